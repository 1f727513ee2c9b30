package io.tsbench.common.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.tsbench.common.util.ConfigUtils;
import org.slf4j.LoggerFactory;

/**
 * Sets up Logback from the {@code logging} block of application.conf, so a run needs no
 * logback.xml next to its HOCON file.
 *
 * <pre>
 * logging {
 *     level = "INFO"
 *     pattern = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n"
 *     loggers {
 *         "io.tsbench.query" = "DEBUG"
 *     }
 * }
 * </pre>
 *
 * Everything is written to stderr: stdout carries the generated queries, points and plans.
 */
public final class LogbackConfigurator {

    static final String LOGGING_PATH = "logging";
    static final String APPENDER_NAME = "CONSOLE";
    static final String DEFAULT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    static final String DEFAULT_LEVEL = "INFO";

    private static volatile boolean configured = false;

    private LogbackConfigurator() {
    }

    /**
     * Applies the classpath configuration. Later calls are ignored.
     */
    public static synchronized void configure() {
        if (!configured) {
            configure(ConfigFactory.load());
            configured = true;
        }
    }

    public static void configure(Config config) {
        var logging = config.hasPath(LOGGING_PATH) ? config.getConfig(LOGGING_PATH) : ConfigFactory.empty();
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(ConfigUtils.getStringOrDefault(logging, "level", DEFAULT_LEVEL)));
        root.addAppender(stderrAppender(context, ConfigUtils.getStringOrDefault(logging, "pattern", DEFAULT_PATTERN)));

        if (logging.hasPath("loggers")) {
            // quoted logger names contain dots, so they cannot be looked up as paths
            logging.getObject("loggers").forEach((name, level) ->
                    context.getLogger(name).setLevel(Level.toLevel(String.valueOf(level.unwrapped()))));
        }
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(LoggerContext context, String pattern) {
        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();

        var appender = new ConsoleAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }

    static void reset() {
        configured = false;
    }
}
