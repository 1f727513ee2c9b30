package io.tsbench.common.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void tearDown() {
        LogbackConfigurator.reset();
        ConfigFactory.invalidateCaches();
    }

    @Test
    void configuresFromHocon() {
        var config = ConfigFactory.parseString("""
                logging {
                    level = "ERROR"
                    pattern = "%level %msg%n"
                    loggers {
                        "io.tsbench.query" = "DEBUG"
                    }
                }
                """);

        LogbackConfigurator.configure(config);

        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertEquals(Level.ERROR, root.getLevel());
        assertNotNull(root.getAppender("CONSOLE"));
        assertEquals(Level.DEBUG, context.getLogger("io.tsbench.query").getLevel());
    }

    @Test
    void defaults() {
        LogbackConfigurator.configure(ConfigFactory.empty());

        assertEquals(Level.toLevel(LogbackConfigurator.DEFAULT_LEVEL),
                context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void loggersWithoutRootLevel() {
        LogbackConfigurator.configure(ConfigFactory.parseString("""
                logging.loggers { "io.tsbench.generator" = "TRACE" }
                """));

        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertEquals(Level.INFO, root.getLevel());
        assertNotNull(root.getAppender(LogbackConfigurator.APPENDER_NAME));
        assertEquals(Level.TRACE, context.getLogger("io.tsbench.generator").getLevel());
    }

    @Test
    void configureOnce() {
        LogbackConfigurator.configure();
        assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());

        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.TRACE);
        LogbackConfigurator.configure();
        assertEquals(Level.TRACE, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
