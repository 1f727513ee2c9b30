package io.tsbench.common.util;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ConfigConstants;
import io.tsbench.common.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public class ConfigUtils {

    public record ConfigWithMainParameters(Config config, List<String> mainParameters) {
    }

    /**
     * Each {@code --conf} value is one HOCON line, e.g. {@code --conf tsbench.scale=100}. Other
     * arguments are returned as main parameters.
     */
    public static ConfigWithMainParameters loadCommandLineConfig(String[] args) {
        var argv = new Args();
        JCommander.newBuilder().addObject(argv).build().parse(args);
        var overrides = ConfigFactory.parseString(String.join("\n", argv.configs));
        return new ConfigWithMainParameters(overrides, List.copyOf(argv.mainParameters));
    }

    /**
     * Command line overrides on top of the classpath configuration, scoped to {@link ConfigConstants#CONFIG_PATH}.
     */
    public static Config loadConfig(String[] args) {
        var commandLineConfig = loadCommandLineConfig(args).config();
        return commandLineConfig.withFallback(ConfigFactory.load()).resolve().getConfig(ConfigConstants.CONFIG_PATH);
    }

    public static Instant getInstant(Config config, String key) {
        var text = config.getString(key);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new BenchmarkException(ErrorKind.MALFORMED_QUERY_SPEC,
                    "cannot parse time from string '%s' for key %s".formatted(text, key), e);
        }
    }

    public static Duration getDuration(Config config, String key) {
        return config.getDuration(key);
    }

    public static String getStringOrDefault(Config config, String key, String defaultValue) {
        return config.hasPath(key) ? config.getString(key) : defaultValue;
    }

    static class Args {
        @Parameter(names = "--conf", description = "HOCON override, repeatable")
        private List<String> configs = new ArrayList<>();

        @Parameter(description = "main parameters")
        private List<String> mainParameters = new ArrayList<>();
    }
}
