package io.tsbench.runtime;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tsbench.common.BenchmarkException;
import io.tsbench.common.config.LogbackConfigurator;
import io.tsbench.common.util.ConfigUtils;
import io.tsbench.generator.GeneratorConfig;
import io.tsbench.generator.QueryGenerator;
import io.tsbench.generator.QueryGeneratorFactories;
import io.tsbench.generator.UseCaseRegistry;
import io.tsbench.generator.data.DataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.tsbench.common.ConfigConstants.*;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar tsbench-runtime.jar --conf tsbench.mode=generate-queries --conf tsbench.query_type=lastpoint
 * java -jar tsbench-runtime.jar --conf tsbench.mode=plan --conf tsbench.input=queries.jsonl
 * </pre>
 *
 * Any key of the {@code tsbench} block in application.conf can be overridden with {@code --conf}.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final String STANDARD_STREAM = "-";

    public static void main(String[] args) throws Exception {
        LogbackConfigurator.configure();
        var config = ConfigUtils.loadConfig(args);
        start(config);
    }

    public static void start(Config config) throws IOException {
        var mode = config.getString(MODE_KEY);
        log.info("starting in {} mode", mode);
        switch (mode) {
            case MODE_GENERATE_QUERIES:
                try (var out = openOutput(config)) {
                    new QueryGenerator(UseCaseRegistry.defaults(), QueryGeneratorFactories.defaults())
                            .generate(new GeneratorConfig(config), out);
                }
                break;
            case MODE_GENERATE_DATA:
                try (var out = openOutput(config)) {
                    new DataGenerator().generate(new GeneratorConfig(config), out);
                }
                break;
            case MODE_PLAN: {
                var runner = PlanRunner.create(config, new SimpleMeterRegistry());
                try (var in = openInput(config); var out = openOutput(config)) {
                    runner.run(in, out);
                }
                break;
            }
            default:
                throw BenchmarkException.unsupported("unknown mode '%s', expected %s, %s or %s",
                        mode, MODE_GENERATE_QUERIES, MODE_GENERATE_DATA, MODE_PLAN);
        }
    }

    static BufferedReader openInput(Config config) throws IOException {
        var input = ConfigUtils.getStringOrDefault(config, INPUT_KEY, STANDARD_STREAM);
        Reader reader = STANDARD_STREAM.equals(input)
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : Files.newBufferedReader(Path.of(input), StandardCharsets.UTF_8);
        return new BufferedReader(reader);
    }

    static Writer openOutput(Config config) throws IOException {
        var output = ConfigUtils.getStringOrDefault(config, OUTPUT_KEY, STANDARD_STREAM);
        if (STANDARD_STREAM.equals(output)) {
            // stdout stays open after the run
            return new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) {
                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        }
        return Files.newBufferedWriter(Path.of(output), StandardCharsets.UTF_8);
    }
}
