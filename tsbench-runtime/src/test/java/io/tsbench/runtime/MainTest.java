package io.tsbench.runtime;

import com.typesafe.config.ConfigFactory;
import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import io.tsbench.query.QueryCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static String path(Path p) {
        return "\"" + p.toString().replace("\\", "/") + "\"";
    }

    private static String workload(String mode, Path input, Path output) {
        return """
                mode = %s
                format = cassandra
                use_case = devops
                query_type = single-groupby-1-1-1
                scale = 5
                seed = 11
                timestamp_start = "2016-01-01T00:00:00Z"
                timestamp_end = "2016-01-01T06:00:00Z"
                log_interval = 1h
                queries = 20
                input = %s
                output = %s
                """.formatted(mode, path(input), path(output));
    }

    @Test
    @DisplayName("Generated queries plan against a catalog read from generated data")
    void endToEnd(@TempDir Path dir) throws Exception {
        var data = dir.resolve("data.tsv");
        var queries = dir.resolve("queries.jsonl");
        var plans = dir.resolve("plans.jsonl");

        Main.start(ConfigFactory.parseString(workload("generate-data", dir.resolve("unused"), data)));
        Main.start(ConfigFactory.parseString(workload("generate-queries", dir.resolve("unused"), queries)));
        Main.start(ConfigFactory.parseString(workload("plan", queries, plans) + "catalog = " + path(data)));

        // 6 hours, 5 hosts, 10 cpu fields
        assertEquals(300, Files.readAllLines(data).size());
        assertEquals(20, Files.readAllLines(queries).size());
        var lines = Files.readAllLines(plans);
        assertEquals(20, lines.size());
        for (var line : lines) {
            var record = QueryCodec.mapper().readTree(line);
            assertEquals("SERVER_AGGREGATION", record.get("kind").asText());
            // one hour of minute buckets, plus a partial one when the window is not minute aligned
            int buckets = record.get("plan").get("buckets").size();
            assertTrue(buckets == 60 || buckets == 61, "buckets: " + buckets);
            assertEquals(buckets, record.get("statementCount").asInt());
        }
    }

    @Test
    @DisplayName("Unknown modes are rejected")
    void unknownMode(@TempDir Path dir) {
        var config = ConfigFactory.parseString(workload("serve", dir.resolve("in"), dir.resolve("out")));
        var e = assertThrows(BenchmarkException.class, () -> Main.start(config));
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE, e.kind());
    }
}
