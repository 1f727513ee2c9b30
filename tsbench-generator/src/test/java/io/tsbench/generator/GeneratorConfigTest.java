package io.tsbench.generator;

import com.typesafe.config.ConfigFactory;
import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorConfigTest {

    private static GeneratorConfig config(String hocon) {
        return new GeneratorConfig(ConfigFactory.parseString(hocon));
    }

    @Test
    @DisplayName("Missing optional keys take their defaults")
    void defaults() {
        var config = config("""
                use_case = devops
                query_type = lastpoint
                timestamp_start = "2016-01-01T00:00:00Z"
                timestamp_end = "2016-01-02T00:00:00Z"
                """).validate();

        assertEquals("cassandra", config.getFormat());
        assertEquals(1, config.getScale());
        assertEquals(0L, config.getSeed());
        assertEquals(1000L, config.getQueries());
        assertEquals(0, config.getInterleavedGroupId());
        assertEquals(1, config.getInterleavedGroups());
        assertEquals(Duration.ofSeconds(10), config.getLogInterval());
        assertEquals(Instant.parse("2016-01-02T00:00:00Z"), config.getTimeInterval().end());
    }

    @Test
    @DisplayName("Interleaved group id must be below the number of groups")
    void interleaving() {
        var config = config("""
                timestamp_start = "2016-01-01T00:00:00Z"
                timestamp_end = "2016-01-02T00:00:00Z"
                interleaved_group_id = 2
                interleaved_groups = 2
                """);
        assertEquals(ErrorKind.MALFORMED_QUERY_SPEC, assertThrows(BenchmarkException.class, config::validate).kind());
    }

    @Test
    @DisplayName("An inverted dataset span is an invalid time span")
    void invertedSpan() {
        var config = config("""
                timestamp_start = "2016-01-02T00:00:00Z"
                timestamp_end = "2016-01-01T00:00:00Z"
                """);
        assertEquals(ErrorKind.INVALID_TIME_SPAN, assertThrows(BenchmarkException.class, config::validate).kind());
    }

    @Test
    @DisplayName("Scale must be positive")
    void scale() {
        var config = config("""
                scale = 0
                timestamp_start = "2016-01-01T00:00:00Z"
                timestamp_end = "2016-01-02T00:00:00Z"
                """);
        assertThrows(BenchmarkException.class, config::validate);
    }
}
