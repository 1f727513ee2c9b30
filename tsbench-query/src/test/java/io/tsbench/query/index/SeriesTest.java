package io.tsbench.query.index;

import io.tsbench.common.time.TimeInterval;
import io.tsbench.query.TagSetFilter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeriesTest {

    private final Series series = new Series("series_double", "cpu,hostname=host_1#usage_user#2015-01-01",
            "cpu", "usage_user", Map.of("hostname", "host_1"),
            new TimeInterval(Instant.parse("2015-01-01T00:00:00Z"), Instant.parse("2015-06-01T00:00:00Z")));

    @Test
    void names() {
        assertTrue(series.matchesMeasurement("cpu"));
        assertFalse(series.matchesMeasurement("CPU"));
        assertTrue(series.matchesField("usage_user"));
        assertFalse(series.matchesField("usage_user "));
        assertTrue(series.matchesAnyField(List.of("usage_system", "usage_user")));
        assertFalse(series.matchesAnyField(List.of("usage_system")));
    }

    @Test
    void time() {
        var year2016 = new TimeInterval(Instant.parse("2016-01-01T00:00:00Z"), Instant.parse("2017-01-01T00:00:00Z"));
        var touching = new TimeInterval(Instant.parse("2015-06-01T00:00:00Z"), Instant.parse("2015-07-01T00:00:00Z"));
        var inside = new TimeInterval(Instant.parse("2015-05-31T23:59:59Z"), Instant.parse("2015-07-01T00:00:00Z"));

        assertFalse(series.matchesTimeInterval(year2016));
        assertFalse(series.matchesTimeInterval(touching));
        assertTrue(series.matchesTimeInterval(inside));
    }

    @Test
    void tags() {
        assertTrue(series.matchesTagSets(TagSetFilter.MATCH_ALL));
        assertTrue(series.matchesTagSets(TagSetFilter.parse(List.of(List.of("hostname=host_1")))));
        assertFalse(series.matchesTagSets(TagSetFilter.parse(List.of(List.of("hostname=host_2")))));
    }
}
