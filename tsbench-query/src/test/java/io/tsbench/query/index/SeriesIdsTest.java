package io.tsbench.query.index;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import io.tsbench.common.time.TimeInterval;
import io.tsbench.common.types.FieldValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeriesIdsTest {

    @Test
    void format() {
        var tags = new LinkedHashMap<String, String>();
        tags.put("hostname", "host_0");
        tags.put("region", "eu-west-1");
        assertEquals("cpu,hostname=host_0,region=eu-west-1#usage_user#2016-01-01",
                SeriesIds.format("cpu", tags, "usage_user", LocalDate.of(2016, 1, 1)));
    }

    @Test
    void parse() {
        var series = SeriesIds.parse("series_double", "cpu,hostname=host_0,region=eu-west-1#usage_user#2016-01-01");

        assertEquals("series_double", series.table());
        assertEquals("cpu", series.measurement());
        assertEquals("usage_user", series.field());
        assertEquals(Map.of("hostname", "host_0", "region", "eu-west-1"), series.tags());
        assertEquals(new TimeInterval(Instant.parse("2016-01-01T00:00:00Z"), Instant.parse("2016-01-02T00:00:00Z")),
                series.timeInterval());
    }

    @Test
    void rejectsMalformedIds() {
        for (var id : new String[]{"cpu#usage_user", "cpu,hostname#usage_user#2016-01-01",
                "cpu#usage_user#yesterday", "#usage_user#2016-01-01"}) {
            var e = assertThrows(BenchmarkException.class, () -> SeriesIds.parse("series_double", id), id);
            assertEquals(ErrorKind.INDEX_INCONSISTENCY, e.kind());
        }
    }

    @Test
    void tables() {
        assertEquals("series_double", SeriesIds.tableFor(FieldValue.Kind.FLOAT));
        assertEquals("series_bigint", SeriesIds.tableFor(FieldValue.Kind.INTEGER));
        assertEquals("series_boolean", SeriesIds.tableFor(FieldValue.Kind.BOOLEAN));
        assertEquals("series_blob", SeriesIds.tableFor(FieldValue.Kind.TEXT));
    }
}
