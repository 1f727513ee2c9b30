package io.tsbench.query.index;

import io.tsbench.common.time.TimeInterval;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesCatalogTest {

    private static final TimeInterval TWO_DAYS = new TimeInterval(
            Instant.parse("2016-01-01T00:00:00Z"), Instant.parse("2016-01-03T00:00:00Z"));

    @Test
    void days() {
        assertEquals(List.of(LocalDate.of(2016, 1, 1), LocalDate.of(2016, 1, 2)), SeriesCatalog.days(TWO_DAYS));

        var partial = new TimeInterval(Instant.parse("2016-01-01T12:00:00Z"), Instant.parse("2016-01-02T00:00:01Z"));
        assertEquals(List.of(LocalDate.of(2016, 1, 1), LocalDate.of(2016, 1, 2)), SeriesCatalog.days(partial));
    }

    @Test
    void devops() {
        var catalog = SeriesCatalog.devops(3, TWO_DAYS);

        assertEquals(3 * DevopsSchema.CPU_FIELDS.size() * 2, catalog.size());
        var first = catalog.get(0);
        assertEquals("cpu", first.measurement());
        assertEquals("host_0", first.tags().get("hostname"));
        assertEquals(first, SeriesIds.parse(first.table(), first.id()));
    }

    @Test
    void iot() {
        var catalog = SeriesCatalog.iot(2, TWO_DAYS);
        int perTruckDay = IotSchema.READINGS_FIELDS.size() + IotSchema.DIAGNOSTICS_FIELDS.size() + 1;

        assertEquals(2 * 2 * perTruckDay, catalog.size());
        assertTrue(catalog.stream().anyMatch(s -> s.field().equals("status") && s.table().equals("series_bigint")));
        assertTrue(catalog.stream().allMatch(s -> s.tags().containsKey("fleet")));
    }

    @Test
    void readsLoadFile() throws IOException {
        var text = """
                # table\tseries id\ttimestamp\tvalue
                series_double\tcpu,hostname=host_0#usage_user#2016-01-01\t1451606400000000000\t58
                series_double\tcpu,hostname=host_0#usage_user#2016-01-01\t1451606410000000000\t59

                series_double\tcpu,hostname=host_1#usage_user#2016-01-01
                """;
        var catalog = SeriesCatalog.read(new BufferedReader(new StringReader(text)));

        assertEquals(2, catalog.size());
        assertEquals("host_1", catalog.get(1).tags().get("hostname"));
    }

    @Test
    void readsFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("catalog.tsv");
        Files.writeString(file, "series_bigint\tdiagnostics,name=truck_0#status#2016-01-01\n");

        var catalog = SeriesCatalog.read(file);
        assertEquals(1, catalog.size());
        assertEquals("status", catalog.get(0).field());
    }

    @Test
    void rejectsShortLines() {
        assertThrows(IOException.class,
                () -> SeriesCatalog.read(new BufferedReader(new StringReader("series_double\n"))));
    }
}
