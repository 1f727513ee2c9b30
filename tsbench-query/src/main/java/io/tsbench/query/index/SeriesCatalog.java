package io.tsbench.query.index;

import io.tsbench.common.time.TimeInterval;
import io.tsbench.common.types.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Sources of the series known to a run. Nothing is persisted between runs; the catalog is
 * derived from the use case and scale, or read back from the loader's output.
 */
public interface SeriesCatalog {

    Logger log = LoggerFactory.getLogger(SeriesCatalog.class);

    /**
     * One series per (host, cpu field, day) for {@code scale} hosts.
     */
    static List<Series> devops(int scale, TimeInterval span) {
        var table = SeriesIds.tableFor(FieldValue.Kind.FLOAT);
        var days = days(span);
        var result = new ArrayList<Series>(scale * DevopsSchema.CPU_FIELDS.size() * days.size());
        for (int host = 0; host < scale; host++) {
            var tags = DevopsSchema.hostTags(host);
            for (var field : DevopsSchema.CPU_FIELDS) {
                for (var day : days) {
                    var id = SeriesIds.format(DevopsSchema.CPU, tags, field, day);
                    result.add(new Series(table, id, DevopsSchema.CPU, field, tags, SeriesIds.dayInterval(day)));
                }
            }
        }
        log.debug("devops catalog: {} series for {} hosts over {}", result.size(), scale, span);
        return result;
    }

    /**
     * Readings and diagnostics series for {@code scale} trucks.
     */
    static List<Series> iot(int scale, TimeInterval span) {
        var doubleTable = SeriesIds.tableFor(FieldValue.Kind.FLOAT);
        var bigintTable = SeriesIds.tableFor(FieldValue.Kind.INTEGER);
        var days = days(span);
        var result = new ArrayList<Series>();
        for (int truck = 0; truck < scale; truck++) {
            var tags = IotSchema.truckTags(truck);
            for (var day : days) {
                var interval = SeriesIds.dayInterval(day);
                for (var field : IotSchema.READINGS_FIELDS) {
                    result.add(new Series(doubleTable, SeriesIds.format(IotSchema.READINGS, tags, field, day),
                            IotSchema.READINGS, field, tags, interval));
                }
                for (var field : IotSchema.DIAGNOSTICS_FIELDS) {
                    result.add(new Series(doubleTable, SeriesIds.format(IotSchema.DIAGNOSTICS, tags, field, day),
                            IotSchema.DIAGNOSTICS, field, tags, interval));
                }
                result.add(new Series(bigintTable, SeriesIds.format(IotSchema.DIAGNOSTICS, tags, IotSchema.STATUS, day),
                        IotSchema.DIAGNOSTICS, IotSchema.STATUS, tags, interval));
            }
        }
        log.debug("iot catalog: {} series for {} trucks over {}", result.size(), scale, span);
        return result;
    }

    /**
     * Reads {@code <table>\t<seriesId>[\t...]} lines; blank lines and lines starting with '#'
     * are skipped.
     */
    static List<Series> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    static List<Series> read(BufferedReader reader) throws IOException {
        var result = new ArrayList<Series>();
        var seen = new HashSet<String>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            var columns = line.split("\t", 3);
            if (columns.length < 2) {
                throw new IOException("catalog line without table and series id: " + line);
            }
            // load files repeat a series id once per point
            if (seen.add(columns[0] + "\t" + columns[1])) {
                result.add(SeriesIds.parse(columns[0], columns[1]));
            }
        }
        return result;
    }

    /**
     * UTC days intersecting {@code span}.
     */
    static List<LocalDate> days(TimeInterval span) {
        var days = new ArrayList<LocalDate>();
        var day = LocalDate.ofInstant(span.start(), ZoneOffset.UTC);
        while (SeriesIds.dayInterval(day).start().isBefore(span.end())) {
            days.add(day);
            day = day.plusDays(1);
        }
        return days;
    }
}
