package io.tsbench.query.index;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import io.tsbench.common.time.TimeInterval;
import io.tsbench.common.types.FieldValue;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Series ids as written by the loader: {@code <measurement>,<k>=<v>,...#<field>#<yyyy-MM-dd>}.
 * Each id holds one UTC day of one field.
 */
public final class SeriesIds {

    public static final String SEPARATOR = "#";

    private SeriesIds() {
    }

    public static String format(String measurement, Map<String, String> tags, String field, LocalDate day) {
        var sb = new StringBuilder(measurement);
        tags.forEach((k, v) -> sb.append(',').append(k).append('=').append(v));
        return sb.append(SEPARATOR).append(field).append(SEPARATOR).append(day).toString();
    }

    public static String tableFor(FieldValue.Kind kind) {
        return switch (kind) {
            case INTEGER -> "series_bigint";
            case FLOAT -> "series_double";
            case BOOLEAN -> "series_boolean";
            case TEXT, BYTES -> "series_blob";
        };
    }

    public static TimeInterval dayInterval(LocalDate day) {
        var start = day.atStartOfDay().toInstant(ZoneOffset.UTC);
        return new TimeInterval(start, day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC));
    }

    /**
     * @throws BenchmarkException INDEX_INCONSISTENCY if {@code id} does not have the loader's shape
     */
    public static Series parse(String table, String id) {
        var parts = id.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw BenchmarkException.inconsistent("series id '%s' does not have 3 '%s' separated parts", id, SEPARATOR);
        }
        var head = parts[0].split(",", -1);
        if (head[0].isEmpty() || parts[1].isEmpty()) {
            throw BenchmarkException.inconsistent("series id '%s' has an empty measurement or field", id);
        }
        var tags = new LinkedHashMap<String, String>();
        for (int i = 1; i < head.length; i++) {
            int eq = head[i].indexOf('=');
            if (eq <= 0) {
                throw BenchmarkException.inconsistent("series id '%s' has malformed tag '%s'", id, head[i]);
            }
            tags.put(head[i].substring(0, eq), head[i].substring(eq + 1));
        }
        LocalDate day;
        try {
            day = LocalDate.parse(parts[2]);
        } catch (DateTimeParseException e) {
            throw new BenchmarkException(ErrorKind.INDEX_INCONSISTENCY,
                    "series id '%s' has malformed day '%s'".formatted(id, parts[2]), e);
        }
        return new Series(table, id, head[0], parts[1], tags, dayInterval(day));
    }
}
