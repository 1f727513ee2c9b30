package io.tsbench.generator.serialize;

import io.tsbench.common.time.TimeInterval;
import io.tsbench.common.types.Point;
import io.tsbench.query.index.SeriesIds;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;

/**
 * One {@code <table>\t<seriesId>\t<timestampNanos>\t<value>} line per field. The table is
 * chosen by the value kind and the series id by measurement, tags, field and UTC day, so
 * the first two columns double as a series catalog.
 */
public class CassandraSerializer implements PointSerializer {

    @Override
    public void serialize(Point point, Writer out) throws IOException {
        var tags = new LinkedHashMap<String, String>();
        var tagKeys = point.tagKeys();
        var tagValues = point.tagValues();
        for (int i = 0; i < tagKeys.size(); i++) {
            if (tagValues.get(i) != null) {
                tags.put(tagKeys.get(i), tagValues.get(i).format());
            }
        }
        var day = LocalDate.ofInstant(point.timestamp(), ZoneOffset.UTC);
        long nanos = TimeInterval.toNanos(point.timestamp());

        var fieldKeys = point.fieldKeys();
        var fieldValues = point.fieldValues();
        var lines = new StringBuilder();
        for (int i = 0; i < fieldKeys.size(); i++) {
            var value = fieldValues.get(i);
            if (value == null) {
                continue;
            }
            lines.append(SeriesIds.tableFor(value.kind())).append('\t')
                    .append(SeriesIds.format(point.measurementName(), tags, fieldKeys.get(i), day)).append('\t')
                    .append(nanos).append('\t')
                    .append(value.format()).append('\n');
        }
        out.write(lines.toString());
    }
}
