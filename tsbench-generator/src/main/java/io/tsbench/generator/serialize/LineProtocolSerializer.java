package io.tsbench.generator.serialize;

import io.tsbench.common.time.TimeInterval;
import io.tsbench.common.types.FieldValue;
import io.tsbench.common.types.Point;

import java.io.IOException;
import java.io.Writer;

/**
 * InfluxDB line protocol:
 * {@code cpu,hostname=host_0,region=eu-west-1 usage_user=58,usage_system=2i 1451606400000000000}.
 *
 * <p>Text tag values are written as tags; tag values of any other kind are written as
 * fields. Null values are skipped, and a point left without fields is not written.
 */
public class LineProtocolSerializer implements PointSerializer {

    @Override
    public void serialize(Point point, Writer out) throws IOException {
        var line = new StringBuilder();
        line.append(escape(point.measurementName(), false));

        var tagKeys = point.tagKeys();
        var tagValues = point.tagValues();
        var fields = new StringBuilder();
        for (int i = 0; i < tagKeys.size(); i++) {
            var value = tagValues.get(i);
            if (value == null) {
                continue;
            }
            if (value.kind() == FieldValue.Kind.TEXT) {
                line.append(',').append(escape(tagKeys.get(i), true)).append('=').append(escape(value.asText(), true));
            } else {
                appendField(fields, tagKeys.get(i), value);
            }
        }

        var fieldKeys = point.fieldKeys();
        var fieldValues = point.fieldValues();
        for (int i = 0; i < fieldKeys.size(); i++) {
            if (fieldValues.get(i) != null) {
                appendField(fields, fieldKeys.get(i), fieldValues.get(i));
            }
        }
        if (fields.length() == 0) {
            return;
        }

        line.append(' ').append(fields).append(' ').append(TimeInterval.toNanos(point.timestamp())).append('\n');
        out.write(line.toString());
    }

    private static void appendField(StringBuilder fields, String key, FieldValue value) {
        if (fields.length() > 0) {
            fields.append(',');
        }
        fields.append(escape(key, true)).append('=').append(fieldValue(value));
    }

    static String fieldValue(FieldValue value) {
        return switch (value.kind()) {
            case INTEGER -> value.asLong() + "i";
            case FLOAT, BOOLEAN -> value.format();
            case TEXT, BYTES -> '"' + value.format().replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        };
    }

    static String escape(String s, boolean escapeEquals) {
        var sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == ',' || c == ' ' || (escapeEquals && c == '=')) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
