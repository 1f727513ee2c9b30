package io.tsbench.generator.serialize;

import io.tsbench.common.types.FieldValue;
import io.tsbench.common.types.Point;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LineProtocolSerializerTest {

    private final LineProtocolSerializer serializer = new LineProtocolSerializer();

    private String serialize(Point point) throws Exception {
        var out = new StringWriter();
        serializer.serialize(point, out);
        return out.toString();
    }

    @Test
    void typedValues() throws Exception {
        var point = new Point()
                .setMeasurementName("cpu")
                .setTimestamp(Instant.parse("2016-01-01T00:00:00Z"))
                .appendTag("hostname", FieldValue.ofText("host_0"))
                .appendTag("rack", FieldValue.ofLong(67))
                .appendField("usage_user", FieldValue.ofDouble(58.0))
                .appendField("usage_system", FieldValue.ofDouble(2.5))
                .appendField("procs", FieldValue.ofLong(12))
                .appendField("ok", FieldValue.ofBoolean(true))
                .appendField("note", FieldValue.ofText("say \"hi\""));

        assertEquals("cpu,hostname=host_0 rack=67i,usage_user=58,usage_system=2.5,procs=12i,ok=true,"
                + "note=\"say \\\"hi\\\"\" 1451606400000000000\n", serialize(point));
    }

    @Test
    void escaping() throws Exception {
        var point = new Point()
                .setMeasurementName("my cpu")
                .setTimestamp(Instant.EPOCH)
                .appendTag("region", FieldValue.ofText("us west,1"))
                .appendField("a=b", FieldValue.ofLong(1));

        assertEquals("my\\ cpu,region=us\\ west\\,1 a\\=b=1i 0\n", serialize(point));
    }

    @Test
    void clearedValues() throws Exception {
        var point = new Point()
                .setMeasurementName("cpu")
                .setTimestamp(Instant.EPOCH)
                .appendTag("hostname", FieldValue.ofText("host_0"))
                .appendField("usage_user", FieldValue.ofDouble(1))
                .appendField("usage_idle", FieldValue.ofDouble(2));
        point.clearFieldValue("usage_user");
        assertEquals("cpu,hostname=host_0 usage_idle=2 0\n", serialize(point));

        point.clearFieldValue("usage_idle");
        assertEquals("", serialize(point));
    }
}
