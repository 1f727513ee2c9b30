package io.tsbench.generator.data;

import com.typesafe.config.ConfigFactory;
import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import io.tsbench.generator.GeneratorConfig;
import io.tsbench.generator.serialize.CassandraSerializer;
import io.tsbench.generator.serialize.LineProtocolSerializer;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class DataGeneratorTest {

    private static GeneratorConfig config(String format, String useCase) {
        return new GeneratorConfig(ConfigFactory.parseString("""
                format = %s
                use_case = %s
                scale = 2
                seed = 3
                timestamp_start = "2016-01-01T00:00:00Z"
                timestamp_end = "2016-01-01T00:00:30Z"
                log_interval = 10s
                """.formatted(format, useCase)));
    }

    @Test
    void cassandra() throws Exception {
        var out = new StringWriter();
        long points = new DataGenerator().generate(config("cassandra", "devops"), out);

        assertEquals(6, points);
        assertEquals(60, out.toString().lines().count());
    }

    @Test
    void influx() throws Exception {
        var out = new StringWriter();
        new DataGenerator().generate(config("influx", "cpu-only"), out);
        assertEquals(6, out.toString().lines().count());
    }

    @Test
    void serializers() {
        assertInstanceOf(CassandraSerializer.class, DataGenerator.serializerFor("cassandra"));
        assertInstanceOf(LineProtocolSerializer.class, DataGenerator.serializerFor("influx"));
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE,
                assertThrows(BenchmarkException.class, () -> DataGenerator.serializerFor("csv")).kind());
    }

    @Test
    void iot() {
        var e = assertThrows(BenchmarkException.class,
                () -> new DataGenerator().generate(config("cassandra", "iot"), new StringWriter()));
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE, e.kind());
    }
}
