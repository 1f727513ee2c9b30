package io.tsbench.generator.data;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.types.Point;
import io.tsbench.generator.GeneratorConfig;
import io.tsbench.generator.serialize.CassandraSerializer;
import io.tsbench.generator.serialize.LineProtocolSerializer;
import io.tsbench.generator.serialize.PointSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;

import static io.tsbench.common.ConfigConstants.*;

/**
 * Writes the devops dataset in a target's bulk-load format.
 */
public class DataGenerator {

    private static final Logger log = LoggerFactory.getLogger(DataGenerator.class);

    /**
     * @throws BenchmarkException UNSUPPORTED_USE_CASE for a format without a serializer
     */
    public static PointSerializer serializerFor(String format) {
        switch (format) {
            case FORMAT_CASSANDRA:
                return new CassandraSerializer();
            case FORMAT_INFLUX:
                return new LineProtocolSerializer();
            default:
                throw BenchmarkException.unsupported("no serializer for format '%s'", format);
        }
    }

    /**
     * @return number of points written
     */
    public long generate(GeneratorConfig config, Writer out) throws IOException {
        config.validate();
        var useCase = config.getUseCase();
        if (!USE_CASE_DEVOPS.equals(useCase) && !USE_CASE_CPU_ONLY.equals(useCase)) {
            throw BenchmarkException.unsupported("data generation is not implemented for use case '%s'", useCase);
        }
        var serializer = serializerFor(config.getFormat());
        var generator = new DevopsPointGenerator(config.getScale(), config.getTimeInterval(),
                config.getLogInterval(), config.getSeed());
        log.info("generating {} {} points for {} hosts", generator.count(), config.getFormat(), config.getScale());

        var point = new Point();
        long written = 0;
        while (generator.next(point)) {
            serializer.serialize(point, out);
            written++;
        }
        out.flush();
        log.info("wrote {} points", written);
        return written;
    }
}
