package io.tsbench.generator.cassandra;

import io.tsbench.generator.DevopsGeneratorMaker;
import io.tsbench.generator.IoTGeneratorMaker;
import io.tsbench.generator.UseCaseGenerator;

import java.time.Instant;
import java.util.Random;

/**
 * High-level queries for the Cassandra-style wide-column store, planned client side by
 * {@link io.tsbench.query.QueryPlanner}.
 */
public class CassandraGeneratorFactory implements DevopsGeneratorMaker, IoTGeneratorMaker {

    @Override
    public UseCaseGenerator newDevops(Instant start, Instant end, int scale, Random random) {
        return new CassandraDevops(start, end, scale, random);
    }

    @Override
    public UseCaseGenerator newIoT(Instant start, Instant end, int scale, Random random) {
        return new CassandraIot(start, end, scale, random);
    }
}
