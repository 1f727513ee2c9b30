package io.tsbench.generator;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import io.tsbench.generator.cassandra.CassandraDevops;
import io.tsbench.generator.cassandra.CassandraIot;
import io.tsbench.query.HighLevelQuery;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class QueryGeneratorFactoriesTest {

    private static final Instant START = Instant.parse("2016-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2016-01-02T00:00:00Z");

    /** Backend that only knows devops. */
    static class DevopsOnly implements DevopsGeneratorMaker {
        @Override
        public UseCaseGenerator newDevops(Instant start, Instant end, int scale, Random random) {
            return HighLevelQuery::builder;
        }
    }

    @Test
    void capabilities() {
        var factories = QueryGeneratorFactories.builder()
                .register("stub", new DevopsOnly())
                .build();

        assertEquals(EnumSet.of(QueryGeneratorFactories.Capability.DEVOPS), factories.capabilities("stub"));
        assertTrue(factories.supports("stub", "devops"));
        assertTrue(factories.supports("stub", "cpu-only"));
        assertFalse(factories.supports("stub", "iot"));
        assertFalse(factories.supports("missing", "devops"));
    }

    @Test
    void rejectsFactoryWithoutCapability() {
        var builder = QueryGeneratorFactories.builder();
        var e = assertThrows(BenchmarkException.class, () -> builder.register("empty", new GeneratorFactory() {
        }));
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE, e.kind());
    }

    @Test
    void unsupportedPair() {
        var factories = QueryGeneratorFactories.builder().register("stub", new DevopsOnly()).build();

        var e = assertThrows(BenchmarkException.class,
                () -> factories.generatorFor("stub", "iot", START, END, 1, new Random(1)));
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE, e.kind());
        assertTrue(e.getMessage().contains("'iot'"));
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE, assertThrows(BenchmarkException.class,
                () -> factories.generatorFor("influx", "devops", START, END, 1, new Random(1))).kind());
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE, assertThrows(BenchmarkException.class,
                () -> factories.generatorFor("stub", "weather", START, END, 1, new Random(1))).kind());
    }

    @Test
    void defaults() {
        var factories = QueryGeneratorFactories.defaults();

        assertInstanceOf(CassandraDevops.class, factories.generatorFor("cassandra", "devops", START, END, 4, new Random(1)));
        assertInstanceOf(CassandraIot.class, factories.generatorFor("cassandra", "iot", START, END, 4, new Random(1)));
    }

    @Test
    void fillerCapability() {
        var generator = new DevopsOnly().newDevops(START, END, 1, new Random(1));
        var maker = UseCaseRegistry.defaults().fillerMaker("devops", "lastpoint");

        var e = assertThrows(BenchmarkException.class, () -> maker.make(generator));
        assertEquals(ErrorKind.UNSUPPORTED_USE_CASE, e.kind());
        assertTrue(e.getMessage().contains("LastPointFiller"));
    }
}
