package io.tsbench.query.plan;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    private static OptionalDouble fold(String label, double... values) {
        var aggregator = Aggregator.forLabel(label).get();
        for (var v : values) {
            aggregator.put(v);
        }
        return aggregator.get();
    }

    @Test
    void labels() {
        assertEquals(OptionalDouble.of(9), fold("max", 3, 9, -1));
        assertEquals(OptionalDouble.of(-1), fold("MIN", 3, 9, -1));
        assertEquals(OptionalDouble.of(2), fold("avg", 1, 2, 3));
        assertEquals(OptionalDouble.of(2), fold("mean", 1, 2, 3));
        assertEquals(OptionalDouble.of(6), fold("sum", 1, 2, 3));
        assertEquals(OptionalDouble.of(3), fold("count", 1, 2, 3));
    }

    @Test
    void empty() {
        assertTrue(fold("max").isEmpty());
        assertTrue(fold("avg").isEmpty());
        assertEquals(OptionalDouble.of(0), fold("count"));
    }

    @Test
    void unknown() {
        var e = assertThrows(BenchmarkException.class, () -> Aggregator.forLabel("median"));
        assertEquals(ErrorKind.MALFORMED_QUERY_SPEC, e.kind());
    }
}
