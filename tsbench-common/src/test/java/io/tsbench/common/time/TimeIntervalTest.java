package io.tsbench.common.time;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeIntervalTest {

    private static final Instant T0 = Instant.parse("2016-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2016-01-01T01:00:00Z");
    private static final Instant T2 = Instant.parse("2016-01-01T02:00:00Z");

    @Test
    void rejectsInverted() {
        var e = assertThrows(BenchmarkException.class, () -> new TimeInterval(T1, T0));
        assertEquals(ErrorKind.INVALID_TIME_SPAN, e.kind());
        assertEquals(ErrorKind.INVALID_TIME_SPAN,
                assertThrows(BenchmarkException.class, () -> new TimeInterval(null, T0)).kind());
    }

    @Test
    void overlaps() {
        var first = TimeInterval.of(T0, T1);
        assertTrue(first.overlaps(TimeInterval.of(T0.plusSeconds(1), T2)));
        assertFalse(first.overlaps(TimeInterval.of(T1, T2)));
        assertFalse(TimeInterval.of(T1, T2).overlaps(first));
        assertFalse(first.overlaps(TimeInterval.of(T0, T0)));
    }

    @Test
    void contains() {
        var interval = TimeInterval.of(T0, T1);
        assertTrue(interval.contains(interval.startNanos()));
        assertTrue(interval.contains(interval.endNanos() - 1));
        assertFalse(interval.contains(interval.endNanos()));
    }

    @Test
    void clamp() {
        var span = TimeInterval.of(T0.plusSeconds(60), T1);
        assertEquals(span, TimeInterval.of(T0, T2).clampTo(span));
        assertEquals(TimeInterval.of(T0.plusSeconds(60), T0.plusSeconds(120)),
                TimeInterval.of(T0, T0.plusSeconds(120)).clampTo(span));
        assertTrue(TimeInterval.of(T1, T2).clampTo(span).isEmpty());
        assertEquals(TimeInterval.of(span.start(), span.start()), TimeInterval.of(T0, T0.plusSeconds(1)).clampTo(span));
    }

    @Test
    void nanos() {
        var instant = Instant.parse("2016-01-01T00:00:00.000000123Z");
        assertEquals(1451606400000000123L, TimeInterval.toNanos(instant));
        assertEquals(instant, TimeInterval.fromNanos(TimeInterval.toNanos(instant)));
        assertEquals(-1L, TimeInterval.toNanos(Instant.EPOCH.minusNanos(1)));
        assertEquals(TimeInterval.of(Instant.EPOCH, T0), TimeInterval.ofNanos(0, TimeInterval.toNanos(T0)));
    }

    @Test
    void nanosOutOfRange() {
        var e = assertThrows(BenchmarkException.class, () -> TimeInterval.toNanos(Instant.parse("2300-01-01T00:00:00Z")));
        assertEquals(ErrorKind.INVALID_TIME_SPAN, e.kind());
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }
}
