package io.tsbench.common.time;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Half-open span {@code [start, end)}. Equality is by value.
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new BenchmarkException(ErrorKind.INVALID_TIME_SPAN, "time interval bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new BenchmarkException(ErrorKind.INVALID_TIME_SPAN,
                    "bad time interval: start %s is after end %s".formatted(start, end));
        }
    }

    public static TimeInterval of(Instant start, Instant end) {
        return new TimeInterval(start, end);
    }

    public static TimeInterval ofNanos(long startNanos, long endNanos) {
        return new TimeInterval(fromNanos(startNanos), fromNanos(endNanos));
    }

    /**
     * True when the two spans share at least one instant. Touching spans do not overlap.
     */
    public boolean overlaps(TimeInterval other) {
        return other.start.isBefore(end) && start.isBefore(other.end);
    }

    public boolean contains(long nanos) {
        return nanos >= startNanos() && nanos < endNanos();
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    /**
     * This interval cut down to {@code span}; bounds already inside the span are kept as is.
     */
    public TimeInterval clampTo(TimeInterval span) {
        var s = start.isBefore(span.start) ? span.start : start;
        var e = end.isAfter(span.end) ? span.end : end;
        if (s.isAfter(e)) {
            // disjoint from span, collapse to an empty interval at the nearest span edge
            return s.equals(span.start) ? new TimeInterval(span.start, span.start) : new TimeInterval(span.end, span.end);
        }
        return new TimeInterval(s, e);
    }

    public long startNanos() {
        return toNanos(start);
    }

    public long endNanos() {
        return toNanos(end);
    }

    /**
     * @throws BenchmarkException INVALID_TIME_SPAN for instants outside the years 1677 to 2262
     */
    public static long toNanos(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
        } catch (ArithmeticException e) {
            throw new BenchmarkException(ErrorKind.INVALID_TIME_SPAN,
                    "%s is outside the nanosecond timestamp range".formatted(instant), e);
        }
    }

    public static Instant fromNanos(long nanos) {
        return Instant.EPOCH.plus(nanos, ChronoUnit.NANOS);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
