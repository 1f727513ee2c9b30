package io.tsbench.query.time;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;
import io.tsbench.common.time.TimeInterval;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a query span into group-by buckets with rounded boundaries: buckets start at
 * multiples of the duration counted from the Unix epoch, not at the span start, and the
 * first and last ones are clamped to the span.
 */
public final class TimeBuckets {

    /** Upper bound on the buckets of one query. */
    public static final int MAX_BUCKETS = 1_000_000;

    private TimeBuckets() {
    }

    /**
     * Every bucket intersecting {@code span}, in ascending order, whether or not any data
     * falls into it. A zero duration yields the span itself as the only bucket.
     *
     * @throws BenchmarkException MALFORMED_QUERY_SPEC for a negative duration, one so short
     *                            the span would need more than {@link #MAX_BUCKETS}, or one
     *                            too wide for nanosecond arithmetic; INVALID_TIME_SPAN for a
     *                            span outside the nanosecond range
     */
    public static List<Bucket> generate(TimeInterval span, Duration groupBy) {
        if (groupBy.isNegative()) {
            throw BenchmarkException.malformed("negative group by duration %s", groupBy);
        }
        if (groupBy.isZero()) {
            return List.of(new Bucket(span, span));
        }
        long spanStart = span.startNanos();
        long spanEnd = span.endNanos();
        long width;
        long alignedStart;
        long length;
        try {
            width = groupBy.toNanos();
            alignedStart = Math.multiplyExact(Math.floorDiv(spanStart, width), width);
            length = Math.subtractExact(spanEnd, alignedStart);
        } catch (ArithmeticException e) {
            throw new BenchmarkException(ErrorKind.MALFORMED_QUERY_SPEC,
                    "group by %s over %s does not fit in nanoseconds".formatted(groupBy, span), e);
        }
        long count = spanEnd <= spanStart ? 0 : Math.floorDiv(length - 1, width) + 1;
        if (count > MAX_BUCKETS) {
            throw BenchmarkException.malformed("group by %s over %s needs %d buckets, more than %d",
                    groupBy, span, count, MAX_BUCKETS);
        }
        var buckets = new ArrayList<Bucket>((int) count);
        for (long i = 0; i < count; i++) {
            // the last raw end may lie past the nanosecond range, so it is built from instants
            var rawStart = TimeInterval.fromNanos(alignedStart + i * width);
            var raw = new TimeInterval(rawStart, rawStart.plus(groupBy));
            buckets.add(new Bucket(raw, raw.clampTo(span)));
        }
        return buckets;
    }

    /**
     * Same buckets, latest first.
     */
    public static List<Bucket> reversed(List<Bucket> buckets) {
        var copy = new ArrayList<>(buckets);
        Collections.reverse(copy);
        return copy;
    }
}
