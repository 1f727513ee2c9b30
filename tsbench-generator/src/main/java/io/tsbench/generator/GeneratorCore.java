package io.tsbench.generator;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.time.TimeInterval;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Dataset span, scale and seeded randomness behind every use-case generator.
 */
public class GeneratorCore {

    private final TimeInterval interval;
    private final int scale;
    protected final Random random;

    public GeneratorCore(Instant start, Instant end, int scale, Random random) {
        this.interval = new TimeInterval(start, end);
        if (scale < 1) {
            throw BenchmarkException.malformed("scale must be positive, got %d", scale);
        }
        this.scale = scale;
        this.random = random;
    }

    public TimeInterval interval() {
        return interval;
    }

    public int scale() {
        return scale;
    }

    /**
     * Window of length {@code window} starting at a random instant inside the dataset span.
     *
     * @throws BenchmarkException MALFORMED_QUERY_SPEC if the window does not fit
     */
    public TimeInterval randomWindow(Duration window) {
        long room = interval.endNanos() - interval.startNanos() - window.toNanos();
        if (room < 0) {
            throw BenchmarkException.malformed("random window %s is larger than the dataset span %s", window, interval);
        }
        long start = interval.startNanos() + (room == 0 ? 0 : random.nextLong(room + 1));
        return TimeInterval.ofNanos(start, start + window.toNanos());
    }

    /**
     * {@code count} distinct values of {@code [0, total)} in random order (partial Fisher-Yates).
     */
    protected int[] randomSubset(int count, int total) {
        int[] values = IntStream.range(0, total).toArray();
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(total - i);
            int swap = values[i];
            values[i] = values[j];
            values[j] = swap;
        }
        int[] subset = new int[count];
        System.arraycopy(values, 0, subset, 0, count);
        return subset;
    }
}
