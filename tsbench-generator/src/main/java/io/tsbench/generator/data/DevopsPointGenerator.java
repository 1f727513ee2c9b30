package io.tsbench.generator.data;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.time.TimeInterval;
import io.tsbench.common.types.FieldValue;
import io.tsbench.common.types.Point;
import io.tsbench.query.index.DevopsSchema;

import java.time.Duration;
import java.util.Random;

/**
 * Cpu points for {@code scale} hosts, one point per host every log interval. Each field is a
 * random walk clamped to [0, 100]. The same seed gives the same points.
 */
public class DevopsPointGenerator {

    static final double MIN = 0.0;
    static final double MAX = 100.0;

    private final int scale;
    private final TimeInterval span;
    private final long stepNanos;
    private final Random random;
    private final double[][] state;

    private long currentNanos;
    private int currentHost;

    public DevopsPointGenerator(int scale, TimeInterval span, Duration logInterval, long seed) {
        if (scale < 1) {
            throw BenchmarkException.malformed("scale must be positive, got %d", scale);
        }
        if (logInterval.isZero() || logInterval.isNegative()) {
            throw BenchmarkException.malformed("log interval must be positive, got %s", logInterval);
        }
        this.scale = scale;
        this.span = span;
        this.stepNanos = logInterval.toNanos();
        this.random = new Random(seed);
        this.state = new double[scale][DevopsSchema.CPU_FIELDS.size()];
        for (var host : state) {
            for (int f = 0; f < host.length; f++) {
                host[f] = random.nextDouble() * MAX;
            }
        }
        this.currentNanos = span.startNanos();
    }

    /**
     * Fills {@code point} with the next point.
     *
     * @return false once the span is exhausted, leaving {@code point} untouched
     */
    public boolean next(Point point) {
        if (currentNanos >= span.endNanos()) {
            return false;
        }
        point.reset();
        point.setMeasurementName(DevopsSchema.CPU)
                .setTimestamp(TimeInterval.fromNanos(currentNanos));
        DevopsSchema.hostTags(currentHost).forEach((k, v) -> point.appendTag(k, FieldValue.ofText(v)));
        var values = state[currentHost];
        for (int f = 0; f < values.length; f++) {
            values[f] = Math.max(MIN, Math.min(MAX, values[f] + random.nextGaussian()));
            point.appendField(DevopsSchema.CPU_FIELDS.get(f), FieldValue.ofDouble(values[f]));
        }

        currentHost++;
        if (currentHost == scale) {
            currentHost = 0;
            currentNanos += stepNanos;
        }
        return true;
    }

    /**
     * Number of points over the whole span.
     */
    public long count() {
        long steps = Math.max(0, (span.endNanos() - span.startNanos() + stepNanos - 1) / stepNanos);
        return steps * scale;
    }
}
