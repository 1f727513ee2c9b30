package io.tsbench.query.plan;

import io.tsbench.common.BenchmarkException;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Client-side fold of raw values into one aggregate.
 */
public interface Aggregator {

    void put(double value);

    /**
     * @return the aggregate, or empty if nothing was put
     */
    OptionalDouble get();

    /**
     * @throws BenchmarkException MALFORMED_QUERY_SPEC for a label with no client-side aggregator
     */
    static Supplier<Aggregator> forLabel(String label) {
        switch (label.toLowerCase(Locale.ROOT)) {
            case "max":
                return () -> new Extremum(true);
            case "min":
                return () -> new Extremum(false);
            case "avg":
            case "mean":
                return () -> new Sum(true);
            case "sum":
                return () -> new Sum(false);
            case "count":
                return Count::new;
            default:
                throw BenchmarkException.malformed("no client side aggregator for '%s'", label);
        }
    }

    final class Extremum implements Aggregator {
        private final boolean max;
        private double current;
        private boolean seen;

        Extremum(boolean max) {
            this.max = max;
        }

        @Override
        public void put(double value) {
            if (!seen || (max ? value > current : value < current)) {
                current = value;
            }
            seen = true;
        }

        @Override
        public OptionalDouble get() {
            return seen ? OptionalDouble.of(current) : OptionalDouble.empty();
        }
    }

    final class Sum implements Aggregator {
        private final boolean average;
        private double sum;
        private long count;

        Sum(boolean average) {
            this.average = average;
        }

        @Override
        public void put(double value) {
            sum += value;
            count++;
        }

        @Override
        public OptionalDouble get() {
            if (count == 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(average ? sum / count : sum);
        }
    }

    final class Count implements Aggregator {
        private long count;

        @Override
        public void put(double value) {
            count++;
        }

        @Override
        public OptionalDouble get() {
            return OptionalDouble.of(count);
        }
    }
}
