package io.tsbench.query.plan;

/**
 * A raw (time, value) row as returned by a statement without aggregation.
 */
public record Row(long timestampNanos, double value) {
}
