package io.tsbench.query.plan;

import io.tsbench.common.BenchmarkException;

/**
 * Dialect of the target store. The planners decide which series and which time bounds to
 * read; the builder decides how that reads as statement text.
 */
public interface StatementBuilder {

    /**
     * @param aggregationLabel aggregate function applied to the value column, or empty for raw rows
     * @param orderBy          order clause for raw rows, or empty; ignored when aggregating
     */
    PhysicalStatement build(String aggregationLabel,
                            String table,
                            String seriesId,
                            String orderBy,
                            long startNanos,
                            long endNanos);

    /**
     * True when {@code orderBy} sorts by time, latest first.
     */
    boolean isDescendingTime(String orderBy);

    /** Order clause that puts the latest row first. */
    String latestFirstOrder();

    /** Literal text that caps a statement's result at one row. */
    String limitOneSuffix();

    /**
     * Second-to-last {@code #}-separated segment of a series id.
     *
     * @throws BenchmarkException INDEX_INCONSISTENCY if the id has no '#'
     */
    static String fieldLabel(String seriesId) {
        var parts = seriesId.split("#", -1);
        if (parts.length < 2) {
            throw BenchmarkException.inconsistent("series id '%s' has no field segment", seriesId);
        }
        return parts[parts.length - 2];
    }
}
