package io.tsbench.query.plan;

import io.tsbench.common.time.TimeInterval;
import io.tsbench.query.time.Bucket;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Raw rows of every matching series over the whole span, aggregated by the client into
 * {@code buckets}. Buckets are latest first when the query orders by time descending, so an
 * executor honouring {@code limit} can stop early.
 */
public record ClientAggregationPlan(String aggregationLabel,
                                    Duration groupByDuration,
                                    List<String> fields,
                                    List<Bucket> buckets,
                                    int limit,
                                    List<PhysicalStatement> statements) implements QueryPlan {

    public ClientAggregationPlan {
        fields = List.copyOf(fields);
        buckets = List.copyOf(buckets);
        statements = List.copyOf(statements);
    }

    @Override
    public PlanKind kind() {
        return PlanKind.CLIENT_AGGREGATION;
    }

    /**
     * Buckets the executor has to report: all of them, or the first {@code limit}.
     */
    public List<Bucket> reportedBuckets() {
        return limit > 0 && buckets.size() > limit ? buckets.subList(0, limit) : buckets;
    }

    /**
     * Folds raw rows into the reported buckets. Rows outside every reported bucket are
     * dropped; buckets without rows stay in the result with empty values.
     *
     * @param rowsPerStatement rows of each statement, parallel to {@link #statements()}
     */
    public List<BucketResult> aggregate(List<List<Row>> rowsPerStatement) {
        if (rowsPerStatement.size() != statements.size()) {
            throw new IllegalArgumentException("expected rows for " + statements.size()
                    + " statements, got " + rowsPerStatement.size());
        }
        Supplier<Aggregator> factory = Aggregator.forLabel(aggregationLabel);
        var reported = reportedBuckets();
        var aggregators = new ArrayList<Map<String, Aggregator>>(reported.size());
        var bucketByStart = new HashMap<Long, Integer>();
        long firstStart = Long.MAX_VALUE;
        for (int i = 0; i < reported.size(); i++) {
            var perField = new HashMap<String, Aggregator>();
            for (var field : fields) {
                perField.put(field, factory.get());
            }
            aggregators.add(perField);
            long start = reported.get(i).raw().startNanos();
            bucketByStart.put(start, i);
            firstStart = Math.min(firstStart, start);
        }

        for (int s = 0; s < statements.size(); s++) {
            var field = statements.get(s).field();
            for (var row : rowsPerStatement.get(s)) {
                int i = bucketIndex(row.timestampNanos(), firstStart, reported, bucketByStart);
                if (i < 0) {
                    continue;
                }
                aggregators.get(i).computeIfAbsent(field, f -> factory.get()).put(row.value());
            }
        }

        var results = new ArrayList<BucketResult>(reported.size());
        for (int i = 0; i < reported.size(); i++) {
            var values = new LinkedHashMap<String, OptionalDouble>();
            for (var field : fields) {
                values.put(field, aggregators.get(i).get(field).get());
            }
            aggregators.get(i).forEach((field, aggregator) -> values.putIfAbsent(field, aggregator.get()));
            results.add(new BucketResult(reported.get(i).effective(), Collections.unmodifiableMap(values)));
        }
        return results;
    }

    private int bucketIndex(long nanos, long firstStart, List<Bucket> reported, Map<Long, Integer> bucketByStart) {
        Integer i;
        if (groupByDuration.isZero()) {
            i = reported.isEmpty() ? null : 0;
        } else if (nanos < firstStart) {
            // before every bucket; rounding down here could leave the long range
            i = null;
        } else {
            long width = groupByDuration.toNanos();
            i = bucketByStart.get(Math.floorDiv(nanos, width) * width);
        }
        if (i == null) {
            return -1;
        }
        TimeInterval effective = reported.get(i).effective();
        return effective.contains(nanos) ? i : -1;
    }
}
