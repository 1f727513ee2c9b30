package io.tsbench.query.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregation pushed into the store: one aggregate statement per (bucket, series), with
 * buckets kept in generation order. The executor combines the per-series aggregates of a
 * bucket with {@code aggregationLabel}.
 */
public record ServerAggregationPlan(String aggregationLabel, List<BucketStatements> buckets) implements QueryPlan {

    public ServerAggregationPlan {
        buckets = List.copyOf(buckets);
    }

    @Override
    public PlanKind kind() {
        return PlanKind.SERVER_AGGREGATION;
    }

    @Override
    public List<PhysicalStatement> statements() {
        var result = new ArrayList<PhysicalStatement>();
        for (var bucket : buckets) {
            result.addAll(bucket.statements());
        }
        return result;
    }
}
