package io.tsbench.query.plan;

import io.tsbench.common.time.TimeInterval;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Client-side aggregates of one bucket, by field label in the plan's field order.
 */
public record BucketResult(TimeInterval interval, Map<String, OptionalDouble> values) {

    public OptionalDouble value(String field) {
        return values.getOrDefault(field, OptionalDouble.empty());
    }
}
