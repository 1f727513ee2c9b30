package io.tsbench.query.index;

import io.tsbench.common.time.TimeInterval;
import io.tsbench.query.TagSetFilter;

import java.util.Collection;
import java.util.Map;

/**
 * One physical series of the store: a row partition of {@code table} keyed by {@code id},
 * valid over {@code timeInterval}.
 */
public record Series(String table,
                     String id,
                     String measurement,
                     String field,
                     Map<String, String> tags,
                     TimeInterval timeInterval) {

    public Series {
        tags = Map.copyOf(tags);
    }

    public boolean matchesMeasurement(String measurementName) {
        return measurement.equals(measurementName);
    }

    public boolean matchesField(String fieldName) {
        return field.equals(fieldName);
    }

    public boolean matchesAnyField(Collection<String> fieldNames) {
        for (var f : fieldNames) {
            if (matchesField(f)) {
                return true;
            }
        }
        return false;
    }

    public boolean matchesTagSets(TagSetFilter filter) {
        return filter.matches(tags);
    }

    /**
     * Requires a non-empty intersection with {@code other}.
     */
    public boolean matchesTimeInterval(TimeInterval other) {
        return timeInterval.overlaps(other);
    }
}
