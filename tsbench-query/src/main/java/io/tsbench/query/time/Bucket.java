package io.tsbench.query.time;

import io.tsbench.common.time.TimeInterval;

/**
 * One group-by window. {@code raw} is aligned to the group-by duration; {@code effective}
 * is the part of it inside the query span and is what statements are bounded by.
 */
public record Bucket(TimeInterval raw, TimeInterval effective) {
}
