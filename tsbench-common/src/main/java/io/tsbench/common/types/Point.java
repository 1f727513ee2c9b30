package io.tsbench.common.types;

import io.tsbench.common.BenchmarkException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One point in time of one measurement, database agnostic. Keys and values are kept in
 * parallel lists; a point is reusable through {@link #reset()}. A cleared value is null and
 * is skipped by serializers.
 */
public class Point {

    private String measurementName;
    private final List<String> tagKeys = new ArrayList<>();
    private final List<FieldValue> tagValues = new ArrayList<>();
    private final List<String> fieldKeys = new ArrayList<>();
    private final List<FieldValue> fieldValues = new ArrayList<>();
    private Instant timestamp;

    public Point() {
    }

    public Point(Point from) {
        copy(from);
    }

    public void copy(Point from) {
        reset();
        measurementName = from.measurementName;
        tagKeys.addAll(from.tagKeys);
        tagValues.addAll(from.tagValues);
        fieldKeys.addAll(from.fieldKeys);
        fieldValues.addAll(from.fieldValues);
        timestamp = from.timestamp;
    }

    public void reset() {
        measurementName = null;
        tagKeys.clear();
        tagValues.clear();
        fieldKeys.clear();
        fieldValues.clear();
        timestamp = null;
    }

    public Point setMeasurementName(String measurementName) {
        this.measurementName = measurementName;
        return this;
    }

    public String measurementName() {
        return measurementName;
    }

    public Point setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public Point appendTag(String key, FieldValue value) {
        tagKeys.add(key);
        tagValues.add(value);
        return this;
    }

    public Point appendField(String key, FieldValue value) {
        fieldKeys.add(key);
        fieldValues.add(value);
        return this;
    }

    /**
     * Appends tags from parallel key and value lists, which must be the same length.
     */
    public Point appendTags(List<String> keys, List<FieldValue> values) {
        checkInSync("tag", keys, values);
        tagKeys.addAll(keys);
        tagValues.addAll(values);
        return this;
    }

    /**
     * Appends fields from parallel key and value lists, which must be the same length.
     */
    public Point appendFields(List<String> keys, List<FieldValue> values) {
        checkInSync("field", keys, values);
        fieldKeys.addAll(keys);
        fieldValues.addAll(values);
        return this;
    }

    public List<String> tagKeys() {
        return Collections.unmodifiableList(tagKeys);
    }

    public List<FieldValue> tagValues() {
        return Collections.unmodifiableList(tagValues);
    }

    public List<String> fieldKeys() {
        return Collections.unmodifiableList(fieldKeys);
    }

    public List<FieldValue> fieldValues() {
        return Collections.unmodifiableList(fieldValues);
    }

    /**
     * @return the value for {@code key} or null if the point has no such tag
     */
    public FieldValue getTagValue(String key) {
        int i = tagKeys.indexOf(key);
        return i < 0 ? null : tagValues.get(i);
    }

    /**
     * @return the value for {@code key} or null if the point has no such field
     */
    public FieldValue getFieldValue(String key) {
        int i = fieldKeys.indexOf(key);
        return i < 0 ? null : fieldValues.get(i);
    }

    public void clearFieldValue(String key) {
        int i = fieldKeys.indexOf(key);
        if (i >= 0) {
            fieldValues.set(i, null);
        }
    }

    public void clearTagValue(String key) {
        int i = tagKeys.indexOf(key);
        if (i >= 0) {
            tagValues.set(i, null);
        }
    }

    private static void checkInSync(String what, List<String> keys, List<FieldValue> values) {
        if (keys.size() != values.size()) {
            throw BenchmarkException.inconsistent("%s keys and %s values are out of sync: %d keys, %d values",
                    what, what, keys.size(), values.size());
        }
    }

    @Override
    public String toString() {
        return "Point{" + measurementName + ", tags=" + tagKeys + ", fields=" + fieldKeys + ", " + timestamp + "}";
    }
}
