package io.tsbench.query;

import io.tsbench.common.time.TimeInterval;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Database agnostic description of one benchmark query, as produced by the query generator
 * and consumed by {@link QueryPlanner}. Times are UTC instants.
 *
 * @param fieldName       one field, or several separated by commas
 * @param aggregationType aggregate function label, empty for none
 * @param groupByDuration bucket width; zero means no grouping
 * @param tagSets         clauses of {@code key=value} tokens, see {@link TagSetFilter}
 * @param orderBy         order clause in the store's dialect, empty for none
 * @param limit           number of buckets to report, zero or less for all
 * @param forEveryN       {@code tagName,N} for sampling queries, empty otherwise
 * @param whereClause     predicate the planner passes through to the executor
 */
public record HighLevelQuery(long id,
                             String humanLabel,
                             String humanDescription,
                             String measurementName,
                             String fieldName,
                             String aggregationType,
                             Instant timeStart,
                             Instant timeEnd,
                             Duration groupByDuration,
                             List<List<String>> tagSets,
                             String orderBy,
                             int limit,
                             String forEveryN,
                             String whereClause) {

    public HighLevelQuery {
        humanLabel = orEmpty(humanLabel);
        humanDescription = orEmpty(humanDescription);
        measurementName = orEmpty(measurementName);
        fieldName = orEmpty(fieldName);
        aggregationType = orEmpty(aggregationType);
        groupByDuration = groupByDuration == null ? Duration.ZERO : groupByDuration;
        tagSets = tagSets == null ? List.of() : tagSets.stream().map(List::copyOf).toList();
        orderBy = orEmpty(orderBy);
        forEveryN = orEmpty(forEveryN);
        whereClause = orEmpty(whereClause);
    }

    /**
     * @throws io.tsbench.common.BenchmarkException INVALID_TIME_SPAN if start is after end or either is missing
     */
    public TimeInterval timeInterval() {
        return new TimeInterval(timeStart, timeEnd);
    }

    /**
     * Requested fields, split on ','. Empty segments are kept so that callers can reject them.
     */
    public List<String> fields() {
        if (fieldName.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(fieldName.split(",", -1));
    }

    public TagSetFilter tagSetFilter() {
        return TagSetFilter.parse(tagSets);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .humanLabel(humanLabel)
                .humanDescription(humanDescription)
                .measurementName(measurementName)
                .fieldName(fieldName)
                .aggregationType(aggregationType)
                .timeStart(timeStart)
                .timeEnd(timeEnd)
                .groupByDuration(groupByDuration)
                .tagSets(tagSets)
                .orderBy(orderBy)
                .limit(limit)
                .forEveryN(forEveryN)
                .whereClause(whereClause);
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    public static class Builder {
        private long id;
        private String humanLabel;
        private String humanDescription;
        private String measurementName;
        private String fieldName;
        private String aggregationType;
        private Instant timeStart;
        private Instant timeEnd;
        private Duration groupByDuration;
        private List<List<String>> tagSets = new ArrayList<>();
        private String orderBy;
        private int limit;
        private String forEveryN;
        private String whereClause;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder humanLabel(String humanLabel) {
            this.humanLabel = humanLabel;
            return this;
        }

        public Builder humanDescription(String humanDescription) {
            this.humanDescription = humanDescription;
            return this;
        }

        public Builder measurementName(String measurementName) {
            this.measurementName = measurementName;
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder fields(List<String> fields) {
            this.fieldName = String.join(",", fields);
            return this;
        }

        public Builder aggregationType(String aggregationType) {
            this.aggregationType = aggregationType;
            return this;
        }

        public Builder timeStart(Instant timeStart) {
            this.timeStart = timeStart;
            return this;
        }

        public Builder timeEnd(Instant timeEnd) {
            this.timeEnd = timeEnd;
            return this;
        }

        public Builder timeInterval(TimeInterval interval) {
            this.timeStart = interval.start();
            this.timeEnd = interval.end();
            return this;
        }

        public Builder groupByDuration(Duration groupByDuration) {
            this.groupByDuration = groupByDuration;
            return this;
        }

        public Builder tagSets(List<List<String>> tagSets) {
            this.tagSets = new ArrayList<>(tagSets);
            return this;
        }

        /**
         * Adds one conjunctive clause.
         */
        public Builder tagSet(String... tags) {
            this.tagSets.add(List.of(tags));
            return this;
        }

        public Builder orderBy(String orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder forEveryN(String forEveryN) {
            this.forEveryN = forEveryN;
            return this;
        }

        public Builder whereClause(String whereClause) {
            this.whereClause = whereClause;
            return this;
        }

        public HighLevelQuery build() {
            return new HighLevelQuery(id, humanLabel, humanDescription, measurementName, fieldName, aggregationType,
                    timeStart, timeEnd, groupByDuration, tagSets, orderBy, limit, forEveryN, whereClause);
        }
    }
}
