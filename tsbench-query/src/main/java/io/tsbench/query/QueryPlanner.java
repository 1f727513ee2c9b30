package io.tsbench.query;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.time.TimeInterval;
import io.tsbench.query.index.ClientSideIndex;
import io.tsbench.query.index.Series;
import io.tsbench.query.plan.BucketStatements;
import io.tsbench.query.plan.ClientAggregationPlan;
import io.tsbench.query.plan.ForEveryPlan;
import io.tsbench.query.plan.NoAggregationPlan;
import io.tsbench.query.plan.PhysicalStatement;
import io.tsbench.query.plan.QueryPlan;
import io.tsbench.query.plan.ServerAggregationPlan;
import io.tsbench.query.plan.StatementBuilder;
import io.tsbench.query.time.TimeBuckets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a {@link HighLevelQuery} into a {@link QueryPlan} using the client-side index.
 *
 * <p>Planning is a pure function of the query, the index and the statement builder. An
 * instance holds no mutable state and can be shared across threads.
 */
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    public enum AggregationMode {
        SERVER,
        CLIENT;

        public static AggregationMode of(String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw BenchmarkException.malformed("unknown aggregation plan '%s', expected server or client", name);
            }
        }
    }

    private final ClientSideIndex index;
    private final StatementBuilder statementBuilder;
    private final AggregationMode aggregationMode;

    public QueryPlanner(ClientSideIndex index, StatementBuilder statementBuilder) {
        this(index, statementBuilder, AggregationMode.SERVER);
    }

    public QueryPlanner(ClientSideIndex index, StatementBuilder statementBuilder, AggregationMode aggregationMode) {
        this.index = index;
        this.statementBuilder = statementBuilder;
        this.aggregationMode = aggregationMode;
    }

    /**
     * Picks the plan shape for the query: for-every when a sampling spec is set, no
     * aggregation when neither grouping nor an aggregate is asked for, otherwise server or
     * client aggregation by configuration. Multi-field queries always aggregate on the client.
     */
    public QueryPlan plan(HighLevelQuery query) {
        if (!query.forEveryN().isEmpty()) {
            return planForEvery(query);
        }
        if (query.groupByDuration().isZero() && query.aggregationType().isEmpty()) {
            return planNoAggregation(query);
        }
        if (aggregationMode == AggregationMode.SERVER && query.fields().size() == 1) {
            return planWithServerAggregation(query);
        }
        return planWithoutServerAggregation(query);
    }

    /**
     * One aggregate statement per matching series and bucket. Buckets without series are kept.
     * Membership is decided on the raw bucket, the statement bounds on the clamped one.
     */
    public ServerAggregationPlan planWithServerAggregation(HighLevelQuery query) {
        var span = query.timeInterval();
        var measurement = requireMeasurement(query);
        var field = requireSingleField(query);
        var tagSets = query.tagSetFilter();

        // Populated even if they end up empty, so empty time buckets still get a result.
        var buckets = TimeBuckets.generate(span, query.groupByDuration());
        var seriesPerBucket = new ArrayList<List<Series>>(buckets.size());
        for (int i = 0; i < buckets.size(); i++) {
            seriesPerBucket.add(new ArrayList<>());
        }

        for (var series : index.seriesFor(measurement, field)) {
            if (!series.matchesMeasurement(measurement)
                    || !series.matchesField(field)
                    || !series.matchesTagSets(tagSets)) {
                continue;
            }
            for (int i = 0; i < buckets.size(); i++) {
                if (series.matchesTimeInterval(buckets.get(i).raw())) {
                    seriesPerBucket.get(i).add(series);
                }
            }
        }

        var result = new ArrayList<BucketStatements>(buckets.size());
        for (int i = 0; i < buckets.size(); i++) {
            var effective = buckets.get(i).effective();
            var statements = new ArrayList<PhysicalStatement>(seriesPerBucket.get(i).size());
            for (var series : seriesPerBucket.get(i)) {
                statements.add(statementBuilder.build(query.aggregationType(), series.table(), series.id(),
                        query.orderBy(), effective.startNanos(), effective.endNanos()));
            }
            result.add(new BucketStatements(buckets.get(i), statements));
        }
        var plan = new ServerAggregationPlan(query.aggregationType(), result);
        log.debug("query {} planned with server aggregation: {} buckets, {} statements",
                query.id(), result.size(), plan.statementCount());
        return plan;
    }

    /**
     * One raw statement per matching series over the whole span; the caller aggregates the
     * rows into buckets. Buckets are emitted latest first for a descending time order.
     */
    public ClientAggregationPlan planWithoutServerAggregation(HighLevelQuery query) {
        var span = query.timeInterval();
        var measurement = requireMeasurement(query);
        var fields = requireFields(query);
        var tagSets = query.tagSetFilter();

        var buckets = TimeBuckets.generate(span, query.groupByDuration());
        if (statementBuilder.isDescendingTime(query.orderBy())) {
            buckets = TimeBuckets.reversed(buckets);
        }

        var statements = new ArrayList<PhysicalStatement>();
        for (var series : index.seriesFor(measurement, fields)) {
            if (!series.matchesMeasurement(measurement)
                    || !series.matchesAnyField(fields)
                    || !series.matchesTagSets(tagSets)
                    || !series.matchesTimeInterval(span)) {
                continue;
            }
            statements.add(rawStatement(series, query.orderBy(), span));
        }
        var plan = new ClientAggregationPlan(query.aggregationType(), query.groupByDuration(), fields, buckets,
                query.limit(), statements);
        log.debug("query {} planned without server aggregation: {} buckets, {} statements",
                query.id(), buckets.size(), statements.size());
        return plan;
    }

    /**
     * One raw statement per series matching the tag sets and the span. The where clause is
     * carried through for the caller.
     */
    public NoAggregationPlan planNoAggregation(HighLevelQuery query) {
        var span = query.timeInterval();
        requireMeasurement(query);
        var fields = requireFields(query);
        var statements = new ArrayList<PhysicalStatement>();
        for (var series : matchingSeries(query, fields, span)) {
            statements.add(rawStatement(series, query.orderBy(), span));
        }
        log.debug("query {} planned without aggregation: {} statements", query.id(), statements.size());
        return new NoAggregationPlan(fields, query.whereClause(), statements);
    }

    /**
     * Latest point of each series matching the tag sets and the span.
     */
    public ForEveryPlan planForEvery(HighLevelQuery query) {
        var forEvery = ForEverySpec.parse(query.forEveryN());
        var span = query.timeInterval();
        requireMeasurement(query);
        var fields = requireFields(query);
        var statements = new ArrayList<PhysicalStatement>();
        for (var series : matchingSeries(query, fields, span)) {
            var statement = statementBuilder.build("", series.table(), series.id(),
                    statementBuilder.latestFirstOrder(), span.startNanos(), span.endNanos());
            statements.add(statement.withSuffix(statementBuilder.limitOneSuffix()));
        }
        log.debug("query {} planned for every {}: {} statements", query.id(), forEvery, statements.size());
        return new ForEveryPlan(fields, forEvery.tagName(), forEvery.n(), statements);
    }

    private List<Series> matchingSeries(HighLevelQuery query, List<String> fields, TimeInterval span) {
        var tagSets = query.tagSetFilter();
        var result = new ArrayList<Series>();
        for (var series : index.seriesFor(query.measurementName(), fields)) {
            if (!tagSets.isEmpty() && !series.matchesTagSets(tagSets)) {
                continue;
            }
            if (!series.matchesTimeInterval(span)) {
                continue;
            }
            result.add(series);
        }
        return result;
    }

    private PhysicalStatement rawStatement(Series series, String orderBy, TimeInterval span) {
        return statementBuilder.build("", series.table(), series.id(), orderBy, span.startNanos(), span.endNanos());
    }

    private static String requireMeasurement(HighLevelQuery query) {
        if (query.measurementName().isEmpty()) {
            throw BenchmarkException.malformed("query %d has no measurement", query.id());
        }
        return query.measurementName();
    }

    private static List<String> requireFields(HighLevelQuery query) {
        var fields = query.fields();
        if (fields.isEmpty() || fields.stream().anyMatch(String::isEmpty)) {
            throw BenchmarkException.malformed("query %d has an empty field in '%s'", query.id(), query.fieldName());
        }
        return fields;
    }

    private static String requireSingleField(HighLevelQuery query) {
        var fields = requireFields(query);
        if (fields.size() != 1) {
            throw BenchmarkException.malformed("server side aggregation takes one field, query %d has '%s'",
                    query.id(), query.fieldName());
        }
        return fields.get(0);
    }
}
