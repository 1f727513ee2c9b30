package io.tsbench.query.plan;

import java.util.List;

/**
 * Raw rows of every matching series over the whole span. {@code whereClause} is a predicate
 * the planner does not interpret; the executor applies it to the rows.
 */
public record NoAggregationPlan(List<String> fields, String whereClause, List<PhysicalStatement> statements)
        implements QueryPlan {

    public NoAggregationPlan {
        fields = List.copyOf(fields);
        statements = List.copyOf(statements);
    }

    @Override
    public PlanKind kind() {
        return PlanKind.NO_AGGREGATION;
    }
}
