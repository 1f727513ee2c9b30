package io.tsbench.query.plan;

import java.util.List;

/**
 * Latest point of every matching series; the executor groups the rows by {@code tagName}
 * and samples {@code n} of them.
 */
public record ForEveryPlan(List<String> fields, String tagName, long n, List<PhysicalStatement> statements)
        implements QueryPlan {

    public ForEveryPlan {
        fields = List.copyOf(fields);
        statements = List.copyOf(statements);
    }

    @Override
    public PlanKind kind() {
        return PlanKind.FOR_EVERY;
    }
}
