package io.tsbench.query.plan;

import java.util.List;

/**
 * Physical recipe for one high-level query: the statements to run and whatever the executor
 * needs to combine their results.
 */
public interface QueryPlan {

    PlanKind kind();

    /**
     * All statements of the plan in execution order.
     */
    List<PhysicalStatement> statements();

    default int statementCount() {
        return statements().size();
    }
}
