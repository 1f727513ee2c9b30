package io.tsbench.runtime;

import io.tsbench.query.plan.PlanKind;
import io.tsbench.query.plan.QueryPlan;

/**
 * One line of plan output.
 */
public record PlanRecord(long id, String label, PlanKind kind, int statementCount, QueryPlan plan) {
}
