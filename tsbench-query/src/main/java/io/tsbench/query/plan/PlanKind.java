package io.tsbench.query.plan;

public enum PlanKind {
    SERVER_AGGREGATION,
    CLIENT_AGGREGATION,
    NO_AGGREGATION,
    FOR_EVERY
}
