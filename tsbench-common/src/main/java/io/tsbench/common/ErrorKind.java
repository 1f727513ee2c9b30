package io.tsbench.common;

public enum ErrorKind {
    /** Unparseable or incomplete query input: for-every spec, tag sets, empty measurement or field. */
    MALFORMED_QUERY_SPEC,
    /** A time interval whose start is after its end. */
    INVALID_TIME_SPAN,
    /** Catalog or point data that breaks a structural invariant. */
    INDEX_INCONSISTENCY,
    /** A (format, use case, query type) combination nothing is registered for. */
    UNSUPPORTED_USE_CASE
}
