package io.tsbench.query.plan;

import java.util.List;

/**
 * One prepared statement against the store.
 *
 * @param template text with positional placeholders for series id, start and end
 * @param args     bound values: series id, start nanos, end nanos
 * @param field    field label taken from the series id, used to attribute results
 */
public record PhysicalStatement(String template, List<Object> args, String field) {

    public PhysicalStatement {
        args = List.copyOf(args);
    }

    /**
     * Same statement with literal text appended to the template; arguments are unchanged.
     */
    public PhysicalStatement withSuffix(String suffix) {
        return new PhysicalStatement(template + suffix, args, field);
    }

    public String seriesId() {
        return (String) args.get(0);
    }

    public long startNanos() {
        return (Long) args.get(1);
    }

    public long endNanos() {
        return (Long) args.get(2);
    }
}
