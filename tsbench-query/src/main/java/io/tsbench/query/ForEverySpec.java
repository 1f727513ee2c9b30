package io.tsbench.query;

import io.tsbench.common.BenchmarkException;
import io.tsbench.common.ErrorKind;

/**
 * Parsed {@code tagName,N} sampling spec of a "for every N" query.
 */
public record ForEverySpec(String tagName, long n) {

    public static ForEverySpec parse(String spec) {
        if (spec == null || spec.isEmpty()) {
            throw BenchmarkException.malformed("empty for-every spec");
        }
        var parts = spec.split(",", -1);
        if (parts.length != 2) {
            throw BenchmarkException.malformed("unparseable for-every spec '%s': expected tagName,N", spec);
        }
        if (parts[0].isEmpty()) {
            throw BenchmarkException.malformed("unparseable for-every spec '%s': empty tag name", spec);
        }
        try {
            return new ForEverySpec(parts[0], Long.parseLong(parts[1]));
        } catch (NumberFormatException e) {
            throw new BenchmarkException(ErrorKind.MALFORMED_QUERY_SPEC,
                    "unparseable for-every spec '%s': '%s' is not an integer".formatted(spec, parts[1]), e);
        }
    }

    @Override
    public String toString() {
        return tagName + "," + n;
    }
}
