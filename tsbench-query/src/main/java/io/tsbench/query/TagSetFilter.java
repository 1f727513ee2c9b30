package io.tsbench.query;

import io.tsbench.common.BenchmarkException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Disjunction of conjunctions over tag values. A tag map matches when at least one clause
 * has all of its {@code key=value} pairs present; the empty filter matches everything.
 */
public record TagSetFilter(List<List<Tag>> clauses) {

    public record Tag(String key, String value) {
        @Override
        public String toString() {
            return key + "=" + value;
        }
    }

    public static final TagSetFilter MATCH_ALL = new TagSetFilter(List.of());

    public TagSetFilter {
        clauses = clauses.stream().map(List::copyOf).toList();
    }

    /**
     * @param tagSets clauses of {@code key=value} tokens
     * @throws BenchmarkException MALFORMED_QUERY_SPEC on a token without '=' or with an empty key
     */
    public static TagSetFilter parse(List<List<String>> tagSets) {
        if (tagSets == null || tagSets.isEmpty()) {
            return MATCH_ALL;
        }
        var clauses = new ArrayList<List<Tag>>(tagSets.size());
        for (var tagSet : tagSets) {
            var clause = new ArrayList<Tag>(tagSet.size());
            for (var token : tagSet) {
                int eq = token.indexOf('=');
                if (eq <= 0) {
                    throw BenchmarkException.malformed("invalid tag '%s', expected key=value", token);
                }
                clause.add(new Tag(token.substring(0, eq), token.substring(eq + 1)));
            }
            clauses.add(clause);
        }
        return new TagSetFilter(clauses);
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public boolean matches(Map<String, String> tags) {
        if (clauses.isEmpty()) {
            return true;
        }
        for (var clause : clauses) {
            if (clause.stream().allMatch(t -> t.value().equals(tags.get(t.key())))) {
                return true;
            }
        }
        return false;
    }
}
