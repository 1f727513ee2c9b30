package io.tsbench.generator;

import io.tsbench.query.HighLevelQuery;

@FunctionalInterface
public interface QueryFiller {

    void fill(HighLevelQuery.Builder query);
}
