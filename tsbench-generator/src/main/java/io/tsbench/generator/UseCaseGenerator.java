package io.tsbench.generator;

import io.tsbench.query.HighLevelQuery;

/**
 * Backend specific query generator for one use case. Fillers check which filler
 * interfaces it implements before using it.
 */
public interface UseCaseGenerator {

    /**
     * Empty query carrying the backend's defaults.
     */
    HighLevelQuery.Builder newQuery();
}
