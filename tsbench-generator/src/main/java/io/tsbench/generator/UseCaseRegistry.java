package io.tsbench.generator;

import io.tsbench.common.BenchmarkException;
import io.tsbench.generator.devops.DevopsQueries;
import io.tsbench.generator.iot.IotQueries;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static io.tsbench.common.ConfigConstants.*;
import static io.tsbench.generator.devops.DevopsQueries.*;

/**
 * Query types available per use case. Built once, immutable afterwards, and handed to the
 * generator; nothing registers query types after startup.
 */
public final class UseCaseRegistry {

    private final Map<String, Map<String, QueryFillerMaker>> useCases;

    private UseCaseRegistry(Map<String, Map<String, QueryFillerMaker>> useCases) {
        var copy = new LinkedHashMap<String, Map<String, QueryFillerMaker>>();
        useCases.forEach((useCase, types) -> copy.put(useCase, Collections.unmodifiableMap(new LinkedHashMap<>(types))));
        this.useCases = Collections.unmodifiableMap(copy);
    }

    /**
     * Devops, its cpu-only alias, and IoT.
     */
    public static UseCaseRegistry defaults() {
        var devops = new LinkedHashMap<String, QueryFillerMaker>();
        devops.put(LABEL_SINGLE_GROUPBY + "-1-1-1", DevopsQueries.singleGroupby(1, 1, 1));
        devops.put(LABEL_SINGLE_GROUPBY + "-1-1-12", DevopsQueries.singleGroupby(1, 1, 12));
        devops.put(LABEL_SINGLE_GROUPBY + "-1-8-1", DevopsQueries.singleGroupby(1, 8, 1));
        devops.put(LABEL_SINGLE_GROUPBY + "-5-1-1", DevopsQueries.singleGroupby(5, 1, 1));
        devops.put(LABEL_SINGLE_GROUPBY + "-5-1-12", DevopsQueries.singleGroupby(5, 1, 12));
        devops.put(LABEL_SINGLE_GROUPBY + "-5-8-1", DevopsQueries.singleGroupby(5, 8, 1));
        devops.put(LABEL_MAX_ALL + "-1", DevopsQueries.maxAllCpu(1, MAX_ALL_DURATION));
        devops.put(LABEL_MAX_ALL + "-8", DevopsQueries.maxAllCpu(8, MAX_ALL_DURATION));
        devops.put(LABEL_MAX_ALL + "-32-24", DevopsQueries.maxAllCpu(32, Duration.ofHours(24)));
        devops.put(LABEL_DOUBLE_GROUPBY + "-1", DevopsQueries.doubleGroupby(1));
        devops.put(LABEL_DOUBLE_GROUPBY + "-5", DevopsQueries.doubleGroupby(5));
        devops.put(LABEL_DOUBLE_GROUPBY + "-all", DevopsQueries.doubleGroupbyAll());
        devops.put(LABEL_GROUPBY_ORDERBY_LIMIT, DevopsQueries.groupByOrderByLimit());
        devops.put(LABEL_HIGH_CPU + "-all", DevopsQueries.highCpu(0));
        devops.put(LABEL_HIGH_CPU + "-1", DevopsQueries.highCpu(1));
        devops.put(LABEL_LASTPOINT, DevopsQueries.lastPointPerHost());

        var iot = new LinkedHashMap<String, QueryFillerMaker>();
        iot.put(IotQueries.LABEL_LAST_LOC, IotQueries.lastLocPerTruck());
        iot.put(IotQueries.LABEL_AVG_LOAD, IotQueries.avgLoad());

        return builder()
                .useCase(USE_CASE_DEVOPS, devops)
                .useCase(USE_CASE_CPU_ONLY, devops)
                .useCase(USE_CASE_IOT, iot)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> useCases() {
        return useCases.keySet();
    }

    public Set<String> queryTypes(String useCase) {
        return queryTypesOf(useCase).keySet();
    }

    /**
     * @throws BenchmarkException UNSUPPORTED_USE_CASE for an unknown use case or query type
     */
    public QueryFillerMaker fillerMaker(String useCase, String queryType) {
        var maker = queryTypesOf(useCase).get(queryType);
        if (maker == null) {
            throw BenchmarkException.unsupported("invalid query type for use case '%s': '%s'", useCase, queryType);
        }
        return maker;
    }

    private Map<String, QueryFillerMaker> queryTypesOf(String useCase) {
        var types = useCases.get(useCase);
        if (types == null) {
            throw BenchmarkException.unsupported("invalid use case specified: '%s'", useCase);
        }
        return types;
    }

    public static class Builder {
        private final Map<String, Map<String, QueryFillerMaker>> useCases = new LinkedHashMap<>();

        public Builder useCase(String useCase, Map<String, QueryFillerMaker> queryTypes) {
            useCases.put(useCase, new LinkedHashMap<>(queryTypes));
            return this;
        }

        public Builder queryType(String useCase, String queryType, QueryFillerMaker maker) {
            useCases.computeIfAbsent(useCase, u -> new LinkedHashMap<>()).put(queryType, maker);
            return this;
        }

        public UseCaseRegistry build() {
            return new UseCaseRegistry(useCases);
        }
    }
}
