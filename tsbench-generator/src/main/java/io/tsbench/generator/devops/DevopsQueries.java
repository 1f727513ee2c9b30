package io.tsbench.generator.devops;

import io.tsbench.generator.QueryFillerMaker;
import io.tsbench.query.HighLevelQuery;
import io.tsbench.query.index.DevopsSchema;

import java.time.Duration;

import static io.tsbench.generator.QueryFillerMaker.require;

/**
 * Devops query types. Each filler needs the matching capability from the backend generator.
 */
public final class DevopsQueries {

    public static final String LABEL_SINGLE_GROUPBY = "single-groupby";
    public static final String LABEL_MAX_ALL = "cpu-max-all";
    public static final String LABEL_DOUBLE_GROUPBY = "double-groupby";
    public static final String LABEL_GROUPBY_ORDERBY_LIMIT = "groupby-orderby-limit";
    public static final String LABEL_HIGH_CPU = "high-cpu";
    public static final String LABEL_LASTPOINT = "lastpoint";

    public static final Duration MAX_ALL_DURATION = Duration.ofHours(8);
    public static final Duration DOUBLE_GROUPBY_DURATION = Duration.ofHours(12);
    public static final Duration HIGH_CPU_DURATION = Duration.ofHours(12);

    public interface SingleGroupbyFiller {
        void groupByTime(HighLevelQuery.Builder query, int hosts, int metrics, Duration timeRange);
    }

    public interface MaxAllFiller {
        void maxAllCpu(HighLevelQuery.Builder query, int hosts, Duration timeRange);
    }

    public interface DoubleGroupbyFiller {
        void groupByTimeAndPrimaryTag(HighLevelQuery.Builder query, int metrics);
    }

    public interface GroupbyOrderbyLimitFiller {
        void groupByOrderByLimit(HighLevelQuery.Builder query);
    }

    public interface HighCpuFiller {
        /**
         * @param hosts number of hosts, 0 for all of them
         */
        void highCpuForHosts(HighLevelQuery.Builder query, int hosts);
    }

    public interface LastPointFiller {
        void lastPointPerHost(HighLevelQuery.Builder query);
    }

    private DevopsQueries() {
    }

    public static QueryFillerMaker singleGroupby(int metrics, int hosts, int hours) {
        var label = "%s-%d-%d-%d".formatted(LABEL_SINGLE_GROUPBY, metrics, hosts, hours);
        return generator -> {
            var filler = require(generator, SingleGroupbyFiller.class, label);
            return query -> filler.groupByTime(query, hosts, metrics, Duration.ofHours(hours));
        };
    }

    public static QueryFillerMaker maxAllCpu(int hosts, Duration timeRange) {
        return generator -> {
            var filler = require(generator, MaxAllFiller.class, LABEL_MAX_ALL);
            return query -> filler.maxAllCpu(query, hosts, timeRange);
        };
    }

    public static QueryFillerMaker doubleGroupby(int metrics) {
        return generator -> {
            var filler = require(generator, DoubleGroupbyFiller.class, LABEL_DOUBLE_GROUPBY);
            return query -> filler.groupByTimeAndPrimaryTag(query, metrics);
        };
    }

    public static QueryFillerMaker doubleGroupbyAll() {
        return doubleGroupby(DevopsSchema.CPU_FIELDS.size());
    }

    public static QueryFillerMaker groupByOrderByLimit() {
        return generator -> {
            var filler = require(generator, GroupbyOrderbyLimitFiller.class, LABEL_GROUPBY_ORDERBY_LIMIT);
            return filler::groupByOrderByLimit;
        };
    }

    public static QueryFillerMaker highCpu(int hosts) {
        return generator -> {
            var filler = require(generator, HighCpuFiller.class, LABEL_HIGH_CPU);
            return query -> filler.highCpuForHosts(query, hosts);
        };
    }

    public static QueryFillerMaker lastPointPerHost() {
        return generator -> {
            var filler = require(generator, LastPointFiller.class, LABEL_LASTPOINT);
            return filler::lastPointPerHost;
        };
    }
}
