package io.tsbench.generator.cassandra;

import io.tsbench.generator.UseCaseGenerator;
import io.tsbench.generator.devops.DevopsCore;
import io.tsbench.generator.devops.DevopsQueries;
import io.tsbench.query.HighLevelQuery;
import io.tsbench.query.index.DevopsSchema;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Devops queries for the Cassandra-style store. Host selections become one tag-set clause
 * per host, so a series matches when it belongs to any selected host.
 */
public class CassandraDevops extends DevopsCore implements UseCaseGenerator,
        DevopsQueries.SingleGroupbyFiller,
        DevopsQueries.MaxAllFiller,
        DevopsQueries.DoubleGroupbyFiller,
        DevopsQueries.GroupbyOrderbyLimitFiller,
        DevopsQueries.HighCpuFiller,
        DevopsQueries.LastPointFiller {

    static final String ORDER_BY_TIME_DESC = "timestamp_ns DESC";
    static final String HIGH_CPU_WHERE = "usage_user,>,90.0";

    public CassandraDevops(Instant start, Instant end, int scale, Random random) {
        super(start, end, scale, random);
    }

    @Override
    public HighLevelQuery.Builder newQuery() {
        return HighLevelQuery.builder().measurementName(DevopsSchema.CPU);
    }

    @Override
    public void groupByTime(HighLevelQuery.Builder query, int hosts, int metrics, Duration timeRange) {
        var interval = randomWindow(timeRange);
        var label = "Cassandra %d cpu metric(s), random %4d hosts, random %s by 1m".formatted(metrics, hosts, timeRange);
        query.humanLabel(label)
                .humanDescription(label + ": " + interval.start())
                .aggregationType("max")
                .fields(cpuMetrics(metrics))
                .timeInterval(interval)
                .groupByDuration(Duration.ofMinutes(1))
                .tagSets(hostClauses(randomHosts(hosts)));
    }

    @Override
    public void maxAllCpu(HighLevelQuery.Builder query, int hosts, Duration timeRange) {
        var interval = randomWindow(timeRange);
        var label = "Cassandra max cpu all fields, rand %4d hosts, rand %s by 1h".formatted(hosts, timeRange);
        query.humanLabel(label)
                .humanDescription(label + ": " + interval.start())
                .aggregationType("max")
                .fields(DevopsSchema.CPU_FIELDS)
                .timeInterval(interval)
                .groupByDuration(Duration.ofHours(1))
                .tagSets(hostClauses(randomHosts(hosts)));
    }

    @Override
    public void groupByTimeAndPrimaryTag(HighLevelQuery.Builder query, int metrics) {
        var interval = randomWindow(DevopsQueries.DOUBLE_GROUPBY_DURATION);
        var label = "Cassandra mean of %d metrics, all hosts, random %s by 1h"
                .formatted(metrics, DevopsQueries.DOUBLE_GROUPBY_DURATION);
        query.humanLabel(label)
                .humanDescription(label + ": " + interval.start())
                .aggregationType("avg")
                .fields(cpuMetrics(metrics))
                .timeInterval(interval)
                .groupByDuration(Duration.ofHours(1));
    }

    @Override
    public void groupByOrderByLimit(HighLevelQuery.Builder query) {
        var interval = randomWindow(Duration.ofHours(1));
        var label = "Cassandra max cpu over last 5 min-intervals (random end)";
        query.humanLabel(label)
                .humanDescription(label + ": " + interval.end())
                .aggregationType("max")
                .fieldName("usage_user")
                .timeInterval(interval)
                .groupByDuration(Duration.ofMinutes(1))
                .orderBy(ORDER_BY_TIME_DESC)
                .limit(5);
    }

    @Override
    public void highCpuForHosts(HighLevelQuery.Builder query, int hosts) {
        var interval = randomWindow(DevopsQueries.HIGH_CPU_DURATION);
        String label;
        if (hosts == 0) {
            label = "Cassandra CPU over threshold, all hosts";
        } else {
            label = "Cassandra CPU over threshold, %d host(s)".formatted(hosts);
            query.tagSets(hostClauses(randomHosts(hosts)));
        }
        query.humanLabel(label)
                .humanDescription(label + ": " + interval.start())
                .fields(DevopsSchema.CPU_FIELDS)
                .timeInterval(interval)
                .whereClause(HIGH_CPU_WHERE);
    }

    @Override
    public void lastPointPerHost(HighLevelQuery.Builder query) {
        var label = "Cassandra last row per host";
        query.humanLabel(label)
                .humanDescription(label + ": cpu")
                .fields(DevopsSchema.CPU_FIELDS)
                .timeInterval(interval())
                .forEveryN(DevopsSchema.HOSTNAME + ",1");
    }

    static List<List<String>> hostClauses(List<String> hosts) {
        var clauses = new ArrayList<List<String>>(hosts.size());
        for (var host : hosts) {
            clauses.add(List.of(DevopsSchema.HOSTNAME + "=" + host));
        }
        return clauses;
    }
}
