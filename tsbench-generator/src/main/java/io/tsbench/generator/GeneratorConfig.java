package io.tsbench.generator;

import com.typesafe.config.Config;
import io.tsbench.common.BenchmarkException;
import io.tsbench.common.time.TimeInterval;
import io.tsbench.common.util.ConfigUtils;

import java.time.Duration;
import java.time.Instant;

import static io.tsbench.common.ConfigConstants.*;

/**
 * Workload settings shared by query and data generation, read from the {@code tsbench} block.
 *
 * <pre>
 * tsbench {
 *     format = "cassandra"
 *     use_case = "devops"
 *     query_type = "single-groupby-1-1-1"
 *     scale = 4
 *     seed = 123
 *     timestamp_start = "2016-01-01T00:00:00Z"
 *     timestamp_end = "2016-01-02T00:00:00Z"
 *     queries = 1000
 *     interleaved_group_id = 0
 *     interleaved_groups = 1
 *     log_interval = 10s
 * }
 * </pre>
 */
public class GeneratorConfig {

    private final Config config;

    public GeneratorConfig(Config config) {
        this.config = config;
    }

    public String getFormat() {
        return ConfigUtils.getStringOrDefault(config, FORMAT_KEY, FORMAT_CASSANDRA);
    }

    public String getUseCase() {
        return config.getString(USE_CASE_KEY);
    }

    public String getQueryType() {
        return config.getString(QUERY_TYPE_KEY);
    }

    public int getScale() {
        return config.hasPath(SCALE_KEY) ? config.getInt(SCALE_KEY) : 1;
    }

    public long getSeed() {
        return config.hasPath(SEED_KEY) ? config.getLong(SEED_KEY) : 0L;
    }

    public Instant getTimestampStart() {
        return ConfigUtils.getInstant(config, TIMESTAMP_START_KEY);
    }

    public Instant getTimestampEnd() {
        return ConfigUtils.getInstant(config, TIMESTAMP_END_KEY);
    }

    public TimeInterval getTimeInterval() {
        return new TimeInterval(getTimestampStart(), getTimestampEnd());
    }

    public long getQueries() {
        return config.hasPath(QUERIES_KEY) ? config.getLong(QUERIES_KEY) : 1000L;
    }

    public int getInterleavedGroupId() {
        return config.hasPath(INTERLEAVED_GROUP_ID_KEY) ? config.getInt(INTERLEAVED_GROUP_ID_KEY) : 0;
    }

    public int getInterleavedGroups() {
        return config.hasPath(INTERLEAVED_GROUPS_KEY) ? config.getInt(INTERLEAVED_GROUPS_KEY) : 1;
    }

    public Duration getLogInterval() {
        return config.hasPath(LOG_INTERVAL_KEY) ? ConfigUtils.getDuration(config, LOG_INTERVAL_KEY) : Duration.ofSeconds(10);
    }

    /**
     * @throws BenchmarkException MALFORMED_QUERY_SPEC for a bad scale, interleaving or log interval
     */
    public GeneratorConfig validate() {
        if (getScale() < 1) {
            throw BenchmarkException.malformed("scale must be positive, got %d", getScale());
        }
        if (getInterleavedGroups() < 1) {
            throw BenchmarkException.malformed("interleaved groups must be positive, got %d", getInterleavedGroups());
        }
        if (getInterleavedGroupId() < 0 || getInterleavedGroupId() >= getInterleavedGroups()) {
            throw BenchmarkException.malformed("interleaved group id %d must be below interleaved groups %d",
                    getInterleavedGroupId(), getInterleavedGroups());
        }
        if (getLogInterval().isZero() || getLogInterval().isNegative()) {
            throw BenchmarkException.malformed("log interval must be positive, got %s", getLogInterval());
        }
        getTimeInterval();
        return this;
    }

    @Override
    public String toString() {
        return "GeneratorConfig{" +
                "format='" + getFormat() + '\'' +
                ", scale=" + getScale() +
                ", seed=" + getSeed() +
                ", queries=" + getQueries() +
                ", interleavedGroupId=" + getInterleavedGroupId() +
                ", interleavedGroups=" + getInterleavedGroups() +
                '}';
    }
}
