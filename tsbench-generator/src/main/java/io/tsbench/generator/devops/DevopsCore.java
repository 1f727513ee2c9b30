package io.tsbench.generator.devops;

import io.tsbench.common.BenchmarkException;
import io.tsbench.generator.GeneratorCore;
import io.tsbench.query.index.DevopsSchema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Host and cpu metric selection for devops generators of every backend.
 */
public class DevopsCore extends GeneratorCore {

    public DevopsCore(Instant start, Instant end, int scale, Random random) {
        super(start, end, scale, random);
    }

    /**
     * {@code count} distinct host names in random order.
     */
    public List<String> randomHosts(int count) {
        if (count < 1) {
            throw BenchmarkException.malformed("number of hosts cannot be < 1; got %d", count);
        }
        if (count > scale()) {
            throw BenchmarkException.malformed("number of hosts (%d) larger than total hosts. See --scale (%d)",
                    count, scale());
        }
        var hosts = new ArrayList<String>(count);
        for (int host : randomSubset(count, scale())) {
            hosts.add(DevopsSchema.hostname(host));
        }
        return hosts;
    }

    /**
     * The first {@code count} cpu metrics.
     */
    public static List<String> cpuMetrics(int count) {
        if (count < 1) {
            throw BenchmarkException.malformed("number of metrics cannot be < 1; got %d", count);
        }
        if (count > DevopsSchema.CPU_FIELDS.size()) {
            throw BenchmarkException.malformed("number of metrics (%d) larger than the %d cpu metrics",
                    count, DevopsSchema.CPU_FIELDS.size());
        }
        return DevopsSchema.CPU_FIELDS.subList(0, count);
    }
}
