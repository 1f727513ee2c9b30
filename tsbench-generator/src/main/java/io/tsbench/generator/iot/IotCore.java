package io.tsbench.generator.iot;

import io.tsbench.common.BenchmarkException;
import io.tsbench.generator.GeneratorCore;
import io.tsbench.query.index.IotSchema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class IotCore extends GeneratorCore {

    public IotCore(Instant start, Instant end, int scale, Random random) {
        super(start, end, scale, random);
    }

    public List<String> randomTrucks(int count) {
        if (count < 1 || count > scale()) {
            throw BenchmarkException.malformed("number of trucks must be in [1, %d], got %d", scale(), count);
        }
        var trucks = new ArrayList<String>(count);
        for (int truck : randomSubset(count, scale())) {
            trucks.add(IotSchema.truckName(truck));
        }
        return trucks;
    }

    public String randomFleet() {
        return IotSchema.FLEETS.get(random.nextInt(IotSchema.FLEETS.size()));
    }
}
