package io.tsbench.generator.cassandra;

import io.tsbench.generator.UseCaseGenerator;
import io.tsbench.generator.iot.IotCore;
import io.tsbench.generator.iot.IotQueries;
import io.tsbench.query.HighLevelQuery;
import io.tsbench.query.index.IotSchema;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

public class CassandraIot extends IotCore implements UseCaseGenerator,
        IotQueries.LastLocFiller,
        IotQueries.AvgLoadFiller {

    static final Duration AVG_LOAD_DURATION = Duration.ofHours(12);

    public CassandraIot(Instant start, Instant end, int scale, Random random) {
        super(start, end, scale, random);
    }

    @Override
    public HighLevelQuery.Builder newQuery() {
        return HighLevelQuery.builder();
    }

    @Override
    public void lastLocPerTruck(HighLevelQuery.Builder query) {
        var fleet = randomFleet();
        var label = "Cassandra last location per truck, fleet " + fleet;
        query.humanLabel(label)
                .humanDescription(label + ": readings")
                .measurementName(IotSchema.READINGS)
                .fieldName("latitude,longitude")
                .timeInterval(interval())
                .tagSet("fleet=" + fleet)
                .forEveryN(IotSchema.NAME + ",1");
    }

    @Override
    public void avgLoad(HighLevelQuery.Builder query) {
        var interval = randomWindow(AVG_LOAD_DURATION);
        var label = "Cassandra average load per fleet, random %s by 1h".formatted(AVG_LOAD_DURATION);
        var fleet = randomFleet();
        query.humanLabel(label)
                .humanDescription(label + ": " + fleet + " " + interval.start())
                .measurementName(IotSchema.DIAGNOSTICS)
                .fieldName("load")
                .aggregationType("avg")
                .timeInterval(interval)
                .groupByDuration(Duration.ofHours(1))
                .tagSets(List.of(List.of("fleet=" + fleet)));
    }
}
