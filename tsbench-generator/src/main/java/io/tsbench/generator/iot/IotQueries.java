package io.tsbench.generator.iot;

import io.tsbench.generator.QueryFillerMaker;
import io.tsbench.query.HighLevelQuery;

import static io.tsbench.generator.QueryFillerMaker.require;

/**
 * IoT query types.
 */
public final class IotQueries {

    public static final String LABEL_LAST_LOC = "last-loc";
    public static final String LABEL_AVG_LOAD = "avg-load";

    public interface LastLocFiller {
        void lastLocPerTruck(HighLevelQuery.Builder query);
    }

    public interface AvgLoadFiller {
        void avgLoad(HighLevelQuery.Builder query);
    }

    private IotQueries() {
    }

    public static QueryFillerMaker lastLocPerTruck() {
        return generator -> {
            var filler = require(generator, LastLocFiller.class, LABEL_LAST_LOC);
            return filler::lastLocPerTruck;
        };
    }

    public static QueryFillerMaker avgLoad() {
        return generator -> {
            var filler = require(generator, AvgLoadFiller.class, LABEL_AVG_LOAD);
            return filler::avgLoad;
        };
    }
}
