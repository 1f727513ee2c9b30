package io.tsbench.generator.cassandra;

import io.tsbench.common.time.TimeInterval;
import io.tsbench.generator.iot.IotQueries;
import io.tsbench.query.HighLevelQuery;
import io.tsbench.query.QueryPlanner;
import io.tsbench.query.index.ClientSideIndex;
import io.tsbench.query.index.SeriesCatalog;
import io.tsbench.query.plan.CqlStatementBuilder;
import io.tsbench.query.plan.PlanKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CassandraIotTest {

    private static final Instant START = Instant.parse("2016-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2016-01-02T00:00:00Z");

    private final CassandraIot iot = new CassandraIot(START, END, 8, new Random(5));
    private final QueryPlanner planner = new QueryPlanner(
            ClientSideIndex.build(SeriesCatalog.iot(8, new TimeInterval(START, END))),
            new CqlStatementBuilder());

    @Test
    void lastLoc() {
        var builder = iot.newQuery();
        IotQueries.lastLocPerTruck().make(iot).fill(builder);
        HighLevelQuery query = builder.build();

        var plan = planner.plan(query);

        assertEquals(PlanKind.FOR_EVERY, plan.kind());
        // 8 trucks over 4 fleets, two fields each
        assertEquals(2 * 2, plan.statementCount());
    }

    @Test
    void avgLoad() {
        var builder = iot.newQuery();
        IotQueries.avgLoad().make(iot).fill(builder);
        var query = builder.build();

        var plan = planner.plan(query);

        assertEquals(PlanKind.SERVER_AGGREGATION, plan.kind());
        assertEquals("diagnostics", query.measurementName());
        assertTrue(plan.statements().stream().allMatch(s -> s.field().equals("load")));
    }
}
