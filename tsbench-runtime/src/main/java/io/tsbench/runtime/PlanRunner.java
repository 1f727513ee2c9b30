package io.tsbench.runtime;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.tsbench.common.BenchmarkException;
import io.tsbench.generator.GeneratorConfig;
import io.tsbench.query.HighLevelQuery;
import io.tsbench.query.QueryCodec;
import io.tsbench.query.QueryPlanner;
import io.tsbench.query.index.ClientSideIndex;
import io.tsbench.query.index.Series;
import io.tsbench.query.index.SeriesCatalog;
import io.tsbench.query.plan.CqlStatementBuilder;
import io.tsbench.query.plan.PlanKind;
import io.tsbench.query.plan.QueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.tsbench.common.ConfigConstants.*;

/**
 * Reads high-level queries as JSON lines, plans each one and writes a {@link PlanRecord} line
 * per query. Planning time is recorded per plan kind.
 */
public class PlanRunner {

    private static final Logger log = LoggerFactory.getLogger(PlanRunner.class);

    private final QueryPlanner planner;
    private final MeterRegistry registry;
    private final Map<PlanKind, Timer> timers = new EnumMap<>(PlanKind.class);
    private final Counter statementCounter;

    public PlanRunner(QueryPlanner planner, MeterRegistry registry) {
        this.planner = planner;
        this.registry = registry;
        for (var kind : PlanKind.values()) {
            timers.put(kind, Timer.builder("tsbench.plan.timer")
                    .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.statementCounter = Counter.builder("tsbench.plan.statements.count")
                .register(registry);
    }

    /**
     * Planner over the configured catalog: the {@code catalog} file if set, otherwise the
     * catalog of {@code use_case} at {@code scale} over the configured timestamps.
     */
    public static PlanRunner create(Config config, MeterRegistry registry) throws IOException {
        var series = loadCatalog(config);
        var index = ClientSideIndex.build(series);
        var statementConfig = config.hasPath(STATEMENT_PREFIX) ? config.getConfig(STATEMENT_PREFIX) : null;
        var statementBuilder = statementConfig == null ? new CqlStatementBuilder() : new CqlStatementBuilder(statementConfig);
        var mode = QueryPlanner.AggregationMode.of(
                config.hasPath(AGGREGATION_PLAN_KEY) ? config.getString(AGGREGATION_PLAN_KEY) : AGGREGATION_PLAN_SERVER);
        log.info("planning against {} series with {} side aggregation", index.size(), mode.name().toLowerCase(Locale.ROOT));
        return new PlanRunner(new QueryPlanner(index, statementBuilder, mode), registry);
    }

    static List<Series> loadCatalog(Config config) throws IOException {
        if (config.hasPath(CATALOG_KEY)) {
            var path = Path.of(config.getString(CATALOG_KEY));
            log.info("reading series catalog from {}", path);
            return SeriesCatalog.read(path);
        }
        var workload = new GeneratorConfig(config);
        var span = workload.getTimeInterval();
        switch (workload.getUseCase()) {
            case USE_CASE_DEVOPS:
            case USE_CASE_CPU_ONLY:
                return SeriesCatalog.devops(workload.getScale(), span);
            case USE_CASE_IOT:
                return SeriesCatalog.iot(workload.getScale(), span);
            default:
                throw BenchmarkException.unsupported("no series catalog for use case '%s'", workload.getUseCase());
        }
    }

    public QueryPlan plan(HighLevelQuery query) {
        var sample = Timer.start(registry);
        var plan = planner.plan(query);
        sample.stop(timers.get(plan.kind()));
        statementCounter.increment(plan.statementCount());
        return plan;
    }

    /**
     * @return number of planned queries
     */
    public long run(BufferedReader in, Writer out) throws IOException {
        long planned = 0;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            var query = QueryCodec.parse(line);
            QueryPlan plan;
            try {
                plan = plan(query);
            } catch (BenchmarkException e) {
                log.error("query {} ({}) cannot be planned: {}", query.id(), query.humanLabel(), e.toString());
                throw e;
            }
            QueryCodec.write(out, new PlanRecord(query.id(), query.humanLabel(), plan.kind(), plan.statementCount(), plan));
            planned++;
        }
        out.flush();
        logSummary(planned);
        return planned;
    }

    private void logSummary(long planned) {
        log.info("planned {} queries, {} statements", planned, (long) statementCounter.count());
        timers.forEach((kind, timer) -> {
            if (timer.count() > 0) {
                log.info("{}: {} plans, mean {} ms, max {} ms", kind, timer.count(),
                        "%.3f".formatted(timer.mean(TimeUnit.MILLISECONDS)),
                        "%.3f".formatted(timer.max(TimeUnit.MILLISECONDS)));
            }
        });
    }
}
