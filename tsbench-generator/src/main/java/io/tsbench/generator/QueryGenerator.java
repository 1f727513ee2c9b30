package io.tsbench.generator;

import io.tsbench.query.QueryCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Writes high-level queries of one (format, use case, query type) as JSON lines.
 *
 * <p>With interleaved groups every query is generated, so the random sequence is the same
 * for all groups, but only the queries of the configured group are written.
 */
public class QueryGenerator {

    private static final Logger log = LoggerFactory.getLogger(QueryGenerator.class);

    private final UseCaseRegistry registry;
    private final QueryGeneratorFactories factories;

    public QueryGenerator(UseCaseRegistry registry, QueryGeneratorFactories factories) {
        this.registry = registry;
        this.factories = factories;
    }

    /**
     * @return number of written queries per human label
     */
    public Map<String, Long> generate(GeneratorConfig config, Writer out) throws IOException {
        config.validate();
        var maker = registry.fillerMaker(config.getUseCase(), config.getQueryType());
        var random = new Random(config.getSeed());
        var generator = factories.generatorFor(config.getFormat(), config.getUseCase(),
                config.getTimestampStart(), config.getTimestampEnd(), config.getScale(), random);
        var filler = maker.make(generator);
        log.info("generating {} {} {} queries with seed {}", config.getQueries(), config.getUseCase(),
                config.getQueryType(), config.getSeed());

        var stats = new TreeMap<String, Long>();
        int currentGroup = 0;
        for (long i = 0; i < config.getQueries(); i++) {
            var builder = generator.newQuery().id(i);
            filler.fill(builder);
            var query = builder.build();
            if (currentGroup == config.getInterleavedGroupId()) {
                QueryCodec.write(out, query);
                stats.merge(query.humanLabel(), 1L, Long::sum);
            }
            currentGroup++;
            if (currentGroup == config.getInterleavedGroups()) {
                currentGroup = 0;
            }
        }
        out.flush();
        stats.forEach((label, count) -> log.info("{}: {} queries", label, count));
        return stats;
    }
}
