package io.tsbench.query.index;

import io.tsbench.common.BenchmarkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * In-memory map from (measurement, field) to the series stored under it. The store cannot
 * find series by tag combination, so the client keeps this index and filters candidates
 * itself.
 *
 * <p>Built once, then read-only: concurrent planners may share one instance without locking.
 */
public final class ClientSideIndex {

    private static final Logger log = LoggerFactory.getLogger(ClientSideIndex.class);

    record Key(String measurement, String field) {}

    private final Map<Key, List<Series>> seriesByMeasurementAndField;
    private final int size;

    private ClientSideIndex(Map<Key, List<Series>> seriesByMeasurementAndField, int size) {
        this.seriesByMeasurementAndField = seriesByMeasurementAndField;
        this.size = size;
    }

    /**
     * @throws BenchmarkException INDEX_INCONSISTENCY if two series share a table and id
     */
    public static ClientSideIndex build(Collection<Series> catalog) {
        var grouped = new HashMap<Key, List<Series>>();
        var ids = new HashSet<String>(catalog.size() * 2);
        for (var series : catalog) {
            if (!ids.add(series.table() + "\u0000" + series.id())) {
                throw BenchmarkException.inconsistent("duplicate series %s in table %s", series.id(), series.table());
            }
            grouped.computeIfAbsent(new Key(series.measurement(), series.field()), k -> new ArrayList<>()).add(series);
        }
        var frozen = new HashMap<Key, List<Series>>(grouped.size() * 2);
        grouped.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        log.info("Client side index built: {} series under {} measurement/field pairs", catalog.size(), frozen.size());
        return new ClientSideIndex(Map.copyOf(frozen), catalog.size());
    }

    /**
     * @return every series registered under the pair, possibly empty
     */
    public List<Series> seriesFor(String measurement, String field) {
        return seriesByMeasurementAndField.getOrDefault(new Key(measurement, field), List.of());
    }

    /**
     * Union of the per-field candidates, in field order. A field named twice contributes
     * its series twice.
     */
    public List<Series> seriesFor(String measurement, List<String> fields) {
        var result = new ArrayList<Series>();
        for (var field : fields) {
            result.addAll(seriesFor(measurement, field));
        }
        return result;
    }

    public int size() {
        return size;
    }
}
