package io.tsbench.query.plan;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Locale;

import static io.tsbench.common.ConfigConstants.SERIES_ID_COLUMN_KEY;
import static io.tsbench.common.ConfigConstants.TIME_COLUMN_KEY;
import static io.tsbench.common.ConfigConstants.VALUE_COLUMN_KEY;

/**
 * CQL dialect over tables partitioned by series id and clustered by time.
 */
public class CqlStatementBuilder implements StatementBuilder {

    public static final String DEFAULT_SERIES_ID_COLUMN = "series_id";
    public static final String DEFAULT_TIME_COLUMN = "timestamp_ns";
    public static final String DEFAULT_VALUE_COLUMN = "value";

    private final String seriesIdColumn;
    private final String timeColumn;
    private final String valueColumn;

    public CqlStatementBuilder() {
        this(DEFAULT_SERIES_ID_COLUMN, DEFAULT_TIME_COLUMN, DEFAULT_VALUE_COLUMN);
    }

    public CqlStatementBuilder(String seriesIdColumn, String timeColumn, String valueColumn) {
        this.seriesIdColumn = seriesIdColumn;
        this.timeColumn = timeColumn;
        this.valueColumn = valueColumn;
    }

    /**
     * Column names from the {@code statement} block; missing keys keep the defaults.
     */
    public CqlStatementBuilder(Config config) {
        this(getOrDefault(config, SERIES_ID_COLUMN_KEY, DEFAULT_SERIES_ID_COLUMN),
                getOrDefault(config, TIME_COLUMN_KEY, DEFAULT_TIME_COLUMN),
                getOrDefault(config, VALUE_COLUMN_KEY, DEFAULT_VALUE_COLUMN));
    }

    @Override
    public PhysicalStatement build(String aggregationLabel,
                                   String table,
                                   String seriesId,
                                   String orderBy,
                                   long startNanos,
                                   long endNanos) {
        var where = "WHERE %s = ? AND %s >= ? AND %s < ?".formatted(seriesIdColumn, timeColumn, timeColumn);
        String template;
        if (aggregationLabel == null || aggregationLabel.isEmpty()) {
            template = "SELECT %s, %s FROM %s %s".formatted(timeColumn, valueColumn, table, where);
            if (orderBy != null && !orderBy.isEmpty()) {
                template += " ORDER BY " + orderBy;
            }
        } else {
            template = "SELECT %s(%s) FROM %s %s".formatted(aggregationLabel, valueColumn, table, where);
        }
        return new PhysicalStatement(template, List.of(seriesId, startNanos, endNanos), StatementBuilder.fieldLabel(seriesId));
    }

    @Override
    public boolean isDescendingTime(String orderBy) {
        if (orderBy == null) {
            return false;
        }
        var tokens = orderBy.trim().split("\\s+");
        return tokens.length == 2
                && tokens[0].equals(timeColumn)
                && tokens[1].toUpperCase(Locale.ROOT).equals("DESC");
    }

    @Override
    public String latestFirstOrder() {
        return timeColumn + " DESC";
    }

    @Override
    public String limitOneSuffix() {
        return " LIMIT 1";
    }

    private static String getOrDefault(Config config, String key, String defaultValue) {
        return config.hasPath(key) ? config.getString(key) : defaultValue;
    }
}
