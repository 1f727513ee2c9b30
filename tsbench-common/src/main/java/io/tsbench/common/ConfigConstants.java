package io.tsbench.common;

public class ConfigConstants {

    public static final String CONFIG_PATH = "tsbench";

    public static final String MODE_KEY = "mode";
    public static final String MODE_GENERATE_QUERIES = "generate-queries";
    public static final String MODE_GENERATE_DATA = "generate-data";
    public static final String MODE_PLAN = "plan";

    // Workload configuration keys
    public static final String FORMAT_KEY = "format";
    public static final String USE_CASE_KEY = "use_case";
    public static final String QUERY_TYPE_KEY = "query_type";
    public static final String SCALE_KEY = "scale";
    public static final String SEED_KEY = "seed";
    public static final String TIMESTAMP_START_KEY = "timestamp_start";
    public static final String TIMESTAMP_END_KEY = "timestamp_end";
    public static final String LOG_INTERVAL_KEY = "log_interval";

    // Query generation keys
    public static final String QUERIES_KEY = "queries";
    public static final String INTERLEAVED_GROUP_ID_KEY = "interleaved_group_id";
    public static final String INTERLEAVED_GROUPS_KEY = "interleaved_groups";

    // File locations
    public static final String INPUT_KEY = "input";
    public static final String OUTPUT_KEY = "output";
    public static final String CATALOG_KEY = "catalog";

    // Planner keys
    public static final String AGGREGATION_PLAN_KEY = "aggregation_plan";
    public static final String AGGREGATION_PLAN_SERVER = "server";
    public static final String AGGREGATION_PLAN_CLIENT = "client";
    public static final String STATEMENT_PREFIX = "statement";
    public static final String SERIES_ID_COLUMN_KEY = "series_id_column";
    public static final String TIME_COLUMN_KEY = "time_column";
    public static final String VALUE_COLUMN_KEY = "value_column";

    public static final String USE_CASE_DEVOPS = "devops";
    public static final String USE_CASE_IOT = "iot";
    public static final String USE_CASE_CPU_ONLY = "cpu-only";
    public static final String FORMAT_CASSANDRA = "cassandra";
    public static final String FORMAT_INFLUX = "influx";
}
