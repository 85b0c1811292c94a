package infra.director.schema.model;

import infra.director.schema.Row;
import infra.director.schema.RowValue;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Approximate per-table statistics. Which fields are present depends on the engine:
 * PostgreSQL reports tuple counts and vacuum/analyze times, MySQL sizes and create/update times.
 */
public final class TableStatistics {

    private static final TableStatistics EMPTY = new TableStatistics(null, null, Map.of(), Map.of());

    private static final String[] TIMESTAMP_FIELDS = {
            "last_vacuum", "last_autovacuum", "last_analyze", "last_autoanalyze", "create_time", "update_time"
    };
    private static final String[] SIZE_FIELDS = {"data_length", "index_length", "data_free"};

    private final Long rowCountEstimate;
    private final Long deadTuples;
    private final Map<String, String> timestamps;
    private final Map<String, Long> sizes;

    private TableStatistics(Long rowCountEstimate, Long deadTuples, Map<String, String> timestamps, Map<String, Long> sizes) {
        this.rowCountEstimate = rowCountEstimate;
        this.deadTuples = deadTuples;
        this.timestamps = Collections.unmodifiableMap(timestamps);
        this.sizes = Collections.unmodifiableMap(sizes);
    }

    public static TableStatistics empty() {
        return EMPTY;
    }

    public static TableStatistics fromRow(Row row) {
        Map<String, String> timestamps = new LinkedHashMap<>();
        for (String field : TIMESTAMP_FIELDS) {
            if (row.has(field)) {
                timestamps.put(field, row.getString(field));
            }
        }
        Map<String, Long> sizes = new LinkedHashMap<>();
        for (String field : SIZE_FIELDS) {
            Long size = asLong(row.get(field));
            if (size != null) {
                sizes.put(field, size);
            }
        }
        return new TableStatistics(asLong(row.get("row_count_estimate")), asLong(row.get("dead_tuples")), timestamps, sizes);
    }

    private static Long asLong(RowValue value) {
        Number number = value.asNumber();
        return number == null ? null : number.longValue();
    }

    public boolean isEmpty() {
        return rowCountEstimate == null && deadTuples == null && timestamps.isEmpty() && sizes.isEmpty();
    }

    public Long getRowCountEstimate() {
        return rowCountEstimate;
    }

    public Long getDeadTuples() {
        return deadTuples;
    }

    public Map<String, String> getTimestamps() {
        return timestamps;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        if (rowCountEstimate != null) {
            json.put("row_count_estimate", rowCountEstimate);
        }
        if (deadTuples != null) {
            json.put("dead_tuples", deadTuples);
        }
        timestamps.forEach(json::put);
        sizes.forEach(json::put);
        return json;
    }
}
