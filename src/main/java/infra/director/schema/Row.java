package infra.director.schema;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered mapping from column label to {@link RowValue}.
 *
 * <p>Lookups try the exact label first and fall back to a case-insensitive match,
 * since MySQL 8 reports information_schema labels in upper case.</p>
 */
public final class Row {

    private final Map<String, RowValue> values;

    private Row(Map<String, RowValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> columnNames() {
        return new ArrayList<>(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean has(String column) {
        return resolve(column) != null;
    }

    /**
     * @return the value, or {@link RowValue#nullValue()} when the column is absent
     */
    public RowValue get(String column) {
        String key = resolve(column);
        return key == null ? RowValue.nullValue() : values.get(key);
    }

    public String getString(String column) {
        return get(column).asString();
    }

    /**
     * First column that is present, in the given order of preference.
     */
    public String getString(String... candidates) {
        for (String column : candidates) {
            if (has(column)) {
                return getString(column);
            }
        }
        return null;
    }

    /**
     * Value of the first column of the row (e.g. the single column of <code>SHOW TABLES</code>).
     */
    public RowValue first() {
        return values.isEmpty() ? RowValue.nullValue() : values.values().iterator().next();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, RowValue> entry : values.entrySet()) {
            json.put(entry.getKey(), entry.getValue().toJsonValue());
        }
        return json;
    }

    private String resolve(String column) {
        if (values.containsKey(column)) {
            return column;
        }
        for (String key : values.keySet()) {
            if (key.equalsIgnoreCase(column)) {
                return key;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row && values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }

    public static final class Builder {
        private final LinkedHashMap<String, RowValue> values = new LinkedHashMap<>();

        public Builder put(String column, RowValue value) {
            if (values.containsKey(column)) {
                throw new IllegalArgumentException("duplicate column in row: " + column);
            }
            values.put(column, value == null ? RowValue.nullValue() : value);
            return this;
        }

        public Builder put(String column, String value) {
            return put(column, RowValue.of(value));
        }

        public Builder put(String column, Number value) {
            return put(column, RowValue.of(value));
        }

        public Row build() {
            return new Row(new LinkedHashMap<>(values));
        }
    }
}
