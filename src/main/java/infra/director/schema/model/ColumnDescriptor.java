package infra.director.schema.model;

import infra.director.schema.Row;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.List;

/**
 * One column of a table as reported by the columns facet.
 */
public final class ColumnDescriptor {

    private final String name;
    private final String dataType;
    private final String udtName;
    private final String columnType;
    private final String nullable;
    private final String defaultValue;
    private final List<String> enumValues;
    private final String enumType;

    private ColumnDescriptor(String name, String dataType, String udtName, String columnType,
                             String nullable, String defaultValue, List<String> enumValues, String enumType) {
        this.name = name;
        this.dataType = dataType;
        this.udtName = udtName;
        this.columnType = columnType;
        this.nullable = nullable;
        this.defaultValue = defaultValue;
        this.enumValues = enumValues == null ? null : Collections.unmodifiableList(enumValues);
        this.enumType = enumType;
    }

    /**
     * Read a columns-facet row. Accepts the information_schema labels as well as
     * the <code>Field/Type/Null/Default</code> labels of <code>SHOW COLUMNS</code>.
     */
    public static ColumnDescriptor fromRow(Row row) {
        return new ColumnDescriptor(
                row.getString("column_name", "Field"),
                row.getString("data_type", "Type"),
                row.getString("udt_name"),
                row.getString("column_type"),
                row.getString("is_nullable", "Null"),
                row.getString("column_default", "Default"),
                null,
                null);
    }

    public ColumnDescriptor withEnum(String enumType, List<String> enumValues) {
        return new ColumnDescriptor(name, dataType, udtName, columnType, nullable, defaultValue, enumValues, enumType);
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    public String getUdtName() {
        return udtName;
    }

    public String getColumnType() {
        return columnType;
    }

    public boolean isNullable() {
        return "YES".equalsIgnoreCase(nullable);
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public List<String> getEnumValues() {
        return enumValues;
    }

    public String getEnumType() {
        return enumType;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("column_name", name)
                .put("data_type", dataType);
        if (udtName != null) {
            json.put("udt_name", udtName);
        }
        if (columnType != null) {
            json.put("column_type", columnType);
        }
        json.put("is_nullable", nullable);
        json.put("column_default", defaultValue);
        if (enumValues != null) {
            json.put("enum_values", new JsonArray(List.copyOf(enumValues)));
            json.put("enum_type", enumType);
        }
        return json;
    }
}
