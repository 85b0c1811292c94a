package infra.director.schema.model;

import infra.director.schema.Row;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A UNIQUE or PRIMARY KEY constraint with its ordered column list.
 */
public final class ConstraintDescriptor {

    private final String tableName;
    private final String name;
    private final String type;
    private final List<String> columns;

    public ConstraintDescriptor(String tableName, String name, String type, List<String> columns) {
        this.tableName = tableName;
        this.name = name;
        this.type = type;
        this.columns = Collections.unmodifiableList(columns);
    }

    public static ConstraintDescriptor fromRow(Row row) {
        return new ConstraintDescriptor(
                row.getString("table_name"),
                row.getString("constraint_name"),
                row.getString("constraint_type"),
                splitColumns(row.getString("column_names")));
    }

    /**
     * Split an aggregated column list (<code>STRING_AGG</code> or <code>GROUP_CONCAT</code> output).
     */
    static List<String> splitColumns(String aggregated) {
        List<String> columns = new ArrayList<>();
        if (aggregated == null || aggregated.isBlank()) {
            return columns;
        }
        for (String column : aggregated.split(",")) {
            String trimmed = column.trim();
            if (!trimmed.isEmpty()) {
                columns.add(trimmed);
            }
        }
        return columns;
    }

    public String getTableName() {
        return tableName;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public List<String> getColumns() {
        return columns;
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("table_name", tableName)
                .put("constraint_name", name)
                .put("constraint_type", type)
                .put("column_names", new JsonArray(List.copyOf(columns)));
    }
}
