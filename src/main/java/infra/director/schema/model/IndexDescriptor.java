package infra.director.schema.model;

import infra.director.schema.Row;
import infra.director.schema.RowValue;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.List;

/**
 * An index on a table. PostgreSQL reports a definition, MySQL a column list.
 */
public final class IndexDescriptor {

    private final String tableName;
    private final String name;
    private final String definition;
    private final List<String> columns;
    private final boolean unique;

    public IndexDescriptor(String tableName, String name, String definition, List<String> columns, boolean unique) {
        this.tableName = tableName;
        this.name = name;
        this.definition = definition;
        this.columns = Collections.unmodifiableList(columns);
        this.unique = unique;
    }

    public static IndexDescriptor fromRow(Row row) {
        String definition = row.getString("indexdef");
        boolean unique;
        RowValue nonUnique = row.get("non_unique");
        if (!nonUnique.isNull()) {
            Number flag = nonUnique.asNumber();
            unique = flag != null ? flag.intValue() == 0 : "false".equalsIgnoreCase(nonUnique.asString());
        } else {
            unique = definition != null && definition.toUpperCase().startsWith("CREATE UNIQUE INDEX");
        }
        return new IndexDescriptor(
                row.getString("table_name", "tablename"),
                row.getString("index_name", "indexname"),
                definition,
                ConstraintDescriptor.splitColumns(row.getString("column_names")),
                unique);
    }

    public String getTableName() {
        return tableName;
    }

    public String getName() {
        return name;
    }

    public String getDefinition() {
        return definition;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isUnique() {
        return unique;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("table_name", tableName)
                .put("index_name", name)
                .put("unique", unique);
        if (definition != null) {
            json.put("indexdef", definition);
        }
        if (!columns.isEmpty()) {
            json.put("column_names", new JsonArray(List.copyOf(columns)));
        }
        return json;
    }
}
