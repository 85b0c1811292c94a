package infra.director.schema.model;

import infra.director.schema.Row;
import io.vertx.core.json.JsonObject;

/**
 * One column of a foreign key, from the owning table to the referenced one.
 */
public final class ForeignKeyReference {

    private final String constraintName;
    private final String tableSchema;
    private final String tableName;
    private final String columnName;
    private final String foreignTableSchema;
    private final String foreignTableName;
    private final String foreignColumnName;

    public ForeignKeyReference(String constraintName, String tableSchema, String tableName, String columnName,
                               String foreignTableSchema, String foreignTableName, String foreignColumnName) {
        this.constraintName = constraintName;
        this.tableSchema = tableSchema;
        this.tableName = tableName;
        this.columnName = columnName;
        this.foreignTableSchema = foreignTableSchema;
        this.foreignTableName = foreignTableName;
        this.foreignColumnName = foreignColumnName;
    }

    public static ForeignKeyReference fromRow(Row row) {
        return new ForeignKeyReference(
                row.getString("constraint_name"),
                row.getString("table_schema"),
                row.getString("table_name"),
                row.getString("column_name"),
                row.getString("foreign_table_schema"),
                row.getString("foreign_table_name"),
                row.getString("foreign_column_name"));
    }

    public String getConstraintName() {
        return constraintName;
    }

    public String getTableName() {
        return tableName;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getForeignTableName() {
        return foreignTableName;
    }

    public String getForeignColumnName() {
        return foreignColumnName;
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("table_schema", tableSchema)
                .put("constraint_name", constraintName)
                .put("table_name", tableName)
                .put("column_name", columnName)
                .put("foreign_table_schema", foreignTableSchema)
                .put("foreign_table_name", foreignTableName)
                .put("foreign_column_name", foreignColumnName);
    }
}
