package infra.director.schema.model;

import infra.director.schema.Row;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The assembled schema of one database.
 * Every listed table is present in {@link #getTables()}; only tables whose columns
 * could be read have a {@link TableSchema}.
 */
public final class SchemaDocument {

    private final String dbType;
    private final List<String> tables;
    private final Map<String, TableSchema> detailedSchema;
    private final List<ForeignKeyReference> foreignKeys;
    private final EnumCatalog enumCatalog;
    private final List<Row> enumRows;

    public SchemaDocument(String dbType, List<String> tables, Map<String, TableSchema> detailedSchema,
                          List<ForeignKeyReference> foreignKeys, EnumCatalog enumCatalog, List<Row> enumRows) {
        this.dbType = dbType;
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.detailedSchema = Collections.unmodifiableMap(new LinkedHashMap<>(detailedSchema));
        this.foreignKeys = Collections.unmodifiableList(new ArrayList<>(foreignKeys));
        this.enumCatalog = enumCatalog;
        this.enumRows = Collections.unmodifiableList(new ArrayList<>(enumRows));
    }

    public String getDbType() {
        return dbType;
    }

    public List<String> getTables() {
        return tables;
    }

    public Map<String, TableSchema> getDetailedSchema() {
        return detailedSchema;
    }

    public TableSchema getTable(String name) {
        return detailedSchema.get(name);
    }

    public List<ForeignKeyReference> getForeignKeys() {
        return foreignKeys;
    }

    public EnumCatalog getEnumCatalog() {
        return enumCatalog;
    }

    public JsonObject toJson() {
        JsonObject detailed = new JsonObject();
        detailedSchema.forEach((name, table) -> detailed.put(name, table.toJson()));
        JsonArray foreignKeysJson = new JsonArray();
        foreignKeys.forEach(fk -> foreignKeysJson.add(fk.toJson()));
        JsonArray enumValues = new JsonArray();
        enumRows.forEach(row -> enumValues.add(row.toJson()));

        return new JsonObject()
                .put("tables", new JsonArray(new ArrayList<>(tables)))
                .put("detailed_schema", detailed)
                .put("foreign_keys", foreignKeysJson)
                .put("enum_types", enumCatalog.toJson())
                .put("enum_values", enumValues)
                .put("dbType", dbType);
    }
}
