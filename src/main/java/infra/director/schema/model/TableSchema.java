package infra.director.schema.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything known about one table. Optional sections are empty, never null.
 */
public final class TableSchema {

    private final String name;
    private final List<ColumnDescriptor> columns;
    private final List<String> primaryKeys;
    private final List<IndexDescriptor> indexes;
    private final List<ConstraintDescriptor> uniqueConstraints;
    private final TableStatistics statistics;
    private final List<ForeignKeyReference> foreignKeys;

    private TableSchema(Builder builder) {
        this.name = builder.name;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.primaryKeys = Collections.unmodifiableList(new ArrayList<>(builder.primaryKeys));
        this.indexes = Collections.unmodifiableList(new ArrayList<>(builder.indexes));
        this.uniqueConstraints = Collections.unmodifiableList(new ArrayList<>(builder.uniqueConstraints));
        this.statistics = builder.statistics == null ? TableStatistics.empty() : builder.statistics;
        this.foreignKeys = Collections.unmodifiableList(new ArrayList<>(builder.foreignKeys));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    public List<String> getPrimaryKeys() {
        return primaryKeys;
    }

    public List<IndexDescriptor> getIndexes() {
        return indexes;
    }

    public List<ConstraintDescriptor> getUniqueConstraints() {
        return uniqueConstraints;
    }

    public TableStatistics getStatistics() {
        return statistics;
    }

    public List<ForeignKeyReference> getForeignKeys() {
        return foreignKeys;
    }

    public JsonObject toJson() {
        JsonArray columnsJson = new JsonArray();
        columns.forEach(column -> columnsJson.add(column.toJson()));
        JsonArray indexesJson = new JsonArray();
        indexes.forEach(index -> indexesJson.add(index.toJson()));
        JsonArray uniqueJson = new JsonArray();
        uniqueConstraints.forEach(constraint -> uniqueJson.add(constraint.toJson()));
        JsonArray foreignKeysJson = new JsonArray();
        foreignKeys.forEach(fk -> foreignKeysJson.add(fk.toJson()));

        return new JsonObject()
                .put("columns", columnsJson)
                .put("primary_keys", new JsonArray(new ArrayList<>(primaryKeys)))
                .put("indexes", indexesJson)
                .put("unique_constraints", uniqueJson)
                .put("statistics", statistics.toJson())
                .put("foreign_keys", foreignKeysJson);
    }

    public static final class Builder {
        private final String name;
        private final List<ColumnDescriptor> columns = new ArrayList<>();
        private final List<String> primaryKeys = new ArrayList<>();
        private final List<IndexDescriptor> indexes = new ArrayList<>();
        private final List<ConstraintDescriptor> uniqueConstraints = new ArrayList<>();
        private final List<ForeignKeyReference> foreignKeys = new ArrayList<>();
        private TableStatistics statistics;

        private Builder(String name) {
            this.name = name;
        }

        public Builder columns(List<ColumnDescriptor> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder primaryKeys(List<String> primaryKeys) {
            this.primaryKeys.addAll(primaryKeys);
            return this;
        }

        public Builder indexes(List<IndexDescriptor> indexes) {
            this.indexes.addAll(indexes);
            return this;
        }

        public Builder uniqueConstraints(List<ConstraintDescriptor> uniqueConstraints) {
            this.uniqueConstraints.addAll(uniqueConstraints);
            return this;
        }

        public Builder statistics(TableStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder foreignKeys(List<ForeignKeyReference> foreignKeys) {
            this.foreignKeys.addAll(foreignKeys);
            return this;
        }

        public TableSchema build() {
            return new TableSchema(this);
        }
    }
}
