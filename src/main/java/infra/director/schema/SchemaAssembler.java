package infra.director.schema;

import infra.director.db.Database;
import infra.director.db.QueryContext;
import infra.director.schema.dialect.DialectStrategies;
import infra.director.schema.dialect.DialectStrategy;
import infra.director.schema.model.ColumnDescriptor;
import infra.director.schema.model.ConstraintDescriptor;
import infra.director.schema.model.EnumCatalog;
import infra.director.schema.model.ForeignKeyReference;
import infra.director.schema.model.IndexDescriptor;
import infra.director.schema.model.SchemaDocument;
import infra.director.schema.model.TableSchema;
import infra.director.schema.model.TableStatistics;
import io.vertx.core.Vertx;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static infra.director.services.LogUtil.*;

/**
 * Runs introspection operations against one database and builds the schema document.
 *
 * <p>Only the table list is mandatory for a full schema. Enums, statistics, keys,
 * indexes, constraints and relationships degrade to empty on failure; a table whose
 * columns cannot be read is listed but gets no detailed entry. Timeouts are never
 * degraded and always abort the call.</p>
 */
public class SchemaAssembler {

    private final FallbackQueryExecutor executor;
    private final Vertx vertx;

    public SchemaAssembler(FallbackQueryExecutor executor, Vertx vertx) {
        this.executor = executor;
        this.vertx = vertx;
    }

    public FacetResult getTables(QueryContext context, Database database) throws SchemaIntrospectionException {
        DialectStrategy strategy = strategyFor(database);
        List<Row> rows = executor.execute(context, database, strategy.tablesQueries());
        return new FacetResult(Facet.TABLES, database.driverName(), null, rows);
    }

    /**
     * @throws InvalidSchemaRequestException when table is empty; no query is issued
     */
    public FacetResult getColumns(QueryContext context, Database database, String table) throws SchemaIntrospectionException {
        if (table == null || table.isEmpty()) {
            throw new InvalidSchemaRequestException("table parameter is required for columns component",
                    Facet.COLUMNS.getOperationName());
        }
        DialectStrategy strategy = strategyFor(database);
        List<Row> rows = executor.execute(context, database, strategy.columnsQueries(table), table);
        return new FacetResult(Facet.COLUMNS, database.driverName(), table, rows);
    }

    public FacetResult getRelationships(QueryContext context, Database database, String table) throws SchemaIntrospectionException {
        return tableScoped(context, database, Facet.RELATIONSHIPS, table);
    }

    public FacetResult getPrimaryKeys(QueryContext context, Database database, String table) throws SchemaIntrospectionException {
        return tableScoped(context, database, Facet.PRIMARY_KEYS, table);
    }

    public FacetResult getIndexes(QueryContext context, Database database, String table) throws SchemaIntrospectionException {
        return tableScoped(context, database, Facet.INDEXES, table);
    }

    public FacetResult getUniqueConstraints(QueryContext context, Database database, String table) throws SchemaIntrospectionException {
        return tableScoped(context, database, Facet.UNIQUE_CONSTRAINTS, table);
    }

    /**
     * Statistics are best effort: a failure yields an empty result.
     */
    public FacetResult getTableStats(QueryContext context, Database database, String table) throws IntrospectionTimeoutException {
        try {
            return tableScoped(context, database, Facet.TABLE_STATS, table);
        } catch (IntrospectionTimeoutException e) {
            throw e;
        } catch (SchemaIntrospectionException e) {
            logWarn(vertx, "Failed to get table stats: " + e.getMessage(), "SchemaAssembler", "GetTableStats", "Schema");
            return new FacetResult(Facet.TABLE_STATS, database.driverName(), table, List.of());
        }
    }

    /**
     * Enums are best effort: engines without enum support yield an empty result.
     */
    public FacetResult getEnumValues(QueryContext context, Database database) throws IntrospectionTimeoutException {
        DialectStrategy strategy = strategyFor(database);
        try {
            List<Row> rows = executor.execute(context, database, strategy.enumValuesQueries());
            return new FacetResult(Facet.ENUM_VALUES, database.driverName(), null, rows);
        } catch (IntrospectionTimeoutException e) {
            throw e;
        } catch (SchemaIntrospectionException e) {
            logWarn(vertx, "Failed to get enum values (may not be supported): " + e.getMessage(),
                    "SchemaAssembler", "GetEnumValues", "Schema");
            return new FacetResult(Facet.ENUM_VALUES, database.driverName(), null, List.of());
        }
    }

    public FacetResult getFacet(QueryContext context, Database database, Facet facet, String table) throws SchemaIntrospectionException {
        switch (facet) {
            case TABLES:
                return getTables(context, database);
            case COLUMNS:
                return getColumns(context, database, table);
            case ENUM_VALUES:
                return getEnumValues(context, database);
            case TABLE_STATS:
                return getTableStats(context, database, table);
            default:
                return tableScoped(context, database, facet, table);
        }
    }

    public SchemaDocument getFullSchema(QueryContext context, Database database) throws SchemaIntrospectionException {
        DialectStrategy strategy = strategyFor(database);

        List<String> tableNames = tableNames(getTables(context, database).getRows());

        FacetResult enums = getEnumValues(context, database);
        EnumCatalog enumCatalog = EnumCatalog.fromRows(enums.getRows());

        Map<String, TableStatistics> statsByTable = new HashMap<>();
        for (Row row : getTableStats(context, database, "").getRows()) {
            String tableName = row.getString("table_name");
            if (tableName != null) {
                statsByTable.put(tableName, TableStatistics.fromRow(row));
            }
        }

        Map<String, TableSchema.Builder> builders = new LinkedHashMap<>();
        for (String tableName : tableNames) {
            List<ColumnDescriptor> columns;
            try {
                columns = enrichColumns(strategy, tableName, getColumns(context, database, tableName).getRows(), enumCatalog);
            } catch (IntrospectionTimeoutException e) {
                throw e;
            } catch (SchemaIntrospectionException e) {
                logWarn(vertx, "Failed to get columns for table " + tableName + ": " + e.getMessage(),
                        "SchemaAssembler", "GetFullSchema", "Schema");
                continue;
            }

            List<String> primaryKeys = new ArrayList<>();
            for (Row row : optionalRows(context, database, Facet.PRIMARY_KEYS, tableName)) {
                String column = row.getString("column_name");
                if (column != null) {
                    primaryKeys.add(column);
                }
            }
            List<IndexDescriptor> indexes = new ArrayList<>();
            for (Row row : optionalRows(context, database, Facet.INDEXES, tableName)) {
                indexes.add(IndexDescriptor.fromRow(row));
            }
            List<ConstraintDescriptor> uniqueConstraints = new ArrayList<>();
            for (Row row : optionalRows(context, database, Facet.UNIQUE_CONSTRAINTS, tableName)) {
                uniqueConstraints.add(ConstraintDescriptor.fromRow(row));
            }

            builders.put(tableName, TableSchema.builder(tableName)
                    .columns(columns)
                    .primaryKeys(primaryKeys)
                    .indexes(indexes)
                    .uniqueConstraints(uniqueConstraints)
                    .statistics(statsByTable.getOrDefault(tableName, TableStatistics.empty())));
        }

        List<ForeignKeyReference> foreignKeys = new ArrayList<>();
        Map<String, List<ForeignKeyReference>> foreignKeysByTable = new HashMap<>();
        for (Row row : optionalRows(context, database, Facet.RELATIONSHIPS, "")) {
            ForeignKeyReference reference = ForeignKeyReference.fromRow(row);
            foreignKeys.add(reference);
            if (reference.getTableName() != null) {
                foreignKeysByTable.computeIfAbsent(reference.getTableName(), k -> new ArrayList<>()).add(reference);
            }
        }

        Map<String, TableSchema> detailed = new LinkedHashMap<>();
        builders.forEach((tableName, builder) ->
                detailed.put(tableName, builder.foreignKeys(foreignKeysByTable.getOrDefault(tableName, List.of())).build()));

        logDebug(vertx, "Assembled schema for " + detailed.size() + "/" + tableNames.size() + " tables",
                "SchemaAssembler", "GetFullSchema", "Schema");
        return new SchemaDocument(database.driverName(), tableNames, detailed, foreignKeys, enumCatalog, enums.getRows());
    }

    private FacetResult tableScoped(QueryContext context, Database database, Facet facet, String table)
            throws SchemaIntrospectionException {
        DialectStrategy strategy = strategyFor(database);
        CandidateQueries candidates;
        switch (facet) {
            case RELATIONSHIPS:
                candidates = strategy.relationshipsQueries(table);
                break;
            case PRIMARY_KEYS:
                candidates = strategy.primaryKeysQueries(table);
                break;
            case INDEXES:
                candidates = strategy.indexesQueries(table);
                break;
            case UNIQUE_CONSTRAINTS:
                candidates = strategy.uniqueConstraintsQueries(table);
                break;
            case TABLE_STATS:
                candidates = strategy.tableStatsQueries(table);
                break;
            default:
                throw new InvalidSchemaRequestException("invalid component: " + facet.getResultKey(), facet.getOperationName());
        }
        List<Row> rows = executor.execute(context, database, candidates, table);
        return new FacetResult(facet, database.driverName(), table, rows);
    }

    /**
     * Rows of a supplementary facet, or none when it fails for any reason other than a timeout.
     */
    private List<Row> optionalRows(QueryContext context, Database database, Facet facet, String table)
            throws IntrospectionTimeoutException {
        try {
            return tableScoped(context, database, facet, table).getRows();
        } catch (IntrospectionTimeoutException e) {
            throw e;
        } catch (SchemaIntrospectionException e) {
            String scope = table.isEmpty() ? "" : " for table " + table;
            logWarn(vertx, "Failed to get " + facet.getResultKey() + scope + ": " + e.getMessage(),
                    "SchemaAssembler", "GetFullSchema", "Schema");
            return List.of();
        }
    }

    private List<ColumnDescriptor> enrichColumns(DialectStrategy strategy, String table, List<Row> rows, EnumCatalog enumCatalog) {
        List<ColumnDescriptor> columns = new ArrayList<>(rows.size());
        for (Row row : rows) {
            ColumnDescriptor column = ColumnDescriptor.fromRow(row);
            String enumType = null;
            if (strategy.userDefinedTypeMarker().equals(column.getDataType())) {
                enumType = column.getUdtName();
            } else if (column.getDataType() != null && column.getDataType().toLowerCase().startsWith("enum")) {
                enumType = EnumCatalog.mysqlKey(table, column.getName());
            }
            List<String> labels = enumCatalog.lookup(enumType);
            columns.add(labels == null ? column : column.withEnum(enumType, labels));
        }
        return columns;
    }

    /**
     * Table names in result order. Rows without a <code>table_name</code> label
     * (e.g. <code>SHOW TABLES</code>) use their first column.
     */
    static List<String> tableNames(List<Row> rows) {
        List<String> names = new ArrayList<>(rows.size());
        for (Row row : rows) {
            String name = row.has("table_name") ? row.getString("table_name") : row.first().asString();
            if (name != null && !name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private DialectStrategy strategyFor(Database database) {
        return DialectStrategies.forDriver(database.driverName(), vertx);
    }
}
