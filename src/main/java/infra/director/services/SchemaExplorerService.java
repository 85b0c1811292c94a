package infra.director.services;

import infra.director.db.Database;
import infra.director.db.DatabaseNotFoundException;
import infra.director.db.QueryContext;
import infra.director.schema.Facet;
import infra.director.schema.InvalidSchemaRequestException;
import infra.director.schema.SchemaAssembler;
import infra.director.schema.SchemaCache;
import infra.director.schema.model.SchemaDocument;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.Optional;

import static infra.director.services.LogUtil.*;

/**
 * Tool-facing entry point for schema introspection.
 *
 * <p>Validates the request, resolves the database, then runs the assembler on a
 * worker thread under the caller's timeout. Full schemas are served from the
 * {@link SchemaCache} while fresh.</p>
 */
public class SchemaExplorerService {

    public static final long DEFAULT_TIMEOUT_MS = 10_000;

    public static final String COMPONENT_TABLES = "tables";
    public static final String COMPONENT_COLUMNS = "columns";
    public static final String COMPONENT_RELATIONSHIPS = "relationships";
    public static final String COMPONENT_FULL = "full";
    /** Facet table filter meaning every table, same as an empty filter. */
    public static final String ALL_TABLES = "all";

    private final Vertx vertx;
    private final DatabaseManager databaseManager;
    private final SchemaAssembler assembler;
    private final SchemaCache cache;
    private final DeadlineExecutor deadlineExecutor;

    public SchemaExplorerService(Vertx vertx, DatabaseManager databaseManager, SchemaAssembler assembler, SchemaCache cache) {
        this.vertx = vertx;
        this.databaseManager = databaseManager;
        this.assembler = assembler;
        this.cache = cache;
        this.deadlineExecutor = new DeadlineExecutor(vertx);
    }

    /**
     * @param component one of tables, columns, relationships, full
     * @param table required for columns, optional filter for relationships
     * @param timeoutMs null for the default
     * @param refresh rebuild a full schema even when a fresh copy is cached
     */
    public Future<JsonObject> explore(String databaseId, String component, String table, Long timeoutMs, boolean refresh) {
        long timeout;
        Database database;
        try {
            if (component == null || component.isEmpty()) {
                throw new InvalidSchemaRequestException("component parameter is required", "explore");
            }
            timeout = resolveTimeout(timeoutMs);
            database = databaseManager.getDatabase(databaseId);
        } catch (InvalidSchemaRequestException | DatabaseNotFoundException e) {
            return Future.failedFuture(e);
        }
        String tableArg = table == null ? "" : table;

        switch (component) {
            case COMPONENT_TABLES:
                return deadlineExecutor.run(timeout, "tables",
                    ctx -> assembler.getTables(ctx, database).toJson());
            case COMPONENT_COLUMNS:
                if (tableArg.isEmpty()) {
                    return Future.failedFuture(new InvalidSchemaRequestException(
                        "table parameter is required for columns component", Facet.COLUMNS.getOperationName()));
                }
                return deadlineExecutor.run(timeout, "columns",
                    ctx -> assembler.getColumns(ctx, database, tableArg).toJson());
            case COMPONENT_RELATIONSHIPS:
                return deadlineExecutor.run(timeout, "relationships",
                    ctx -> assembler.getRelationships(ctx, database, tableArg).toJson());
            case COMPONENT_FULL:
                return fullSchema(databaseId, database, timeout, refresh);
            default:
                return Future.failedFuture(new InvalidSchemaRequestException("invalid component: " + component, "explore"));
        }
    }

    /**
     * Narrow single-facet lookups: primary_keys, indexes, unique_constraints, statistics, enum_values.
     */
    public Future<JsonObject> exploreFacet(String databaseId, String component, String table, Long timeoutMs) {
        Facet facet = Facet.fromComponent(component);
        if (facet == null) {
            return Future.failedFuture(new InvalidSchemaRequestException("invalid component: " + component, "exploreFacet"));
        }
        long timeout;
        Database database;
        try {
            timeout = resolveTimeout(timeoutMs);
            database = databaseManager.getDatabase(databaseId);
        } catch (InvalidSchemaRequestException | DatabaseNotFoundException e) {
            return Future.failedFuture(e);
        }
        String tableArg = table == null || ALL_TABLES.equalsIgnoreCase(table) ? "" : table;
        return deadlineExecutor.run(timeout, component,
            ctx -> assembler.getFacet(ctx, database, facet, tableArg).toJson());
    }

    public void invalidate(String databaseId) {
        if (databaseId == null || databaseId.isEmpty()) {
            cache.invalidateAll();
        } else {
            cache.invalidate(databaseId);
        }
    }

    private Future<JsonObject> fullSchema(String databaseId, Database database, long timeout, boolean refresh) {
        if (!refresh) {
            Optional<SchemaDocument> cached = cache.get(databaseId, SchemaDocument.class);
            if (cached.isPresent()) {
                return Future.succeededFuture(cached.get().toJson());
            }
        }
        return deadlineExecutor.run(timeout, "full", ctx -> {
            SchemaDocument document = assembler.getFullSchema(ctx, database);
            cache.set(databaseId, document);
            logInfo(vertx, "Assembled schema for " + databaseId + " with " + document.getTables().size() + " tables",
                "SchemaExplorerService", "FullSchema", "Schema");
            return document.toJson();
        });
    }

    private static long resolveTimeout(Long timeoutMs) throws InvalidSchemaRequestException {
        if (timeoutMs == null) {
            return DEFAULT_TIMEOUT_MS;
        }
        if (timeoutMs <= 0 || timeoutMs > QueryContext.MAX_TIMEOUT_MILLIS) {
            throw new InvalidSchemaRequestException("timeout must be between 1 and "
                + QueryContext.MAX_TIMEOUT_MILLIS + " milliseconds", "explore");
        }
        return timeoutMs;
    }
}
