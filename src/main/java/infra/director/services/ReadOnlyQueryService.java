package infra.director.services;

import infra.director.db.Database;
import infra.director.db.DatabaseNotFoundException;
import infra.director.db.QueryContext;
import infra.director.schema.Row;
import infra.director.schema.RowNormalizer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

import static infra.director.services.LogUtil.*;

/**
 * Runs validated read-only statements with positional parameters.
 */
public class ReadOnlyQueryService {

    private final Vertx vertx;
    private final DatabaseManager databaseManager;
    private final RowNormalizer normalizer;
    private final DeadlineExecutor deadlineExecutor;

    public ReadOnlyQueryService(Vertx vertx, DatabaseManager databaseManager, RowNormalizer normalizer) {
        this.vertx = vertx;
        this.databaseManager = databaseManager;
        this.normalizer = normalizer;
        this.deadlineExecutor = new DeadlineExecutor(vertx);
    }

    /**
     * @param timeoutMs null for the database's configured query timeout
     */
    public Future<JsonObject> execute(String databaseId, String query, JsonArray params, Long timeoutMs) {
        Database database;
        try {
            ReadOnlyQueryValidator.validate(query);
            database = databaseManager.getDatabase(databaseId);
        } catch (ReadOnlyViolationException | DatabaseNotFoundException e) {
            return Future.failedFuture(e);
        }
        if (timeoutMs != null && (timeoutMs <= 0 || timeoutMs > QueryContext.MAX_TIMEOUT_MILLIS)) {
            return Future.failedFuture(new IllegalArgumentException(
                "timeout must be between 1 and " + QueryContext.MAX_TIMEOUT_MILLIS + " milliseconds"));
        }
        long timeout = timeoutMs != null ? timeoutMs : database.queryTimeoutSeconds() * 1000L;

        JsonArray paramsJson = params == null ? new JsonArray() : params;
        List<Object> args = new ArrayList<>(paramsJson.getList());

        logData(vertx, "dbQuery on " + databaseId + ": " + query + " params=" + paramsJson.encode(),
            "ReadOnlyQueryService", "Execute", "Database");
        return deadlineExecutor.run(timeout, "dbQuery", ctx -> {
            long start = System.currentTimeMillis();
            List<Row> rows = normalizer.normalize(database.query(ctx, query, args));
            logDebug(vertx, "Query on " + databaseId + " returned " + rows.size() + " rows in "
                    + (System.currentTimeMillis() - start) + "ms", "ReadOnlyQueryService", "Execute", "Database");

            JsonArray results = new JsonArray();
            rows.forEach(row -> results.add(row.toJson()));
            return new JsonObject()
                .put("results", results)
                .put("query", query)
                .put("params", paramsJson)
                .put("rowCount", rows.size());
        });
    }
}
