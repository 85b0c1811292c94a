package infra.director.mcp.servers;

import infra.director.db.InMemoryQueryCursor;
import infra.director.db.ScriptedDatabase;
import infra.director.mcp.base.MCPResponse;
import infra.director.schema.FallbackQueryExecutor;
import infra.director.schema.RowNormalizer;
import infra.director.schema.SchemaAssembler;
import infra.director.schema.SchemaCache;
import infra.director.services.DatabaseManager;
import infra.director.services.MCPRouterService;
import infra.director.services.ReadOnlyQueryService;
import infra.director.services.SchemaExplorerService;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.ThreadingModel;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;

/**
 * Tool calls over HTTP through the router, against a scripted database.
 */
@ExtendWith(VertxExtension.class)
public class DatabaseServersTest {

    private WebClient client;
    private int port;

    @BeforeEach
    void deploy(Vertx vertx, VertxTestContext testContext) {
        ScriptedDatabase database = new ScriptedDatabase("postgres")
            .on("information_schema.tables", () -> new InMemoryQueryCursor("table_name").row("orders").row("customers"))
            .on("SELECT id FROM orders", () -> new InMemoryQueryCursor("id").row(7));
        DatabaseManager manager = new DatabaseManager(vertx);
        manager.registerDatabase("main", database);

        RowNormalizer normalizer = new RowNormalizer();
        SchemaExplorerService explorer = new SchemaExplorerService(vertx, manager,
            new SchemaAssembler(new FallbackQueryExecutor(normalizer, vertx), vertx),
            new SchemaCache(Duration.ofMinutes(5), vertx));
        ReadOnlyQueryService queryService = new ReadOnlyQueryService(vertx, manager, normalizer);

        MCPRouterService router = new MCPRouterService(0);
        client = WebClient.create(vertx);
        vertx.deployVerticle(router)
            .compose(id -> Future.all(
                vertx.deployVerticle(new DatabaseSchemaServer(explorer, manager),
                    new DeploymentOptions().setThreadingModel(ThreadingModel.WORKER)),
                vertx.deployVerticle(new DatabaseQueryServer(queryService),
                    new DeploymentOptions().setThreadingModel(ThreadingModel.WORKER))))
            .onComplete(testContext.succeeding(v -> {
                port = router.actualPort();
                testContext.completeNow();
            }));
    }

    private Future<JsonObject> call(String path, String tool, JsonObject arguments) {
        JsonObject request = new JsonObject()
            .put("jsonrpc", "2.0")
            .put("id", "req-1")
            .put("method", "tools/call")
            .put("params", new JsonObject().put("name", tool).put("arguments", arguments));
        return client.post(port, "localhost", path + "/tools/call")
            .sendJsonObject(request)
            .map(response -> response.bodyAsJsonObject());
    }

    @Test
    @DisplayName("Tool list advertises the schema tools")
    void listsTools(VertxTestContext testContext) {
        JsonObject request = new JsonObject().put("jsonrpc", "2.0").put("id", "1").put("method", "tools/list");
        client.post(port, "localhost", DatabaseSchemaServer.PATH + "/tools/list")
            .sendJsonObject(request)
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                JsonObject body = response.bodyAsJsonObject();
                Assertions.assertEquals(4, body.getJsonObject("result").getJsonArray("tools").size());
                Assertions.assertEquals(DatabaseSchemaServer.TOOL_SCHEMA,
                    body.getJsonObject("result").getJsonArray("tools").getJsonObject(0).getString("name"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("dbSchema returns the table list")
    void schemaTables(VertxTestContext testContext) {
        call(DatabaseSchemaServer.PATH, DatabaseSchemaServer.TOOL_SCHEMA,
            new JsonObject().put("component", "tables").put("database", "main"))
            .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
                JsonObject result = body.getJsonObject("result");
                Assertions.assertNotNull(result, body.encode());
                Assertions.assertEquals(2, result.getJsonArray("tables").size());
                Assertions.assertEquals("req-1", body.getString("id"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A body that is not JSON is a parse error")
    void unparsableBody(VertxTestContext testContext) {
        client.post(port, "localhost", DatabaseSchemaServer.PATH + "/tools/call")
            .putHeader("Content-Type", "application/json")
            .sendBuffer(Buffer.buffer("{\"jsonrpc\": \"2.0\", "))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                JsonObject error = response.bodyAsJsonObject().getJsonObject("error");
                Assertions.assertEquals(MCPResponse.ErrorCodes.PARSE_ERROR, error.getInteger("code"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Missing required arguments are invalid params")
    void missingArgument(VertxTestContext testContext) {
        call(DatabaseSchemaServer.PATH, DatabaseSchemaServer.TOOL_SCHEMA, new JsonObject().put("component", "tables"))
            .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
                JsonObject error = body.getJsonObject("error");
                Assertions.assertEquals(MCPResponse.ErrorCodes.INVALID_PARAMS, error.getInteger("code"));
                Assertions.assertEquals("database parameter is required", error.getString("message"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Unknown database maps to its own error code")
    void unknownDatabase(VertxTestContext testContext) {
        call(DatabaseSchemaServer.PATH, DatabaseSchemaServer.TOOL_SCHEMA,
            new JsonObject().put("component", "tables").put("database", "nope"))
            .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
                Assertions.assertEquals(MCPResponse.ErrorCodes.DATABASE_NOT_FOUND,
                    body.getJsonObject("error").getInteger("code"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Exhausted fallbacks report the failing operation and table")
    void introspectionFailureCarriesContext(VertxTestContext testContext) {
        call(DatabaseSchemaServer.PATH, DatabaseSchemaServer.TOOL_SCHEMA,
            new JsonObject().put("component", "columns").put("table", "orders").put("database", "main"))
            .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
                JsonObject error = body.getJsonObject("error");
                Assertions.assertNotNull(error, body.encode());
                Assertions.assertEquals(MCPResponse.ErrorCodes.INTERNAL_ERROR, error.getInteger("code"));
                Assertions.assertEquals("get_columns", error.getJsonObject("data").getString("operation"));
                Assertions.assertEquals("orders", error.getJsonObject("data").getString("table"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("dbList and dbSchemaInvalidate")
    void listAndInvalidate(VertxTestContext testContext) {
        call(DatabaseSchemaServer.PATH, DatabaseSchemaServer.TOOL_LIST, new JsonObject())
            .compose(list -> {
                testContext.verify(() -> Assertions.assertEquals("main",
                    list.getJsonObject("result").getJsonArray("databases").getJsonObject(0).getString("id")));
                return call(DatabaseSchemaServer.PATH, DatabaseSchemaServer.TOOL_INVALIDATE, new JsonObject());
            })
            .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
                Assertions.assertEquals("all", body.getJsonObject("result").getString("invalidated"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("dbQuery runs reads and rejects writes")
    void queryTool(VertxTestContext testContext) {
        call(DatabaseQueryServer.PATH, DatabaseQueryServer.TOOL_QUERY,
            new JsonObject().put("query", "SELECT id FROM orders").put("database", "main"))
            .compose(read -> {
                testContext.verify(() -> Assertions.assertEquals(1, read.getJsonObject("result").getInteger("rowCount")));
                return call(DatabaseQueryServer.PATH, DatabaseQueryServer.TOOL_QUERY,
                    new JsonObject().put("query", "DROP TABLE orders").put("database", "main"));
            })
            .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
                Assertions.assertEquals(MCPResponse.ErrorCodes.WRITE_REJECTED, body.getJsonObject("error").getInteger("code"));
                testContext.completeNow();
            })));
    }
}
