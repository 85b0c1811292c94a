package infra.director.services;

import infra.director.db.DatabaseNotFoundException;
import infra.director.db.InMemoryQueryCursor;
import infra.director.db.ScriptedDatabase;
import infra.director.schema.RowNormalizer;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

@ExtendWith(VertxExtension.class)
public class ReadOnlyQueryServiceTest {

    private ScriptedDatabase database;
    private ReadOnlyQueryService service;

    @BeforeEach
    void setUp(Vertx vertx) {
        database = new ScriptedDatabase("postgres")
            .on("FROM orders", () -> new InMemoryQueryCursor("id", "status")
                .row(1, "pending")
                .row(2, "shipped"));
        DatabaseManager manager = new DatabaseManager(vertx);
        manager.registerDatabase("main", database);
        service = new ReadOnlyQueryService(vertx, manager, new RowNormalizer());
    }

    @Test
    @DisplayName("Rows come back with the query, its parameters and a count")
    void runsQuery(VertxTestContext testContext) {
        JsonArray params = new JsonArray().add("pending");
        service.execute("main", "SELECT id, status FROM orders WHERE status <> ?", params, null)
            .onComplete(testContext.succeeding(json -> testContext.verify(() -> {
                Assertions.assertEquals(2, json.getInteger("rowCount"));
                Assertions.assertEquals("shipped", json.getJsonArray("results").getJsonObject(1).getString("status"));
                Assertions.assertEquals(params, json.getJsonArray("params"));
                Assertions.assertEquals(List.of("pending"), database.getCalls().get(0).args);
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Joins selecting the same column name from two tables keep both values")
    void joinWithRepeatedLabels(VertxTestContext testContext) {
        database.on("FROM customers c JOIN orders o", () -> new InMemoryQueryCursor("id", "id", "email")
            .row(10, 3, "ann@example.com"));

        service.execute("main", "SELECT o.id, c.id, c.email FROM customers c JOIN orders o ON o.customer_id = c.id", null, null)
            .onComplete(testContext.succeeding(json -> testContext.verify(() -> {
                JsonObject row = json.getJsonArray("results").getJsonObject(0);
                Assertions.assertEquals(10, row.getInteger("id"));
                Assertions.assertEquals(3, row.getInteger("id_2"));
                Assertions.assertEquals("ann@example.com", row.getString("email"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Writes are rejected before the database is touched")
    void rejectsWrites(VertxTestContext testContext) {
        service.execute("main", "DELETE FROM orders", null, null)
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                Assertions.assertTrue(err instanceof ReadOnlyViolationException);
                Assertions.assertTrue(database.getCalls().isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Unknown database is reported")
    void unknownDatabase(VertxTestContext testContext) {
        service.execute("other", "SELECT 1", null, null)
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                Assertions.assertTrue(err instanceof DatabaseNotFoundException);
                testContext.completeNow();
            })));
    }
}
