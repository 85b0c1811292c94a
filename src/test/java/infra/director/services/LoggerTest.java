package infra.director.services;

import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

@ExtendWith(VertxExtension.class)
public class LoggerTest {

    @Test
    void writesHeaderAndFlushedRecordsInOrder(Vertx vertx, VertxTestContext testContext, @TempDir Path dir) {
        String logsDir = dir.resolve("logs").toString();
        vertx.deployVerticle(new Logger(logsDir, 60_000L, 86_400_000L))
            .compose(id -> {
                vertx.eventBus().publish(Logger.LOG_ADDRESS, "first,2,Test,op,cat");
                vertx.eventBus().publish(Logger.LOG_ADDRESS, "second,2,Test,op,cat");
                return vertx.eventBus().<Boolean>request(Logger.FLUSH_ADDRESS, "now");
            })
            .compose(reply -> vertx.fileSystem().readFile(logsDir + "/" + Logger.CURRENT))
            .onComplete(testContext.succeeding(content -> testContext.verify(() -> {
                String[] lines = content.toString().split("\n");
                Assertions.assertEquals(3, lines.length);
                Assertions.assertEquals(Logger.HEADER.trim(), lines[0]);
                Assertions.assertTrue(lines[1].startsWith("first,2,Test,op,cat,1,"));
                Assertions.assertTrue(lines[2].startsWith("second,2,Test,op,cat,2,"));
                testContext.completeNow();
            })));
    }

    @Test
    void undeployFlushesPendingRecords(Vertx vertx, VertxTestContext testContext, @TempDir Path dir) {
        String logsDir = dir.toString();
        vertx.deployVerticle(new Logger(logsDir, 60_000L, 86_400_000L))
            .compose(id -> {
                vertx.eventBus().publish(Logger.LOG_ADDRESS, "bye,1,Test,stop,cat");
                Promise<Void> delivered = Promise.promise();
                vertx.setTimer(100, t -> delivered.complete());
                return delivered.future().compose(v -> vertx.undeploy(id));
            })
            .compose(v -> vertx.fileSystem().readFile(logsDir + "/" + Logger.CURRENT))
            .onComplete(testContext.succeeding(content -> testContext.verify(() -> {
                Assertions.assertTrue(content.toString().contains("bye,1,Test,stop,cat,1,"));
                testContext.completeNow();
            })));
    }
}
