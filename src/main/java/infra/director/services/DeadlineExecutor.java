package infra.director.services;

import infra.director.db.QueryContext;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.sql.SQLException;
import java.util.List;

import static infra.director.services.LogUtil.*;

/**
 * Runs blocking database work on a worker thread under a {@link QueryContext}
 * whose deadline is enforced by a Vert.x timer.
 */
public class DeadlineExecutor {

    @FunctionalInterface
    public interface ContextTask<T> {
        T run(QueryContext context) throws Exception;
    }

    private final Vertx vertx;

    public DeadlineExecutor(Vertx vertx) {
        this.vertx = vertx;
    }

    /**
     * When the timer fires, running statements are cancelled off the event loop
     * since JDBC cancellation may block.
     */
    public <T> Future<T> run(long timeoutMillis, String operation, ContextTask<T> task) {
        QueryContext context;
        try {
            context = QueryContext.withTimeout(timeoutMillis);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        long timerId = vertx.setTimer(timeoutMillis, id -> vertx.executeBlocking(() -> {
            List<SQLException> failures = context.cancel();
            for (SQLException failure : failures) {
                logWarn(vertx, operation + ": failed to cancel statement: " + failure.getMessage(),
                    "DeadlineExecutor", "Cancel", "Database");
            }
            return failures.size();
        }, false));

        return vertx.<T>executeBlocking(() -> task.run(context), false)
            .onComplete(ar -> vertx.cancelTimer(timerId));
    }
}
