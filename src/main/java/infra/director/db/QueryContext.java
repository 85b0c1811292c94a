package infra.director.db;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deadline and cancellation state shared by every query issued for one tool call.
 *
 * <p>Statements register themselves while they are running so that {@link #cancel()}
 * can interrupt them on the database side.</p>
 */
public class QueryContext {

    /** Longest deadline a tool call may ask for. */
    public static final long MAX_TIMEOUT_MILLIS = Duration.ofHours(24).toMillis();

    private final long deadlineNanos;
    private final long timeoutMillis;
    private final Set<Statement> activeStatements = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    private QueryContext(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
        this.deadlineNanos = System.nanoTime() + Duration.ofMillis(timeoutMillis).toNanos();
    }

    public static QueryContext withTimeout(long timeoutMillis) {
        if (timeoutMillis <= 0 || timeoutMillis > MAX_TIMEOUT_MILLIS) {
            throw new IllegalArgumentException("timeout must be between 1 and " + MAX_TIMEOUT_MILLIS + "ms: " + timeoutMillis);
        }
        return new QueryContext(timeoutMillis);
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public long remainingMillis() {
        return Math.max(0, Duration.ofNanos(deadlineNanos - System.nanoTime()).toMillis());
    }

    public boolean isExpired() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDone() {
        return cancelled || isExpired();
    }

    /**
     * @throws QueryCancelledException if the context is cancelled or past its deadline
     */
    public void checkActive() throws QueryCancelledException {
        if (cancelled) {
            throw new QueryCancelledException("operation cancelled");
        }
        if (isExpired()) {
            throw new QueryCancelledException("operation did not complete within " + timeoutMillis + "ms");
        }
    }

    /**
     * JDBC query timeout for the next statement: remaining time rounded up to
     * whole seconds, at least 1, capped by the database's own limit.
     */
    public int statementTimeoutSeconds(int databaseLimitSeconds) {
        long remaining = remainingMillis();
        int seconds = (int) Math.min(Integer.MAX_VALUE, Math.max(1, (remaining + 999) / 1000));
        if (databaseLimitSeconds > 0) {
            seconds = Math.min(seconds, databaseLimitSeconds);
        }
        return seconds;
    }

    /**
     * Track a running statement. If the context was cancelled meanwhile the
     * statement is cancelled straight away.
     */
    public void register(Statement statement) throws SQLException {
        activeStatements.add(statement);
        if (cancelled) {
            statement.cancel();
        }
    }

    public void unregister(Statement statement) {
        activeStatements.remove(statement);
    }

    public int activeStatementCount() {
        return activeStatements.size();
    }

    /**
     * Mark the context cancelled and cancel every registered statement.
     *
     * @return failures reported by drivers while cancelling; empty when all went through
     */
    public List<SQLException> cancel() {
        cancelled = true;
        List<SQLException> failures = new ArrayList<>();
        for (Statement statement : activeStatements) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                failures.add(e);
            }
        }
        return failures;
    }
}
