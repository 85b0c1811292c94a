package infra.director.db;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.mockito.Mockito.*;

public class QueryContextTest {

    @Test
    @DisplayName("Non-positive timeouts are rejected")
    void rejectsNonPositiveTimeout() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> QueryContext.withTimeout(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> QueryContext.withTimeout(-5));
    }

    @Test
    @DisplayName("Timeouts above the maximum are rejected instead of overflowing")
    void rejectsHugeTimeout() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> QueryContext.withTimeout(Long.MAX_VALUE));
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> QueryContext.withTimeout(QueryContext.MAX_TIMEOUT_MILLIS + 1));

        QueryContext longest = QueryContext.withTimeout(QueryContext.MAX_TIMEOUT_MILLIS);
        Assertions.assertEquals(86_400, longest.statementTimeoutSeconds(0));
        Assertions.assertEquals(30, longest.statementTimeoutSeconds(30));
    }

    @Test
    @DisplayName("Fresh context is active")
    void freshContextIsActive() throws QueryCancelledException {
        QueryContext context = QueryContext.withTimeout(60_000);
        Assertions.assertFalse(context.isDone());
        context.checkActive();
        Assertions.assertTrue(context.remainingMillis() > 0);
    }

    @Test
    @DisplayName("Expired context reports done")
    void expiredContextIsDone() throws InterruptedException {
        QueryContext context = QueryContext.withTimeout(1);
        Thread.sleep(20);
        Assertions.assertTrue(context.isExpired());
        Assertions.assertTrue(context.isDone());
        QueryCancelledException e = Assertions.assertThrows(QueryCancelledException.class, context::checkActive);
        Assertions.assertTrue(e.getMessage().contains("1ms"));
    }

    @Test
    @DisplayName("Cancel interrupts registered statements and collects driver failures")
    void cancelInterruptsStatements() throws SQLException {
        QueryContext context = QueryContext.withTimeout(60_000);
        Statement ok = mock(Statement.class);
        Statement broken = mock(Statement.class);
        doThrow(new SQLException("cancel not supported")).when(broken).cancel();
        context.register(ok);
        context.register(broken);

        List<SQLException> failures = context.cancel();

        verify(ok).cancel();
        verify(broken).cancel();
        Assertions.assertEquals(1, failures.size());
        Assertions.assertTrue(context.isCancelled());
        Assertions.assertThrows(QueryCancelledException.class, context::checkActive);
    }

    @Test
    @DisplayName("Statements registered after cancellation are cancelled immediately")
    void lateRegistrationIsCancelled() throws SQLException {
        QueryContext context = QueryContext.withTimeout(60_000);
        context.cancel();
        Statement statement = mock(Statement.class);
        context.register(statement);
        verify(statement).cancel();
        context.unregister(statement);
        Assertions.assertEquals(0, context.activeStatementCount());
    }

    @Test
    @DisplayName("Statement timeout rounds up and respects the database limit")
    void statementTimeoutSeconds() {
        QueryContext context = QueryContext.withTimeout(2_500);
        int seconds = context.statementTimeoutSeconds(0);
        Assertions.assertTrue(seconds >= 1 && seconds <= 3);
        Assertions.assertEquals(1, context.statementTimeoutSeconds(1));
    }
}
