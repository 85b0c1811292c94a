package infra.director.db;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class JdbcDatabaseTest {

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;
    @Mock
    private ResultSetMetaData metaData;

    private JdbcDatabase database;

    @BeforeEach
    void setUp() {
        database = new JdbcDatabase("main", "postgres", dataSource, 30);
    }

    @Test
    @DisplayName("Arguments bind in order and the cursor releases every resource")
    void queryBindsAndCloses() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement("SELECT column_name FROM t WHERE a = ? AND b = ?")).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(1);
        when(metaData.getColumnLabel(1)).thenReturn("column_name");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn("id");

        QueryContext context = QueryContext.withTimeout(10_000);
        QueryCursor cursor = database.query(context, "SELECT column_name FROM t WHERE a = ? AND b = ?", List.of("orders", 5));

        verify(statement).setObject(1, "orders");
        verify(statement).setObject(2, 5);
        verify(statement).setQueryTimeout(anyInt());
        Assertions.assertEquals(1, context.activeStatementCount());

        Assertions.assertEquals(List.of("column_name"), cursor.columnNames());
        Assertions.assertTrue(cursor.next());
        Assertions.assertEquals("id", cursor.getObject(1));
        Assertions.assertFalse(cursor.next());
        cursor.close();

        verify(resultSet).close();
        verify(statement).close();
        verify(connection).close();
        Assertions.assertEquals(0, context.activeStatementCount());
    }

    @Test
    @DisplayName("Failed statements release the connection and keep the driver error")
    void failureReleasesConnection() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement("SELECT * FROM pg_catalog.nothing")).thenReturn(statement);
        when(statement.executeQuery()).thenThrow(new SQLException("relation does not exist"));

        QueryContext context = QueryContext.withTimeout(10_000);
        SQLException e = Assertions.assertThrows(SQLException.class,
            () -> database.query(context, "SELECT * FROM pg_catalog.nothing", List.of()));

        Assertions.assertFalse(e instanceof QueryCancelledException);
        verify(statement).close();
        verify(connection).close();
        Assertions.assertEquals(0, context.activeStatementCount());
    }

    @Test
    @DisplayName("Driver runtime errors while binding still return the connection to the pool")
    void bindingErrorReleasesConnection() throws SQLException {
        Object unbindable = new Object();
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement("SELECT * FROM orders WHERE meta = ?")).thenReturn(statement);
        doThrow(new IllegalArgumentException("cannot infer SQL type")).when(statement).setObject(1, unbindable);

        QueryContext context = QueryContext.withTimeout(10_000);
        SQLException e = Assertions.assertThrows(SQLException.class,
            () -> database.query(context, "SELECT * FROM orders WHERE meta = ?", List.of(unbindable)));

        Assertions.assertTrue(e.getCause() instanceof IllegalArgumentException);
        verify(statement).close();
        verify(connection).close();
        verify(statement, never()).executeQuery();
    }

    @Test
    @DisplayName("Errors after cancellation surface as cancellation")
    void cancelledQuery() throws SQLException {
        QueryContext context = QueryContext.withTimeout(10_000);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement("SELECT pg_sleep(10)")).thenReturn(statement);
        when(statement.executeQuery()).thenAnswer(invocation -> {
            context.cancel();
            throw new SQLException("canceling statement due to user request");
        });

        Assertions.assertThrows(QueryCancelledException.class,
            () -> database.query(context, "SELECT pg_sleep(10)", List.of()));
        verify(statement, atLeastOnce()).cancel();
    }

    @Test
    @DisplayName("A done context never borrows a connection")
    void doneContext() throws SQLException {
        QueryContext context = QueryContext.withTimeout(10_000);
        context.cancel();

        Assertions.assertThrows(QueryCancelledException.class, () -> database.query(context, "SELECT 1", List.of()));
        verify(dataSource, never()).getConnection();
    }
}
