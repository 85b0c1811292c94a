package infra.director.db;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * {@link Database} backed by a JDBC {@link DataSource} (a HikariCP pool in production).
 * Each query borrows a connection for the lifetime of its cursor.
 */
public class JdbcDatabase implements Database {

    private final String id;
    private final String driverName;
    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public JdbcDatabase(String id, String driverName, DataSource dataSource, int queryTimeoutSeconds) {
        this.id = id;
        this.driverName = driverName;
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public String getId() {
        return id;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    @Override
    public String driverName() {
        return driverName;
    }

    @Override
    public int queryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    @Override
    public QueryCursor query(QueryContext context, String sql, List<Object> args) throws SQLException {
        context.checkActive();

        Connection conn = dataSource.getConnection();
        PreparedStatement stmt = null;
        try {
            stmt = conn.prepareStatement(sql);
            for (int i = 0; i < args.size(); i++) {
                stmt.setObject(i + 1, args.get(i));
            }
            stmt.setQueryTimeout(context.statementTimeoutSeconds(queryTimeoutSeconds));

            context.register(stmt);
            ResultSet rs = stmt.executeQuery();
            return new JdbcQueryCursor(conn, stmt, rs, context);
        } catch (SQLException | RuntimeException failure) {
            // driver runtime errors (e.g. an unbindable parameter) must not leak the pooled connection
            SQLException e = failure instanceof SQLException
                ? (SQLException) failure
                : new SQLException("query failed: " + failure.getMessage(), failure);
            if (stmt != null) {
                context.unregister(stmt);
                closeQuietly(stmt, e);
            }
            closeQuietly(conn, e);
            if (context.isDone() && !(e instanceof QueryCancelledException)) {
                throw new QueryCancelledException("query interrupted: " + e.getMessage(), e);
            }
            throw e;
        }
    }

    private static void closeQuietly(AutoCloseable resource, SQLException primary) {
        try {
            resource.close();
        } catch (Exception closeError) {
            primary.addSuppressed(closeError);
        }
    }

    @Override
    public String toString() {
        return "JdbcDatabase{id='" + id + "', driver='" + driverName + "'}";
    }
}
