package infra.director.db;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link QueryCursor} over a JDBC result set. Owns the result set, its statement
 * and the pooled connection, and releases all three on close.
 */
public class JdbcQueryCursor implements QueryCursor {

    private final Connection connection;
    private final Statement statement;
    private final ResultSet resultSet;
    private final QueryContext context;
    private List<String> columnNames;
    private boolean closed;

    public JdbcQueryCursor(Connection connection, Statement statement, ResultSet resultSet, QueryContext context) {
        this.connection = connection;
        this.statement = statement;
        this.resultSet = resultSet;
        this.context = context;
    }

    @Override
    public List<String> columnNames() throws SQLException {
        if (columnNames == null) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            List<String> names = new ArrayList<>(metaData.getColumnCount());
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                names.add(metaData.getColumnLabel(i));
            }
            columnNames = Collections.unmodifiableList(names);
        }
        return columnNames;
    }

    @Override
    public boolean next() throws SQLException {
        context.checkActive();
        try {
            return resultSet.next();
        } catch (SQLException e) {
            if (context.isDone()) {
                throw new QueryCancelledException("row iteration interrupted: " + e.getMessage(), e);
            }
            throw e;
        }
    }

    @Override
    public Object getObject(int columnIndex) throws SQLException {
        return resultSet.getObject(columnIndex);
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        context.unregister(statement);
        SQLException failure = null;
        for (AutoCloseable resource : new AutoCloseable[] {resultSet, statement, connection}) {
            try {
                if (resource != null) {
                    resource.close();
                }
            } catch (Exception e) {
                if (failure == null) {
                    failure = e instanceof SQLException ? (SQLException) e : new SQLException(e.getMessage(), e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
