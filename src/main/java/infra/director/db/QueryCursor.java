package infra.director.db;

import java.sql.SQLException;
import java.util.List;

/**
 * Forward-only row cursor over one query result.
 * Holds database resources until closed.
 */
public interface QueryCursor extends AutoCloseable {

    /**
     * Column labels in result order.
     */
    List<String> columnNames() throws SQLException;

    /**
     * Advance to the next row.
     *
     * @throws QueryCancelledException when the owning context is done
     */
    boolean next() throws SQLException;

    /**
     * Value of the given 1-based column of the current row.
     */
    Object getObject(int columnIndex) throws SQLException;

    @Override
    void close() throws SQLException;
}
