package infra.director.db;

import java.sql.SQLException;
import java.util.List;

/**
 * A query-capable handle on one configured database.
 * Implementations must be safe for concurrent use.
 */
public interface Database {

    /**
     * Database kind identifier, e.g. <code>postgres</code> or <code>mysql</code>.
     */
    String driverName();

    /**
     * Default per-query timeout configured for this database, in seconds.
     */
    int queryTimeoutSeconds();

    /**
     * Run a query with positional arguments bound to its <code>?</code> placeholders.
     * The returned cursor must be closed by the caller.
     *
     * @throws QueryCancelledException when the context is done before or while the query runs
     */
    QueryCursor query(QueryContext context, String sql, List<Object> args) throws SQLException;
}
