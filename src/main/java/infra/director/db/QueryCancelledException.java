package infra.director.db;

import java.sql.SQLTimeoutException;

/**
 * Raised by the database layer when a {@link QueryContext} has expired or been cancelled.
 */
public class QueryCancelledException extends SQLTimeoutException {

    public QueryCancelledException(String reason) {
        super(reason);
    }

    public QueryCancelledException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
