package infra.director.schema;

import java.sql.SQLException;

/**
 * Every candidate query for a facet failed. The cause is the last candidate's error.
 */
public class FallbackExhaustedException extends SchemaIntrospectionException {

    private final int attemptCount;

    public FallbackExhaustedException(String operation, String table, int attemptCount, SQLException lastError) {
        super(operation + " failed after trying " + attemptCount + " fallback queries: "
                + (lastError == null ? "no candidate queries available" : lastError.getMessage()),
                operation, table, lastError);
        this.attemptCount = attemptCount;
    }

    public int getAttemptCount() {
        return attemptCount;
    }
}
