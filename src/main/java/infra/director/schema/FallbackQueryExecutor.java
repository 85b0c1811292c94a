package infra.director.schema;

import infra.director.db.Database;
import infra.director.db.QueryCancelledException;
import infra.director.db.QueryContext;
import infra.director.db.QueryCursor;
import io.vertx.core.Vertx;

import java.sql.SQLException;
import java.util.List;

import static infra.director.services.LogUtil.*;

/**
 * Runs candidate queries strictly in order and returns the rows of the first that succeeds.
 */
public class FallbackQueryExecutor {

    private final RowNormalizer normalizer;
    private final Vertx vertx;

    public FallbackQueryExecutor(RowNormalizer normalizer, Vertx vertx) {
        this.normalizer = normalizer;
        this.vertx = vertx;
    }

    public List<Row> execute(QueryContext context, Database database, CandidateQueries candidates)
            throws SchemaIntrospectionException {
        return execute(context, database, candidates, null);
    }

    /**
     * @param table table the facet is scoped to, for error context only
     * @throws FallbackExhaustedException when every candidate failed
     * @throws IntrospectionTimeoutException when the context is done, before or between attempts
     */
    public List<Row> execute(QueryContext context, Database database, CandidateQueries candidates, String table)
            throws SchemaIntrospectionException {
        String operation = candidates.operationName();
        SQLException lastError = null;
        int attempts = 0;

        for (QueryCandidate candidate : candidates) {
            if (context.isDone()) {
                throw new IntrospectionTimeoutException(operation, table, lastError);
            }
            attempts++;
            try {
                QueryCursor cursor = database.query(context, candidate.getSql(), candidate.argumentValues());
                List<Row> rows = normalizer.normalize(cursor);
                if (attempts > 1) {
                    logDebug(vertx, operation + " succeeded with fallback query " + attempts,
                            "FallbackQueryExecutor", "Execute", "Schema");
                }
                return rows;
            } catch (QueryCancelledException e) {
                throw new IntrospectionTimeoutException(operation, table, e);
            } catch (SQLException e) {
                lastError = e;
                logWarn(vertx, operation + " query " + attempts + "/" + candidates.size() + " failed: " + e.getMessage(),
                        "FallbackQueryExecutor", "Execute", "Schema");
                if (context.isDone()) {
                    throw new IntrospectionTimeoutException(operation, table, e);
                }
            }
        }

        throw new FallbackExhaustedException(operation, table, attempts, lastError);
    }
}
