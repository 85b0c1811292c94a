package infra.director.schema;

/**
 * The call's deadline lapsed or the caller cancelled it.
 * Never downgraded to an empty result by tolerant facets.
 */
public class IntrospectionTimeoutException extends SchemaIntrospectionException {

    public IntrospectionTimeoutException(String operation, String table, Throwable cause) {
        super(operation + " did not complete within the requested timeout"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
                operation, table, cause);
    }
}
