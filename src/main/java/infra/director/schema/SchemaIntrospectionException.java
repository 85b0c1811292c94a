package infra.director.schema;

/**
 * Failure of an introspection operation, carrying the operation name and,
 * where one applies, the table it was scoped to.
 */
public class SchemaIntrospectionException extends Exception {

    private final String operation;
    private final String table;

    public SchemaIntrospectionException(String message, String operation, String table) {
        super(message);
        this.operation = operation;
        this.table = table;
    }

    public SchemaIntrospectionException(String message, String operation, String table, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.table = table;
    }

    public String getOperation() {
        return operation;
    }

    public String getTable() {
        return table;
    }
}
