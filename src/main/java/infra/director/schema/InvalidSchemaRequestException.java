package infra.director.schema;

/**
 * The request itself is malformed: missing table, unknown component and the like.
 */
public class InvalidSchemaRequestException extends SchemaIntrospectionException {

    public InvalidSchemaRequestException(String message, String operation) {
        super(message, operation, null);
    }
}
