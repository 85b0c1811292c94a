package infra.director.db;

/**
 * The requested database identifier is not configured or not connected.
 */
public class DatabaseNotFoundException extends Exception {

    private final String databaseId;

    public DatabaseNotFoundException(String databaseId) {
        super("database connection " + databaseId + " not found");
        this.databaseId = databaseId;
    }

    public String getDatabaseId() {
        return databaseId;
    }
}
