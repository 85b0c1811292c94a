package infra.director.schema.dialect;

import io.vertx.core.Vertx;

import static infra.director.services.LogUtil.*;

/**
 * Selects the {@link DialectStrategy} for a database kind identifier.
 */
public final class DialectStrategies {

    private static final DialectStrategy POSTGRES = new PostgresStrategy();
    private static final DialectStrategy MYSQL = new MySqlStrategy();
    private static final DialectStrategy GENERIC = new GenericStrategy();

    private DialectStrategies() {
    }

    /**
     * Exact match on the driver name; anything else gets the generic strategy.
     */
    public static DialectStrategy forDriver(String driverName) {
        if (PostgresStrategy.NAME.equals(driverName)) {
            return POSTGRES;
        }
        if (MySqlStrategy.NAME.equals(driverName)) {
            return MYSQL;
        }
        return GENERIC;
    }

    public static DialectStrategy forDriver(String driverName, Vertx vertx) {
        DialectStrategy strategy = forDriver(driverName);
        if (strategy == GENERIC) {
            logWarn(vertx, "No dialect strategy for driver '" + driverName + "'; using generic fallbacks",
                    "DialectStrategies", "ForDriver", "Schema");
        }
        return strategy;
    }
}
