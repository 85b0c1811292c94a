package infra.director.services;

import io.vertx.core.Vertx;
import infra.director.Driver;

/**
 * Structured logging helpers on top of the <code>log</code> event-bus address.
 * Records are CSV shaped: message,level,component,operation,category.
 *
 * <p>Every method accepts a null Vert.x instance and drops the record in that case,
 * so engine classes can be exercised outside a running host.</p>
 */
public class LogUtil {

    // Log levels matching Driver.logLevel
    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    public static void logError(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, ERROR, component, operation, category);
    }

    /**
     * Log an error with exception details; the stack trace follows at debug level.
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String operation, String category) {
        publish(vertx, message + ": " + throwable.getMessage(), ERROR, component, operation, category);

        if (Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append("  at ").append(element.toString()).append("\n");
            }
            publish(vertx, "Stack trace: " + stackTrace, DEBUG, component, operation, category);
        }
    }

    public static void logWarn(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, WARN, component, operation, category);
    }

    public static void logInfo(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, INFO, component, operation, category);
    }

    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, DEBUG, component, operation, category);
    }

    public static void logData(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, DATA, component, operation, category);
    }

    private static void publish(Vertx vertx, String message, int level, String component, String operation, String category) {
        if (vertx == null || Driver.logLevel < level) {
            return;
        }
        vertx.eventBus().publish(Logger.LOG_ADDRESS, formatLogMessage(message, level, component, operation, category));
    }

    /**
     * Format log message for the event bus.
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        // Commas would break the CSV columns
        String cleanMessage = String.valueOf(message).replace(",", ";").replace("\n", " ");
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }
}
