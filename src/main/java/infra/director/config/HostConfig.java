package infra.director.config;

import java.time.Duration;

/**
 * Process-wide configuration read from system properties (populated from
 * <code>.env.local</code> by dotenv) and environment variables.
 *
 * <p>Lookup order for every key: system property, then environment variable,
 * then the documented default.</p>
 */
public class HostConfig {

    public static final String DATA_PATH = "DATA_PATH";
    public static final String LOG_LEVEL = "LOG_LEVEL";
    public static final String MCP_PORT = "MCP_PORT";
    public static final String SCHEMA_CACHE_TTL = "SCHEMA_CACHE_TTL";
    public static final String DB_CONFIG_FILE = "DB_CONFIG_FILE";
    public static final String DB_CONFIG = "DB_CONFIG";

    public static final Duration DEFAULT_SCHEMA_CACHE_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_LOG_LEVEL = 2;

    private final String dataPath;
    private final int logLevel;
    private final int mcpPort;
    private final Duration schemaCacheTtl;
    private final String schemaCacheTtlProblem;
    private final String dbConfigFile;
    private final String dbConfigJson;

    private HostConfig() {
        dataPath = getEnv(DATA_PATH, "./data");
        logLevel = getIntEnv(LOG_LEVEL, DEFAULT_LOG_LEVEL);
        mcpPort = getIntEnv(MCP_PORT, DEFAULT_PORT);
        dbConfigFile = getEnv(DB_CONFIG_FILE, "./config/databases.json");
        dbConfigJson = getEnv(DB_CONFIG, null);

        String ttlValue = getEnv(SCHEMA_CACHE_TTL, null);
        Duration ttl = DEFAULT_SCHEMA_CACHE_TTL;
        String problem = null;
        if (ttlValue != null) {
            try {
                long seconds = Long.parseLong(ttlValue);
                if (seconds > 0) {
                    ttl = Duration.ofSeconds(seconds);
                } else {
                    problem = "Invalid " + SCHEMA_CACHE_TTL + " value '" + ttlValue + "'; using default 5 minutes";
                }
            } catch (NumberFormatException e) {
                problem = "Invalid " + SCHEMA_CACHE_TTL + " value '" + ttlValue + "'; using default 5 minutes";
            }
        }
        schemaCacheTtl = ttl;
        schemaCacheTtlProblem = problem;
    }

    /**
     * Snapshot the current environment.
     */
    public static HostConfig load() {
        return new HostConfig();
    }

    public String getDataPath() {
        return dataPath;
    }

    public String getLogsPath() {
        return dataPath + "/logs";
    }

    public int getLogLevel() {
        return logLevel;
    }

    public int getMcpPort() {
        return mcpPort;
    }

    public Duration getSchemaCacheTtl() {
        return schemaCacheTtl;
    }

    /**
     * Message describing why the configured TTL was rejected, or null when it was accepted.
     */
    public String getSchemaCacheTtlProblem() {
        return schemaCacheTtlProblem;
    }

    public String getDbConfigFile() {
        return dbConfigFile;
    }

    public String getDbConfigJson() {
        return dbConfigJson;
    }

    static String getEnv(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            value = System.getenv(key);
        }
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    static int getIntEnv(String key, int defaultValue) {
        String value = getEnv(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                "Invalid " + key + " value: '" + value + "'. Must be a whole number.", e);
        }
    }
}
