package infra.director.services;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import infra.director.config.DatabaseConnectionConfig;
import infra.director.config.HostConfig;
import infra.director.db.Database;
import infra.director.db.DatabaseNotFoundException;
import infra.director.db.JdbcDatabase;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static infra.director.services.LogUtil.*;

/**
 * Registry of configured databases and their connection pools.
 *
 * <p>Configuration is validated on load. {@link #connectAll()} opens one HikariCP
 * pool per entry, skips entries that fail, and only fails when nothing connected.</p>
 */
public class DatabaseManager {

    private final Vertx vertx;
    private final Map<String, DatabaseConnectionConfig> configs = new LinkedHashMap<>();
    private final Map<String, Database> connections = new ConcurrentHashMap<>();
    private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();

    public DatabaseManager(Vertx vertx) {
        this.vertx = vertx;
    }

    /**
     * Read the <code>{"connections": [...]}</code> document from the inline setting
     * when present, otherwise from the configured file.
     */
    public Future<Void> loadConfiguration(HostConfig hostConfig) {
        if (hostConfig.getDbConfigJson() != null && !hostConfig.getDbConfigJson().isBlank()) {
            try {
                loadConfig(new JsonObject(hostConfig.getDbConfigJson()));
                return Future.succeededFuture();
            } catch (DecodeException | IllegalArgumentException e) {
                return Future.failedFuture(new IllegalArgumentException("invalid DB_CONFIG: " + e.getMessage(), e));
            }
        }
        String path = hostConfig.getDbConfigFile();
        return vertx.fileSystem().readFile(path)
            .recover(err -> Future.failedFuture(
                new IllegalArgumentException("cannot read database configuration " + path + ": " + err.getMessage(), err)))
            .compose(buffer -> {
                try {
                    loadConfig(buffer.toJsonObject());
                    return Future.<Void>succeededFuture();
                } catch (DecodeException | IllegalArgumentException e) {
                    return Future.<Void>failedFuture(
                        new IllegalArgumentException("invalid database configuration " + path + ": " + e.getMessage(), e));
                }
            });
    }

    /**
     * Replace the configured connections. Nothing is stored if any entry is invalid.
     *
     * @throws IllegalArgumentException on an empty or duplicate id or an unsupported type
     */
    public synchronized void loadConfig(JsonObject json) {
        JsonArray entries = json.getJsonArray("connections", new JsonArray());
        Map<String, DatabaseConnectionConfig> parsed = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            DatabaseConnectionConfig config = DatabaseConnectionConfig.fromJson(entries.getJsonObject(i));
            if (parsed.containsKey(config.getId())) {
                throw new IllegalArgumentException("duplicate database connection ID: " + config.getId());
            }
            parsed.put(config.getId(), config);
        }
        configs.clear();
        configs.putAll(parsed);
        logInfo(vertx, "Loaded configuration for " + configs.size() + " database(s)", "DatabaseManager", "LoadConfig", "Database");
    }

    /**
     * Connect every configured database that is not connected yet.
     *
     * @return number of connected databases
     */
    public Future<Integer> connectAll() {
        List<DatabaseConnectionConfig> pending;
        synchronized (this) {
            pending = new ArrayList<>();
            for (DatabaseConnectionConfig config : configs.values()) {
                if (!connections.containsKey(config.getId())) {
                    pending.add(config);
                }
            }
        }
        int total = configs.size();
        return vertx.executeBlocking(() -> {
            List<String> failed = new ArrayList<>();
            for (DatabaseConnectionConfig config : pending) {
                try {
                    connections.put(config.getId(), openDatabase(config));
                    logInfo(vertx, "Connected to database " + config.getId() + " (" + config.getType() + " at "
                            + config.getHost() + ":" + config.getPort() + "/" + config.getName() + ")",
                        "DatabaseManager", "Connect", "Database");
                } catch (Exception e) {
                    failed.add(config.getId());
                    logWarn(vertx, "Failed to connect to database " + config.getId() + ": " + e.getMessage(),
                        "DatabaseManager", "Connect", "Database");
                }
            }
            if (!failed.isEmpty()) {
                logWarn(vertx, "Failed to connect to " + failed.size() + " database(s): " + String.join(" ", failed),
                    "DatabaseManager", "Connect", "Database");
            }
            int connected = connections.size();
            logInfo(vertx, "Connected to " + connected + " out of " + total + " configured databases",
                "DatabaseManager", "Connect", "Database");
            if (connected == 0) {
                throw new IllegalStateException(
                    "failed to connect to any databases: all " + total + " connection attempts failed");
            }
            return connected;
        }, false);
    }

    /**
     * Open a pool for one entry and check that a connection can be borrowed.
     */
    protected Database openDatabase(DatabaseConnectionConfig config) throws Exception {
        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(config.jdbcUrl());
        poolConfig.setUsername(config.getUser());
        poolConfig.setPassword(config.getPassword());
        poolConfig.setReadOnly(true);
        poolConfig.setPoolName("db-" + config.getId());
        if (config.getMaxOpenConns() > 0) {
            poolConfig.setMaximumPoolSize(config.getMaxOpenConns());
        }
        if (config.getMaxIdleConns() > 0) {
            poolConfig.setMinimumIdle(Math.min(config.getMaxIdleConns(), poolConfig.getMaximumPoolSize()));
        }
        if (config.getConnMaxLifetimeSeconds() > 0) {
            poolConfig.setMaxLifetime(config.getConnMaxLifetimeSeconds() * 1000L);
        }
        if (config.getConnMaxIdleTimeSeconds() > 0) {
            poolConfig.setIdleTimeout(config.getConnMaxIdleTimeSeconds() * 1000L);
        }
        if (config.getConnectTimeoutSeconds() > 0) {
            poolConfig.setConnectionTimeout(config.getConnectTimeoutSeconds() * 1000L);
        }

        HikariDataSource dataSource = new HikariDataSource(poolConfig);
        try (Connection ignored = dataSource.getConnection()) {
            pools.put(config.getId(), dataSource);
            return new JdbcDatabase(config.getId(), config.getType(), dataSource, config.getQueryTimeoutSeconds());
        } catch (Exception e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Add an already opened database, replacing any connection with the same id.
     */
    public void registerDatabase(String id, Database database) {
        connections.put(id, database);
    }

    public Database getDatabase(String id) throws DatabaseNotFoundException {
        Database database = id == null ? null : connections.get(id);
        if (database == null) {
            throw new DatabaseNotFoundException(id);
        }
        return database;
    }

    public boolean isConnected(String id) {
        return id != null && connections.containsKey(id);
    }

    public synchronized List<String> getConfiguredIds() {
        return new ArrayList<>(configs.keySet());
    }

    public List<String> getConnectedIds() {
        return new ArrayList<>(connections.keySet());
    }

    /**
     * Configured databases with display metadata and connection state.
     * Databases registered without configuration are listed with their driver only.
     */
    public synchronized JsonArray listDatabases() {
        JsonArray list = new JsonArray();
        for (DatabaseConnectionConfig config : configs.values()) {
            list.add(config.toMetadataJson().put("connected", connections.containsKey(config.getId())));
        }
        for (Map.Entry<String, Database> entry : connections.entrySet()) {
            if (!configs.containsKey(entry.getKey())) {
                list.add(new JsonObject()
                    .put("id", entry.getKey())
                    .put("type", entry.getValue().driverName())
                    .put("connected", true));
            }
        }
        return list;
    }

    public void close(String id) throws DatabaseNotFoundException {
        if (connections.remove(id) == null) {
            throw new DatabaseNotFoundException(id);
        }
        HikariDataSource pool = pools.remove(id);
        if (pool != null) {
            pool.close();
        }
    }

    public void closeAll() {
        for (Map.Entry<String, HikariDataSource> entry : pools.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                logError(vertx, "Failed to close pool for database " + entry.getKey(), e,
                    "DatabaseManager", "CloseAll", "Database");
            }
        }
        pools.clear();
        connections.clear();
    }
}
