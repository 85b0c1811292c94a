package infra.director.config;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the multi-database configuration file.
 * Parsed from the <code>connections</code> array; see {@link #fromJson(JsonObject)}.
 */
public class DatabaseConnectionConfig {

    public static final String TYPE_POSTGRES = "postgres";
    public static final String TYPE_MYSQL = "mysql";
    public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 30;

    private final String id;
    private final String type;
    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String name;

    // Display metadata surfaced to MCP clients
    private final String displayName;
    private final String project;
    private final String environment;
    private final String description;
    private final List<String> tags;

    // PostgreSQL specific
    private final String sslMode;
    private final String sslCert;
    private final String sslKey;
    private final String sslRootCert;
    private final String applicationName;
    private final String targetSessionAttrs;
    private final Map<String, String> options;

    private final int connectTimeoutSeconds;
    private final int queryTimeoutSeconds;

    // Pool
    private final int maxOpenConns;
    private final int maxIdleConns;
    private final int connMaxLifetimeSeconds;
    private final int connMaxIdleTimeSeconds;

    private DatabaseConnectionConfig(JsonObject json) {
        this.id = json.getString("id", "");
        this.type = json.getString("type", "");
        this.host = json.getString("host", "localhost");
        this.port = json.getInteger("port", TYPE_MYSQL.equals(type) ? 3306 : 5432);
        this.user = json.getString("user", "");
        this.password = json.getString("password", "");
        this.name = json.getString("name", "");

        this.displayName = json.getString("display_name");
        this.project = json.getString("project");
        this.environment = json.getString("environment");
        this.description = json.getString("description");
        List<String> tagList = new ArrayList<>();
        JsonArray tagArray = json.getJsonArray("tags", new JsonArray());
        for (int i = 0; i < tagArray.size(); i++) {
            tagList.add(tagArray.getString(i));
        }
        this.tags = Collections.unmodifiableList(tagList);

        this.sslMode = json.getString("ssl_mode");
        this.sslCert = json.getString("ssl_cert");
        this.sslKey = json.getString("ssl_key");
        this.sslRootCert = json.getString("ssl_root_cert");
        this.applicationName = json.getString("application_name");
        this.targetSessionAttrs = json.getString("target_session_attrs");
        Map<String, String> optionMap = new LinkedHashMap<>();
        JsonObject optionJson = json.getJsonObject("options", new JsonObject());
        for (String key : optionJson.fieldNames()) {
            optionMap.put(key, String.valueOf(optionJson.getValue(key)));
        }
        this.options = Collections.unmodifiableMap(optionMap);

        this.connectTimeoutSeconds = json.getInteger("connect_timeout", 0);
        int queryTimeout = json.getInteger("query_timeout", 0);
        this.queryTimeoutSeconds = queryTimeout > 0 ? queryTimeout : DEFAULT_QUERY_TIMEOUT_SECONDS;

        this.maxOpenConns = json.getInteger("max_open_conns", 0);
        this.maxIdleConns = json.getInteger("max_idle_conns", 0);
        this.connMaxLifetimeSeconds = json.getInteger("conn_max_lifetime_seconds", 0);
        this.connMaxIdleTimeSeconds = json.getInteger("conn_max_idle_time_seconds", 0);
    }

    /**
     * Parse and validate one connection entry.
     *
     * @throws IllegalArgumentException when the id is empty or the type is unsupported
     */
    public static DatabaseConnectionConfig fromJson(JsonObject json) {
        DatabaseConnectionConfig config = new DatabaseConnectionConfig(json);
        if (config.id.trim().isEmpty()) {
            throw new IllegalArgumentException("database connection ID cannot be empty");
        }
        if (!TYPE_POSTGRES.equals(config.type) && !TYPE_MYSQL.equals(config.type)) {
            throw new IllegalArgumentException(
                "unsupported database type for connection " + config.id + ": " + config.type);
        }
        return config;
    }

    /**
     * Build the JDBC URL for this connection.
     */
    public String jdbcUrl() {
        Map<String, String> params = new LinkedHashMap<>();
        if (TYPE_POSTGRES.equals(type)) {
            putIfPresent(params, "sslmode", sslMode);
            putIfPresent(params, "sslcert", sslCert);
            putIfPresent(params, "sslkey", sslKey);
            putIfPresent(params, "sslrootcert", sslRootCert);
            putIfPresent(params, "ApplicationName", applicationName);
            putIfPresent(params, "targetServerType", toTargetServerType(targetSessionAttrs));
            if (connectTimeoutSeconds > 0) {
                params.put("connectTimeout", String.valueOf(connectTimeoutSeconds));
            }
            params.putAll(options);
            return "jdbc:postgresql://" + host + ":" + port + "/" + name + queryString(params);
        }

        if (connectTimeoutSeconds > 0) {
            params.put("connectTimeout", String.valueOf(connectTimeoutSeconds * 1000L));
        }
        return "jdbc:mysql://" + host + ":" + port + "/" + name + queryString(params);
    }

    /**
     * Metadata safe to show to MCP clients (no credentials).
     */
    public JsonObject toMetadataJson() {
        JsonObject json = new JsonObject()
            .put("id", id)
            .put("type", type)
            .put("host", host)
            .put("port", port)
            .put("name", name);
        if (displayName != null) json.put("display_name", displayName);
        if (project != null) json.put("project", project);
        if (environment != null) json.put("environment", environment);
        if (description != null) json.put("description", description);
        if (!tags.isEmpty()) json.put("tags", new JsonArray(new ArrayList<>(tags)));
        return json;
    }

    private static String toTargetServerType(String sessionAttrs) {
        if (sessionAttrs == null) {
            return null;
        }
        switch (sessionAttrs) {
            case "read-write":
            case "primary":
                return "primary";
            case "read-only":
            case "standby":
                return "secondary";
            case "prefer-standby":
                return "preferSecondary";
            default:
                return "any";
        }
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (value != null && !value.isEmpty()) {
            params.put(key, value);
        }
    }

    private static String queryString(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("?");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (sb.length() > 1) {
                sb.append('&');
            }
            sb.append(entry.getKey())
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getTags() {
        return tags;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public int getMaxOpenConns() {
        return maxOpenConns;
    }

    public int getMaxIdleConns() {
        return maxIdleConns;
    }

    public int getConnMaxLifetimeSeconds() {
        return connMaxLifetimeSeconds;
    }

    public int getConnMaxIdleTimeSeconds() {
        return connMaxIdleTimeSeconds;
    }

    @Override
    public String toString() {
        return "DatabaseConnectionConfig{id='" + id + "', type='" + type + "', host='" + host
            + "', port=" + port + ", name='" + name + "'}";
    }
}
