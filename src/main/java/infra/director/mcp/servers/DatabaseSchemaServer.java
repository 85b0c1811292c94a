package infra.director.mcp.servers;

import infra.director.mcp.base.MCPServerBase;
import infra.director.mcp.base.MCPTool;
import infra.director.services.DatabaseManager;
import infra.director.services.SchemaExplorerService;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import static infra.director.services.LogUtil.*;

/**
 * MCP server exposing read-only schema introspection of the configured databases.
 * Deployed as a worker verticle.
 */
public class DatabaseSchemaServer extends MCPServerBase {

    public static final String PATH = "/mcp/servers/db-schema";

    public static final String TOOL_SCHEMA = "dbSchema";
    public static final String TOOL_SCHEMA_FACET = "dbSchemaFacet";
    public static final String TOOL_INVALIDATE = "dbSchemaInvalidate";
    public static final String TOOL_LIST = "dbList";

    private final SchemaExplorerService explorer;
    private final DatabaseManager databaseManager;

    public DatabaseSchemaServer(SchemaExplorerService explorer, DatabaseManager databaseManager) {
        super("DatabaseSchemaServer", PATH);
        this.explorer = explorer;
        this.databaseManager = databaseManager;
    }

    @Override
    protected void initializeTools() {
        registerTool(new MCPTool(
            TOOL_SCHEMA,
            "Explore database schema: list tables, describe columns, find foreign key relationships, or fetch the full schema.",
            MCPTool.objectSchema(new JsonObject()
                    .put("component", MCPTool.property("string",
                        "Schema component to explore: tables, columns, relationships, full"))
                    .put("table", MCPTool.property("string",
                        "Table name (required for columns, optional filter for relationships)"))
                    .put("timeout", MCPTool.property("integer", "Timeout in milliseconds (default 10000)"))
                    .put("database", MCPTool.property("string", "Database connection ID"))
                    .put("refresh", MCPTool.property("boolean", "Rebuild the full schema even when cached")),
                "component", "database")
        ));

        registerTool(new MCPTool(
            TOOL_SCHEMA_FACET,
            "Fetch one schema facet: primary_keys, indexes, unique_constraints, statistics or enum_values.",
            MCPTool.objectSchema(new JsonObject()
                    .put("component", MCPTool.property("string",
                        "Facet to fetch: primary_keys, indexes, unique_constraints, statistics, enum_values"))
                    .put("table", MCPTool.property("string", "Table name filter; empty or 'all' for every table"))
                    .put("timeout", MCPTool.property("integer", "Timeout in milliseconds (default 10000)"))
                    .put("database", MCPTool.property("string", "Database connection ID")),
                "component", "database")
        ));

        registerTool(new MCPTool(
            TOOL_INVALIDATE,
            "Drop cached full schemas for one database, or for all when database is omitted.",
            MCPTool.objectSchema(new JsonObject()
                .put("database", MCPTool.property("string", "Database connection ID")))
        ));

        registerTool(new MCPTool(
            TOOL_LIST,
            "List configured database connections and whether each is connected.",
            MCPTool.objectSchema(new JsonObject())
        ));
    }

    @Override
    protected void onServerReady() {
        logInfo(vertx, "DatabaseSchemaServer ready with " + databaseManager.getConnectedIds().size()
            + " connected databases", "DatabaseSchemaServer", "MCP", "System");
    }

    @Override
    protected Future<JsonObject> executeTool(String toolName, JsonObject arguments) {
        switch (toolName) {
            case TOOL_SCHEMA:
                return explorer.explore(
                    arguments.getString("database"),
                    arguments.getString("component"),
                    arguments.getString("table", ""),
                    getLongArgument(arguments, "timeout"),
                    getBooleanArgument(arguments, "refresh"));
            case TOOL_SCHEMA_FACET:
                return explorer.exploreFacet(
                    arguments.getString("database"),
                    arguments.getString("component"),
                    arguments.getString("table", ""),
                    getLongArgument(arguments, "timeout"));
            case TOOL_INVALIDATE: {
                String database = arguments.getString("database");
                explorer.invalidate(database);
                boolean all = database == null || database.isEmpty();
                return Future.succeededFuture(new JsonObject().put("invalidated", all ? "all" : database));
            }
            case TOOL_LIST:
                return Future.succeededFuture(new JsonObject().put("databases", databaseManager.listDatabases()));
            default:
                return Future.failedFuture(new IllegalStateException("unhandled tool: " + toolName));
        }
    }
}
