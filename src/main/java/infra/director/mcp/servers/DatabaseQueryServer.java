package infra.director.mcp.servers;

import infra.director.mcp.base.MCPServerBase;
import infra.director.mcp.base.MCPTool;
import infra.director.services.ReadOnlyQueryService;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * MCP server running read-only SQL against a configured database.
 * Anything that looks like a write is rejected before it reaches the driver.
 */
public class DatabaseQueryServer extends MCPServerBase {

    public static final String PATH = "/mcp/servers/db-query";
    public static final String TOOL_QUERY = "dbQuery";

    private final ReadOnlyQueryService queryService;

    public DatabaseQueryServer(ReadOnlyQueryService queryService) {
        super("DatabaseQueryServer", PATH);
        this.queryService = queryService;
    }

    @Override
    protected void initializeTools() {
        registerTool(new MCPTool(
            TOOL_QUERY,
            "Execute a read-only SQL query (SELECT, SHOW, DESCRIBE, EXPLAIN, WITH) with optional positional parameters.",
            MCPTool.objectSchema(new JsonObject()
                    .put("query", MCPTool.property("string", "SQL query to execute"))
                    .put("params", new JsonObject()
                        .put("type", "array")
                        .put("description", "Values bound to the query's ? placeholders"))
                    .put("timeout", MCPTool.property("integer", "Timeout in milliseconds"))
                    .put("database", MCPTool.property("string", "Database connection ID")),
                "query", "database")
        ));
    }

    @Override
    protected Future<JsonObject> executeTool(String toolName, JsonObject arguments) {
        if (!TOOL_QUERY.equals(toolName)) {
            return Future.failedFuture(new IllegalStateException("unhandled tool: " + toolName));
        }
        Object rawParams = arguments.getValue("params");
        if (rawParams != null && !(rawParams instanceof JsonArray)) {
            return Future.failedFuture(new IllegalArgumentException("params must be an array"));
        }
        return queryService.execute(
            arguments.getString("database"),
            arguments.getString("query"),
            (JsonArray) rawParams,
            getLongArgument(arguments, "timeout"));
    }
}
