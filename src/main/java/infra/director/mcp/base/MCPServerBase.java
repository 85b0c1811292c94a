package infra.director.mcp.base;

import infra.director.db.DatabaseNotFoundException;
import infra.director.schema.IntrospectionTimeoutException;
import infra.director.schema.InvalidSchemaRequestException;
import infra.director.schema.SchemaIntrospectionException;
import infra.director.services.MCPRouterService;
import infra.director.services.ReadOnlyViolationException;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static infra.director.services.LogUtil.*;

/**
 * Base class for MCP servers.
 * Provides the JSON-RPC endpoints <code>tools/list</code> and <code>tools/call</code>
 * and maps tool failures to JSON-RPC error codes.
 */
public abstract class MCPServerBase extends AbstractVerticle {

    protected Router router;
    protected final Map<String, MCPTool> tools = new LinkedHashMap<>();
    protected final String serverName;
    protected final String serverPath;

    protected MCPServerBase(String serverName, String serverPath) {
        this.serverName = serverName;
        this.serverPath = serverPath;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        router = Router.router(vertx);

        router.post("/tools/list").handler(this::handleToolsList);
        router.post("/tools/call").handler(this::handleToolCall);

        initializeTools();

        MCPRouterService.registerRouter(serverPath, router);
        logInfo(vertx, serverName + " registered router at path: " + serverPath, "MCPServerBase", "MCP", "System");

        onServerReady();
        startPromise.complete();
    }

    /**
     * Register the tools this server provides.
     */
    protected abstract void initializeTools();

    protected void onServerReady() {
    }

    protected void registerTool(MCPTool tool) {
        tools.put(tool.getName(), tool);
        logDebug(vertx, serverName + " registered tool: " + tool.getName(), "MCPServerBase", "MCP", "System");
    }

    private void handleToolsList(RoutingContext ctx) {
        MCPRequest request = readRequest(ctx);
        if (request == null) {
            return;
        }

        JsonArray toolsArray = new JsonArray();
        for (MCPTool tool : tools.values()) {
            toolsArray.add(tool.toJson());
        }
        sendSuccess(ctx, request.getId(), new JsonObject().put("tools", toolsArray));
    }

    private void handleToolCall(RoutingContext ctx) {
        MCPRequest request = readRequest(ctx);
        if (request == null) {
            return;
        }

        String toolName = request.getToolName();
        JsonObject arguments = request.getToolArguments();

        if (toolName == null) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name");
            return;
        }

        MCPTool tool = tools.get(toolName);
        if (tool == null) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Tool not found: " + toolName);
            return;
        }

        for (int i = 0; i < tool.getRequired().size(); i++) {
            String name = tool.getRequired().getString(i);
            Object value = arguments.getValue(name);
            if (value == null || (value instanceof String && ((String) value).isEmpty())) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, name + " parameter is required");
                return;
            }
        }

        Future<JsonObject> result;
        try {
            result = executeTool(toolName, arguments);
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        result.onComplete(ar -> {
            if (ar.succeeded()) {
                sendSuccess(ctx, request.getId(), ar.result());
            } else {
                sendFailure(ctx, request.getId(), toolName, ar.cause());
            }
        });
    }

    /**
     * Run a tool. Failures travel through the returned future.
     */
    protected abstract Future<JsonObject> executeTool(String toolName, JsonObject arguments);

    /**
     * JSON-RPC code for a tool failure.
     */
    public static int errorCodeFor(Throwable failure) {
        if (failure instanceof InvalidSchemaRequestException || failure instanceof IllegalArgumentException) {
            return MCPResponse.ErrorCodes.INVALID_PARAMS;
        }
        if (failure instanceof DatabaseNotFoundException) {
            return MCPResponse.ErrorCodes.DATABASE_NOT_FOUND;
        }
        if (failure instanceof IntrospectionTimeoutException || failure instanceof SQLTimeoutException) {
            return MCPResponse.ErrorCodes.TIMEOUT;
        }
        if (failure instanceof ReadOnlyViolationException) {
            return MCPResponse.ErrorCodes.WRITE_REJECTED;
        }
        return MCPResponse.ErrorCodes.INTERNAL_ERROR;
    }

    protected void sendFailure(RoutingContext ctx, String requestId, String toolName, Throwable failure) {
        int code = errorCodeFor(failure);
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        if (code == MCPResponse.ErrorCodes.INTERNAL_ERROR) {
            logError(vertx, toolName + " failed", failure, serverName, "ToolCall", "MCP");
        } else {
            logWarn(vertx, toolName + " failed: " + message, serverName, "ToolCall", "MCP");
        }
        JsonObject data = null;
        if (failure instanceof SchemaIntrospectionException) {
            SchemaIntrospectionException schemaFailure = (SchemaIntrospectionException) failure;
            data = new JsonObject().put("operation", schemaFailure.getOperation());
            if (schemaFailure.getTable() != null && !schemaFailure.getTable().isEmpty()) {
                data.put("table", schemaFailure.getTable());
            }
        }
        sendError(ctx, requestId, code, message, data);
    }

    protected void sendSuccess(RoutingContext ctx, String requestId, JsonObject result) {
        MCPResponse response = MCPResponse.success(requestId != null ? requestId : UUID.randomUUID().toString(), result);
        ctx.response()
            .putHeader("content-type", "application/json")
            .end(response.toJson().encode());
    }

    protected void sendError(RoutingContext ctx, String requestId, int code, String message) {
        sendError(ctx, requestId, code, message, null);
    }

    protected void sendError(RoutingContext ctx, String requestId, int code, String message, JsonObject data) {
        MCPResponse response = MCPResponse.error(
            requestId != null ? requestId : UUID.randomUUID().toString(), code, message, data);
        ctx.response()
            .putHeader("content-type", "application/json")
            .setStatusCode(400)
            .end(response.toJson().encode());
    }

    /**
     * Decodes and validates the JSON-RPC envelope; answers the error itself and returns null when it is unusable.
     */
    private MCPRequest readRequest(RoutingContext ctx) {
        JsonObject body;
        try {
            body = ctx.body().asJsonObject();
        } catch (DecodeException e) {
            sendError(ctx, null, MCPResponse.ErrorCodes.PARSE_ERROR, "Parse error: " + e.getMessage());
            return null;
        }
        MCPRequest request = MCPRequest.fromJson(body);
        if (!request.isValid()) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
            return null;
        }
        return request;
    }

    /**
     * Optional numeric argument; accepts JSON numbers and numeric strings.
     *
     * @throws IllegalArgumentException when present but not a number
     */
    protected static Long getLongArgument(JsonObject arguments, String name) {
        Object value = arguments.getValue(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + value, e);
        }
    }

    protected static boolean getBooleanArgument(JsonObject arguments, String name) {
        Object value = arguments.getValue(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    protected MCPTool getTool(String toolName) {
        return tools.get(toolName);
    }

    protected List<MCPTool> getAllTools() {
        return new ArrayList<>(tools.values());
    }
}
