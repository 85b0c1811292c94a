package infra.director.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Incoming JSON-RPC 2.0 request. Ids may arrive as numbers and are kept as strings.
 */
public class MCPRequest {

    private final String jsonrpc;
    private final String id;
    private final String method;
    private final JsonObject params;

    private MCPRequest(String jsonrpc, String id, String method, JsonObject params) {
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.params = params;
    }

    /**
     * A null body yields an invalid request rather than an exception.
     */
    public static MCPRequest fromJson(JsonObject json) {
        if (json == null) {
            return new MCPRequest(null, null, null, new JsonObject());
        }
        Object rawId = json.getValue("id");
        Object rawParams = json.getValue("params");
        return new MCPRequest(
            json.getString("jsonrpc", "2.0"),
            rawId == null ? null : String.valueOf(rawId),
            json.getString("method"),
            rawParams instanceof JsonObject ? (JsonObject) rawParams : new JsonObject());
    }

    public boolean isValid() {
        return "2.0".equals(jsonrpc)
            && id != null && !id.isEmpty()
            && method != null && !method.isEmpty();
    }

    public String getId() {
        return id;
    }

    /**
     * <code>params.name</code> of a tools/call request.
     */
    public String getToolName() {
        return params.getString("name");
    }

    /**
     * <code>params.arguments</code> of a tools/call request; empty when absent or not an object.
     */
    public JsonObject getToolArguments() {
        Object raw = params.getValue("arguments");
        return raw instanceof JsonObject ? (JsonObject) raw : new JsonObject();
    }

    @Override
    public String toString() {
        return "MCPRequest{id='" + id + "', method='" + method + "'}";
    }
}
