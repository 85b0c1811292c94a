package infra.director.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * JSON-RPC 2.0 response envelope. Exactly one of result and error is set.
 */
public class MCPResponse {

    private final String id;
    private final JsonObject result;
    private final JsonObject error;

    private MCPResponse(String id, JsonObject result, JsonObject error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static MCPResponse success(String id, JsonObject result) {
        return new MCPResponse(id, result == null ? new JsonObject() : result, null);
    }

    public static MCPResponse error(String id, int code, String message) {
        return error(id, code, message, null);
    }

    /**
     * @param data extra error context, e.g. the failing operation and table; omitted when null or empty
     */
    public static MCPResponse error(String id, int code, String message, JsonObject data) {
        JsonObject error = new JsonObject().put("code", code).put("message", message);
        if (data != null && !data.isEmpty()) {
            error.put("data", data);
        }
        return new MCPResponse(id, null, error);
    }

    public boolean isError() {
        return error != null;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject().put("jsonrpc", "2.0").put("id", id);
        return isError() ? json.put("error", error) : json.put("result", result);
    }

    /**
     * Standard JSON-RPC codes, then the -32001..-32003 range used by the database tools.
     */
    public static final class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;

        public static final int DATABASE_NOT_FOUND = -32001;
        public static final int TIMEOUT = -32002;
        public static final int WRITE_REJECTED = -32003;

        private ErrorCodes() {
        }
    }
}
