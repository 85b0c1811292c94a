package infra.director.mcp.base;

import infra.director.db.DatabaseNotFoundException;
import infra.director.db.QueryCancelledException;
import infra.director.schema.FallbackExhaustedException;
import infra.director.schema.IntrospectionTimeoutException;
import infra.director.schema.InvalidSchemaRequestException;
import infra.director.services.ReadOnlyViolationException;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

public class McpProtocolTest {

    @Test
    @DisplayName("Numeric request ids are kept as strings")
    void numericIds() {
        MCPRequest request = MCPRequest.fromJson(new JsonObject()
            .put("jsonrpc", "2.0").put("id", 42).put("method", "tools/call"));
        Assertions.assertEquals("42", request.getId());
        Assertions.assertTrue(request.isValid());
    }

    @Test
    @DisplayName("Requests without id, method or body are invalid")
    void invalidRequests() {
        Assertions.assertFalse(MCPRequest.fromJson(null).isValid());
        Assertions.assertFalse(MCPRequest.fromJson(new JsonObject().put("id", "1")).isValid());
        Assertions.assertFalse(MCPRequest.fromJson(new JsonObject()
            .put("jsonrpc", "1.0").put("id", "1").put("method", "tools/list")).isValid());
    }

    @Test
    @DisplayName("Tool failures map to JSON-RPC error codes")
    void errorCodes() {
        Assertions.assertEquals(MCPResponse.ErrorCodes.INVALID_PARAMS,
            MCPServerBase.errorCodeFor(new InvalidSchemaRequestException("table parameter is required", "get_columns")));
        Assertions.assertEquals(MCPResponse.ErrorCodes.INVALID_PARAMS,
            MCPServerBase.errorCodeFor(new IllegalArgumentException("timeout must be a number")));
        Assertions.assertEquals(MCPResponse.ErrorCodes.DATABASE_NOT_FOUND,
            MCPServerBase.errorCodeFor(new DatabaseNotFoundException("x")));
        Assertions.assertEquals(MCPResponse.ErrorCodes.TIMEOUT,
            MCPServerBase.errorCodeFor(new IntrospectionTimeoutException("get_tables", null, null)));
        Assertions.assertEquals(MCPResponse.ErrorCodes.TIMEOUT,
            MCPServerBase.errorCodeFor(new QueryCancelledException("cancelled")));
        Assertions.assertEquals(MCPResponse.ErrorCodes.WRITE_REJECTED,
            MCPServerBase.errorCodeFor(new ReadOnlyViolationException("DROP", "write rejected")));
        Assertions.assertEquals(MCPResponse.ErrorCodes.INTERNAL_ERROR,
            MCPServerBase.errorCodeFor(new FallbackExhaustedException("get_tables", null, 3, new SQLException("boom"))));
    }

    @Test
    @DisplayName("Error responses carry code and message")
    void errorResponse() {
        JsonObject json = MCPResponse.error("7", MCPResponse.ErrorCodes.TIMEOUT, "too slow").toJson();
        Assertions.assertEquals("7", json.getString("id"));
        Assertions.assertEquals(-32002, json.getJsonObject("error").getInteger("code"));
        Assertions.assertFalse(json.containsKey("result"));
    }

    @Test
    @DisplayName("Tool schemas list their required arguments")
    void toolSchema() {
        MCPTool tool = new MCPTool("dbQuery", "run a query", MCPTool.objectSchema(new JsonObject()
            .put("query", MCPTool.property("string", "SQL")), "query"));
        Assertions.assertEquals("query", tool.getRequired().getString(0));
        Assertions.assertEquals("dbQuery", tool.toJson().getString("name"));
    }
}
