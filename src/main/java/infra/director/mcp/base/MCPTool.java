package infra.director.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * An MCP tool definition: name, description and JSON input schema.
 */
public class MCPTool {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;

    public MCPTool(String name, String description, JsonObject inputSchema) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
    }

    /**
     * Object schema with the given properties and required names.
     */
    public static JsonObject objectSchema(JsonObject properties, String... required) {
        JsonArray requiredArray = new JsonArray();
        for (String name : required) {
            requiredArray.add(name);
        }
        return new JsonObject()
            .put("type", "object")
            .put("properties", properties)
            .put("required", requiredArray);
    }

    public static JsonObject property(String type, String description) {
        return new JsonObject()
            .put("type", type)
            .put("description", description);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    public JsonArray getRequired() {
        return inputSchema.getJsonArray("required", new JsonArray());
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", inputSchema);
    }

    @Override
    public String toString() {
        return "MCPTool{name='" + name + "'}";
    }
}
