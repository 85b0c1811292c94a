package infra.director.schema;

/**
 * Categories of schema information that can be introspected.
 */
public enum Facet {
    TABLES("tables", "get_tables", null),
    COLUMNS("columns", "get_columns", null),
    RELATIONSHIPS("relationships", "get_relationships", null),
    PRIMARY_KEYS("primary_keys", "get_primary_keys", "primary_keys"),
    INDEXES("indexes", "get_indexes", "indexes"),
    ENUM_VALUES("enums", "get_enum_values", "enum_values"),
    UNIQUE_CONSTRAINTS("unique_constraints", "get_unique_constraints", "unique_constraints"),
    TABLE_STATS("stats", "get_table_stats", "statistics");

    private final String resultKey;
    private final String operationName;
    private final String component;

    Facet(String resultKey, String operationName, String component) {
        this.resultKey = resultKey;
        this.operationName = operationName;
        this.component = component;
    }

    /**
     * Key under which the facet's rows are returned to tool callers.
     */
    public String getResultKey() {
        return resultKey;
    }

    /**
     * Name used in error messages and logs.
     */
    public String getOperationName() {
        return operationName;
    }

    /**
     * Component name accepted by the narrow-facet tool, or null when the facet
     * is only reachable through the main schema tool.
     */
    public String getComponent() {
        return component;
    }

    /**
     * Whether an empty table argument means "all tables" for this facet.
     */
    public boolean isTableScoped() {
        return this != TABLES && this != ENUM_VALUES;
    }

    public static Facet fromComponent(String component) {
        if (component == null) {
            return null;
        }
        for (Facet facet : values()) {
            if (component.equals(facet.component)) {
                return facet;
            }
        }
        return null;
    }
}
