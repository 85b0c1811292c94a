package infra.director.schema.model;

import infra.director.schema.Row;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enum type name to its ordered labels.
 *
 * <p>PostgreSQL rows carry one label each (<code>enum_name</code>, <code>enum_value</code>).
 * MySQL rows carry a whole column definition (<code>enum('a','b')</code>), which is
 * stored under <code>table.column</code> since MySQL enums are not named types.</p>
 */
public final class EnumCatalog {

    private static final EnumCatalog EMPTY = new EnumCatalog(Map.of());

    private final Map<String, List<String>> labelsByType;

    private EnumCatalog(Map<String, List<String>> labelsByType) {
        this.labelsByType = Collections.unmodifiableMap(labelsByType);
    }

    public static EnumCatalog empty() {
        return EMPTY;
    }

    public static EnumCatalog fromRows(List<Row> rows) {
        Map<String, List<String>> labels = new LinkedHashMap<>();
        for (Row row : rows) {
            String enumName = row.getString("enum_name");
            if (enumName == null) {
                continue;
            }
            String definition = row.getString("enum_definition");
            if (definition != null) {
                String table = row.getString("table_name");
                String key = table == null ? enumName : mysqlKey(table, enumName);
                labels.put(key, parseDefinition(definition));
                continue;
            }
            String label = row.getString("enum_value");
            if (label != null) {
                labels.computeIfAbsent(enumName, k -> new ArrayList<>()).add(label);
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        labels.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new EnumCatalog(frozen);
    }

    /**
     * Catalog key of a MySQL inline enum column.
     */
    public static String mysqlKey(String table, String column) {
        return table + "." + column;
    }

    /**
     * Labels of an <code>enum('a','b')</code> column definition, quotes removed and
     * doubled or backslash-escaped quotes unescaped.
     */
    static List<String> parseDefinition(String definition) {
        List<String> labels = new ArrayList<>();
        String body = definition.trim();
        int open = body.indexOf('(');
        int close = body.lastIndexOf(')');
        if (open < 0 || close <= open) {
            return labels;
        }
        body = body.substring(open + 1, close);

        StringBuilder current = null;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (current == null) {
                if (c == '\'') {
                    current = new StringBuilder();
                }
            } else if (c == '\\' && i + 1 < body.length()) {
                current.append(body.charAt(++i));
            } else if (c == '\'') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '\'') {
                    current.append('\'');
                    i++;
                } else {
                    labels.add(current.toString());
                    current = null;
                }
            } else {
                current.append(c);
            }
        }
        return labels;
    }

    /**
     * @return the labels of the type, or null when it is not an enum
     */
    public List<String> lookup(String typeName) {
        return typeName == null ? null : labelsByType.get(typeName);
    }

    public boolean isEmpty() {
        return labelsByType.isEmpty();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        labelsByType.forEach((type, labels) -> json.put(type, new JsonArray(new ArrayList<>(labels))));
        return json;
    }
}
