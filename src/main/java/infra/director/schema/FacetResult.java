package infra.director.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by one facet query, with the database kind and table it was scoped to.
 */
public final class FacetResult {

    private final Facet facet;
    private final String dbType;
    private final String table;
    private final List<Row> rows;

    public FacetResult(Facet facet, String dbType, String table, List<Row> rows) {
        this.facet = facet;
        this.dbType = dbType;
        this.table = table == null ? "" : table;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public Facet getFacet() {
        return facet;
    }

    public String getDbType() {
        return dbType;
    }

    public String getTable() {
        return table;
    }

    public List<Row> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Tool-facing shape: the rows under the facet's result key, plus <code>dbType</code>
     * and, for table-scoped facets, <code>table</code>.
     */
    public JsonObject toJson() {
        JsonArray rowsJson = new JsonArray();
        rows.forEach(row -> rowsJson.add(row.toJson()));
        JsonObject json = new JsonObject();
        if (facet.isTableScoped()) {
            json.put("table", table);
        }
        return json.put(facet.getResultKey(), rowsJson).put("dbType", dbType);
    }
}
