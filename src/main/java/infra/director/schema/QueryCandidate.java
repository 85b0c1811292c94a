package infra.director.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One SQL attempt at satisfying a facet request: query text plus its named,
 * positional arguments. Arguments bind to the <code>?</code> placeholders in order.
 */
public final class QueryCandidate {

    private final String sql;
    private final List<String> argumentNames;
    private final List<Object> argumentValues;

    private QueryCandidate(String sql, List<String> argumentNames, List<Object> argumentValues) {
        this.sql = sql;
        this.argumentNames = Collections.unmodifiableList(argumentNames);
        this.argumentValues = Collections.unmodifiableList(argumentValues);
    }

    public static QueryCandidate of(String sql) {
        return new QueryCandidate(sql, List.of(), List.of());
    }

    /**
     * Copy of this candidate with one more argument appended.
     */
    public QueryCandidate bind(String name, Object value) {
        List<String> names = new ArrayList<>(argumentNames);
        List<Object> values = new ArrayList<>(argumentValues);
        names.add(name);
        values.add(value);
        return new QueryCandidate(sql, names, values);
    }

    public String getSql() {
        return sql;
    }

    public List<String> argumentNames() {
        return argumentNames;
    }

    public List<Object> argumentValues() {
        return argumentValues;
    }

    public int placeholderCount() {
        int count = 0;
        for (int i = 0; i < sql.length(); i++) {
            if (sql.charAt(i) == '?') {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "QueryCandidate{sql='" + sql.replaceAll("\\s+", " ").trim() + "', args=" + argumentNames + "}";
    }
}
