package infra.director.schema;

import infra.director.db.QueryCursor;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a {@link QueryCursor} into an ordered list of {@link Row}s.
 * Column and row order are preserved exactly; the cursor is always closed.
 */
public class RowNormalizer {

    public List<Row> normalize(QueryCursor cursor) throws SQLException {
        SQLException failure = null;
        List<Row> rows = new ArrayList<>();
        try {
            List<String> columns = uniqueLabels(cursor.columnNames());
            while (cursor.next()) {
                Row.Builder row = Row.builder();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), RowValue.fromDriver(cursor.getObject(i + 1)));
                }
                rows.add(row.build());
            }
        } catch (SQLException | RuntimeException e) {
            failure = e instanceof SQLException ? (SQLException) e : new SQLException("failed to read row: " + e.getMessage(), e);
        } finally {
            try {
                cursor.close();
            } catch (SQLException closeError) {
                if (failure == null) {
                    failure = closeError;
                } else {
                    failure.addSuppressed(closeError);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return rows;
    }

    /**
     * Repeated labels, as in <code>SELECT o.id, c.id</code>, get a positional suffix: <code>id</code>, <code>id_2</code>.
     */
    static List<String> uniqueLabels(List<String> columns) {
        List<String> labels = new ArrayList<>(columns.size());
        Set<String> taken = new HashSet<>();
        for (String column : columns) {
            String label = column;
            for (int n = 2; !taken.add(label); n++) {
                label = column + "_" + n;
            }
            labels.add(label);
        }
        return labels;
    }
}
