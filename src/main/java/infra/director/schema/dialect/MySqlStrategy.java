package infra.director.schema.dialect;

import infra.director.schema.CandidateQueries;
import infra.director.schema.Facet;
import infra.director.schema.QueryCandidate;

/**
 * MySQL candidates, restricted to the connection's current database via <code>DATABASE()</code>.
 * Table filters always go into the WHERE clause ahead of any GROUP BY or ORDER BY.
 */
public class MySqlStrategy implements DialectStrategy {

    public static final String NAME = "mysql";

    static final String TABLES_INFORMATION_SCHEMA = """
            SELECT table_name AS table_name
            FROM information_schema.tables
            WHERE table_schema = DATABASE() AND table_type = 'BASE TABLE'
            ORDER BY table_name""";

    static final String TABLES_SHOW = "SHOW TABLES";

    static final String COLUMNS_INFORMATION_SCHEMA = """
            SELECT column_name AS column_name,
                   data_type AS data_type,
                   column_type AS column_type,
                   is_nullable AS is_nullable,
                   column_default AS column_default
            FROM information_schema.columns
            WHERE table_name = ? AND table_schema = DATABASE()
            ORDER BY ordinal_position""";

    static final String RELATIONSHIPS_TABLE_CONSTRAINTS = """
            SELECT tc.table_schema AS table_schema,
                   tc.constraint_name AS constraint_name,
                   tc.table_name AS table_name,
                   kcu.column_name AS column_name,
                   kcu.referenced_table_schema AS foreign_table_schema,
                   kcu.referenced_table_name AS foreign_table_name,
                   kcu.referenced_column_name AS foreign_column_name
            FROM information_schema.table_constraints AS tc
            JOIN information_schema.key_column_usage AS kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
             AND tc.table_name = kcu.table_name
            WHERE tc.constraint_type = 'FOREIGN KEY'
              AND tc.table_schema = DATABASE()
            """;

    static final String RELATIONSHIPS_KEY_COLUMN_USAGE = """
            SELECT kcu.constraint_schema AS table_schema,
                   kcu.constraint_name AS constraint_name,
                   kcu.table_name AS table_name,
                   kcu.column_name AS column_name,
                   kcu.referenced_table_schema AS foreign_table_schema,
                   kcu.referenced_table_name AS foreign_table_name,
                   kcu.referenced_column_name AS foreign_column_name
            FROM information_schema.key_column_usage kcu
            WHERE kcu.referenced_table_name IS NOT NULL
              AND kcu.constraint_schema = DATABASE()
            """;

    static final String PRIMARY_KEYS = """
            SELECT tc.table_name AS table_name,
                   kcu.column_name AS column_name,
                   tc.constraint_name AS constraint_name
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
             AND tc.table_name = kcu.table_name
            WHERE tc.constraint_type = 'PRIMARY KEY'
              AND tc.table_schema = DATABASE()
            """;

    static final String INDEXES = """
            SELECT table_name AS table_name,
                   index_name AS index_name,
                   GROUP_CONCAT(column_name ORDER BY seq_in_index) AS column_names,
                   non_unique AS non_unique
            FROM information_schema.statistics
            WHERE table_schema = DATABASE()
            """;

    static final String ENUM_VALUES = """
            SELECT c.table_name AS table_name,
                   c.column_name AS enum_name,
                   c.column_type AS enum_definition
            FROM information_schema.columns c
            WHERE c.table_schema = DATABASE()
              AND c.column_type LIKE 'enum(%'
            ORDER BY c.table_name, c.column_name""";

    static final String UNIQUE_CONSTRAINTS = """
            SELECT tc.table_name AS table_name,
                   tc.constraint_name AS constraint_name,
                   tc.constraint_type AS constraint_type,
                   GROUP_CONCAT(kcu.column_name ORDER BY kcu.ordinal_position) AS column_names
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
             AND tc.table_name = kcu.table_name
            WHERE tc.constraint_type IN ('UNIQUE', 'PRIMARY KEY')
              AND tc.table_schema = DATABASE()
            """;

    static final String TABLE_STATS = """
            SELECT table_schema AS table_schema,
                   table_name AS table_name,
                   table_rows AS row_count_estimate,
                   data_length AS data_length,
                   index_length AS index_length,
                   data_free AS data_free,
                   create_time AS create_time,
                   update_time AS update_time
            FROM information_schema.tables
            WHERE table_schema = DATABASE()
              AND table_type = 'BASE TABLE'
            """;

    @Override
    public String dialectName() {
        return NAME;
    }

    @Override
    public CandidateQueries tablesQueries() {
        return CandidateQueries.of(Facet.TABLES,
                QueryCandidate.of(TABLES_INFORMATION_SCHEMA),
                QueryCandidate.of(TABLES_SHOW));
    }

    @Override
    public CandidateQueries columnsQueries(String table) {
        return CandidateQueries.of(Facet.COLUMNS,
                QueryCandidate.of(COLUMNS_INFORMATION_SCHEMA).bind("table", table),
                QueryCandidate.of("SHOW COLUMNS FROM " + quoteIdentifier(table)));
    }

    @Override
    public CandidateQueries relationshipsQueries(String table) {
        if (PostgresStrategy.isAll(table)) {
            return CandidateQueries.of(Facet.RELATIONSHIPS,
                    QueryCandidate.of(RELATIONSHIPS_TABLE_CONSTRAINTS + "ORDER BY tc.table_name, tc.constraint_name"),
                    QueryCandidate.of(RELATIONSHIPS_KEY_COLUMN_USAGE + "ORDER BY kcu.table_name, kcu.constraint_name"));
        }
        return CandidateQueries.of(Facet.RELATIONSHIPS,
                QueryCandidate.of(RELATIONSHIPS_TABLE_CONSTRAINTS
                                + "  AND (tc.table_name = ? OR kcu.referenced_table_name = ?)\nORDER BY tc.table_name, tc.constraint_name")
                        .bind("table", table).bind("referenced_table", table),
                QueryCandidate.of(RELATIONSHIPS_KEY_COLUMN_USAGE
                                + "  AND (kcu.table_name = ? OR kcu.referenced_table_name = ?)\nORDER BY kcu.table_name, kcu.constraint_name")
                        .bind("table", table).bind("referenced_table", table));
    }

    @Override
    public CandidateQueries primaryKeysQueries(String table) {
        if (PostgresStrategy.isAll(table)) {
            return CandidateQueries.of(Facet.PRIMARY_KEYS,
                    QueryCandidate.of(PRIMARY_KEYS + "ORDER BY tc.table_name, kcu.ordinal_position"));
        }
        return CandidateQueries.of(Facet.PRIMARY_KEYS,
                QueryCandidate.of(PRIMARY_KEYS + "  AND tc.table_name = ?\nORDER BY kcu.ordinal_position")
                        .bind("table", table));
    }

    @Override
    public CandidateQueries indexesQueries(String table) {
        String groupBy = "GROUP BY table_name, index_name, non_unique\n";
        if (PostgresStrategy.isAll(table)) {
            return CandidateQueries.of(Facet.INDEXES,
                    QueryCandidate.of(INDEXES + groupBy + "ORDER BY table_name, index_name"));
        }
        return CandidateQueries.of(Facet.INDEXES,
                QueryCandidate.of(INDEXES + "  AND table_name = ?\n" + groupBy + "ORDER BY index_name")
                        .bind("table", table));
    }

    @Override
    public CandidateQueries enumValuesQueries() {
        return CandidateQueries.of(Facet.ENUM_VALUES, QueryCandidate.of(ENUM_VALUES));
    }

    @Override
    public CandidateQueries uniqueConstraintsQueries(String table) {
        String groupBy = "GROUP BY tc.table_name, tc.constraint_name, tc.constraint_type\n";
        if (PostgresStrategy.isAll(table)) {
            return CandidateQueries.of(Facet.UNIQUE_CONSTRAINTS,
                    QueryCandidate.of(UNIQUE_CONSTRAINTS + groupBy + "ORDER BY tc.table_name, tc.constraint_name"));
        }
        return CandidateQueries.of(Facet.UNIQUE_CONSTRAINTS,
                QueryCandidate.of(UNIQUE_CONSTRAINTS + "  AND tc.table_name = ?\n" + groupBy + "ORDER BY tc.constraint_name")
                        .bind("table", table));
    }

    @Override
    public CandidateQueries tableStatsQueries(String table) {
        if (PostgresStrategy.isAll(table)) {
            return CandidateQueries.of(Facet.TABLE_STATS,
                    QueryCandidate.of(TABLE_STATS + "ORDER BY table_name"));
        }
        return CandidateQueries.of(Facet.TABLE_STATS,
                QueryCandidate.of(TABLE_STATS + "  AND table_name = ?\nORDER BY table_name").bind("table", table));
    }

    /**
     * Backtick-quote an identifier for statements that cannot take bind parameters.
     */
    static String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
