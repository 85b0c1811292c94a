package infra.director.schema.dialect;

import infra.director.schema.CandidateQueries;
import infra.director.schema.Facet;
import infra.director.schema.QueryCandidate;

/**
 * PostgreSQL candidates, restricted to the <code>public</code> schema.
 * information_schema views come first, pg_catalog fallbacks after them.
 */
public class PostgresStrategy implements DialectStrategy {

    public static final String NAME = "postgres";

    static final String TABLES_INFORMATION_SCHEMA = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = 'public' AND table_type = 'BASE TABLE'
            ORDER BY table_name""";

    static final String TABLES_PG_TABLES = """
            SELECT tablename AS table_name
            FROM pg_catalog.pg_tables
            WHERE schemaname = 'public'
            ORDER BY tablename""";

    static final String TABLES_PG_CLASS = """
            SELECT relname AS table_name
            FROM pg_catalog.pg_class
            WHERE relkind = 'r'
              AND relnamespace = (SELECT oid FROM pg_catalog.pg_namespace WHERE nspname = 'public')
            ORDER BY relname""";

    static final String COLUMNS_INFORMATION_SCHEMA = """
            SELECT column_name,
                   data_type,
                   udt_name,
                   CASE WHEN is_nullable = 'YES' THEN 'YES' ELSE 'NO' END AS is_nullable,
                   column_default
            FROM information_schema.columns
            WHERE table_name = ? AND table_schema = 'public'
            ORDER BY ordinal_position""";

    static final String COLUMNS_PG_CATALOG = """
            SELECT a.attname AS column_name,
                   CASE WHEN t.typtype = 'e' THEN 'USER-DEFINED'
                        ELSE pg_catalog.format_type(a.atttypid, a.atttypmod) END AS data_type,
                   t.typname AS udt_name,
                   CASE WHEN a.attnotnull THEN 'NO' ELSE 'YES' END AS is_nullable,
                   pg_catalog.pg_get_expr(d.adbin, d.adrelid) AS column_default
            FROM pg_catalog.pg_attribute a
            LEFT JOIN pg_catalog.pg_attrdef d ON a.attrelid = d.adrelid AND a.attnum = d.adnum
            LEFT JOIN pg_catalog.pg_type t ON a.atttypid = t.oid
            WHERE a.attrelid = (SELECT oid FROM pg_catalog.pg_class
                                WHERE relname = ?
                                  AND relnamespace = (SELECT oid FROM pg_catalog.pg_namespace WHERE nspname = 'public'))
              AND a.attnum > 0 AND NOT a.attisdropped
            ORDER BY a.attnum""";

    static final String RELATIONSHIPS_INFORMATION_SCHEMA = """
            SELECT tc.table_schema,
                   tc.constraint_name,
                   tc.table_name,
                   kcu.column_name,
                   ccu.table_schema AS foreign_table_schema,
                   ccu.table_name AS foreign_table_name,
                   ccu.column_name AS foreign_column_name
            FROM information_schema.table_constraints AS tc
            JOIN information_schema.key_column_usage AS kcu
              ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema
            JOIN information_schema.constraint_column_usage AS ccu
              ON ccu.constraint_name = tc.constraint_name AND ccu.table_schema = tc.table_schema
            WHERE tc.constraint_type = 'FOREIGN KEY'
              AND tc.table_schema = 'public'
            """;

    static final String RELATIONSHIPS_PG_CATALOG = """
            SELECT ns.nspname AS table_schema,
                   c.conname AS constraint_name,
                   cl.relname AS table_name,
                   att.attname AS column_name,
                   ns2.nspname AS foreign_table_schema,
                   cl2.relname AS foreign_table_name,
                   att2.attname AS foreign_column_name
            FROM pg_catalog.pg_constraint c
            JOIN pg_catalog.pg_class cl ON c.conrelid = cl.oid
            JOIN pg_catalog.pg_attribute att ON att.attrelid = cl.oid AND att.attnum = ANY(c.conkey)
            JOIN pg_catalog.pg_namespace ns ON ns.oid = cl.relnamespace
            JOIN pg_catalog.pg_class cl2 ON c.confrelid = cl2.oid
            JOIN pg_catalog.pg_attribute att2 ON att2.attrelid = cl2.oid AND att2.attnum = ANY(c.confkey)
            JOIN pg_catalog.pg_namespace ns2 ON ns2.oid = cl2.relnamespace
            WHERE c.contype = 'f'
              AND ns.nspname = 'public'
            """;

    static final String PRIMARY_KEYS_INFORMATION_SCHEMA = """
            SELECT tc.table_name,
                   kcu.column_name,
                   tc.constraint_name
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema
            WHERE tc.constraint_type = 'PRIMARY KEY'
              AND tc.table_schema = 'public'
            """;

    static final String PRIMARY_KEYS_PG_CATALOG = """
            SELECT cl.relname AS table_name,
                   att.attname AS column_name,
                   c.conname AS constraint_name
            FROM pg_catalog.pg_constraint c
            JOIN pg_catalog.pg_class cl ON c.conrelid = cl.oid
            JOIN pg_catalog.pg_namespace ns ON ns.oid = cl.relnamespace
            JOIN pg_catalog.pg_attribute att ON att.attrelid = cl.oid AND att.attnum = ANY(c.conkey)
            WHERE c.contype = 'p'
              AND ns.nspname = 'public'
            """;

    static final String INDEXES_PG_INDEXES = """
            SELECT tablename AS table_name,
                   indexname AS index_name,
                   indexdef
            FROM pg_catalog.pg_indexes
            WHERE schemaname = 'public'
            """;

    static final String INDEXES_PG_INDEX = """
            SELECT t.relname AS table_name,
                   i.relname AS index_name,
                   pg_catalog.pg_get_indexdef(ix.indexrelid) AS indexdef
            FROM pg_catalog.pg_index ix
            JOIN pg_catalog.pg_class t ON t.oid = ix.indrelid
            JOIN pg_catalog.pg_class i ON i.oid = ix.indexrelid
            JOIN pg_catalog.pg_namespace ns ON ns.oid = t.relnamespace
            WHERE ns.nspname = 'public'
            """;

    static final String ENUM_VALUES_PG_ENUM = """
            SELECT t.typname AS enum_name,
                   n.nspname AS schema_name,
                   e.enumlabel AS enum_value,
                   e.enumsortorder AS sort_order
            FROM pg_catalog.pg_type t
            JOIN pg_catalog.pg_enum e ON t.oid = e.enumtypid
            JOIN pg_catalog.pg_namespace n ON n.oid = t.typnamespace
            WHERE n.nspname = 'public'
            ORDER BY t.typname, e.enumsortorder""";

    static final String UNIQUE_INFORMATION_SCHEMA = """
            SELECT tc.table_name,
                   tc.constraint_name,
                   tc.constraint_type,
                   STRING_AGG(kcu.column_name, ', ' ORDER BY kcu.ordinal_position) AS column_names
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema
            WHERE tc.constraint_type IN ('UNIQUE', 'PRIMARY KEY')
              AND tc.table_schema = 'public'
            """;

    static final String UNIQUE_PG_CATALOG = """
            SELECT cl.relname AS table_name,
                   c.conname AS constraint_name,
                   CASE c.contype WHEN 'p' THEN 'PRIMARY KEY' ELSE 'UNIQUE' END AS constraint_type,
                   STRING_AGG(att.attname, ', ' ORDER BY att.attnum) AS column_names
            FROM pg_catalog.pg_constraint c
            JOIN pg_catalog.pg_class cl ON c.conrelid = cl.oid
            JOIN pg_catalog.pg_namespace ns ON ns.oid = cl.relnamespace
            JOIN pg_catalog.pg_attribute att ON att.attrelid = cl.oid AND att.attnum = ANY(c.conkey)
            WHERE c.contype IN ('u', 'p')
              AND ns.nspname = 'public'
            """;

    static final String STATS_PG_STAT = """
            SELECT schemaname,
                   relname AS table_name,
                   n_live_tup AS row_count_estimate,
                   n_dead_tup AS dead_tuples,
                   last_vacuum,
                   last_autovacuum,
                   last_analyze,
                   last_autoanalyze
            FROM pg_catalog.pg_stat_user_tables
            WHERE schemaname = 'public'
            """;

    static final String STATS_PG_CLASS = """
            SELECT ns.nspname AS schemaname,
                   cl.relname AS table_name,
                   cl.reltuples::bigint AS row_count_estimate
            FROM pg_catalog.pg_class cl
            JOIN pg_catalog.pg_namespace ns ON ns.oid = cl.relnamespace
            WHERE cl.relkind = 'r'
              AND ns.nspname = 'public'
            """;

    @Override
    public String dialectName() {
        return NAME;
    }

    @Override
    public CandidateQueries tablesQueries() {
        return CandidateQueries.of(Facet.TABLES,
                QueryCandidate.of(TABLES_INFORMATION_SCHEMA),
                QueryCandidate.of(TABLES_PG_TABLES),
                QueryCandidate.of(TABLES_PG_CLASS));
    }

    @Override
    public CandidateQueries columnsQueries(String table) {
        return CandidateQueries.of(Facet.COLUMNS,
                QueryCandidate.of(COLUMNS_INFORMATION_SCHEMA).bind("table", table),
                QueryCandidate.of(COLUMNS_PG_CATALOG).bind("table", table));
    }

    @Override
    public CandidateQueries relationshipsQueries(String table) {
        if (isAll(table)) {
            return CandidateQueries.of(Facet.RELATIONSHIPS,
                    QueryCandidate.of(RELATIONSHIPS_INFORMATION_SCHEMA + "ORDER BY tc.table_name, tc.constraint_name"),
                    QueryCandidate.of(RELATIONSHIPS_PG_CATALOG + "ORDER BY cl.relname, c.conname"));
        }
        return CandidateQueries.of(Facet.RELATIONSHIPS,
                QueryCandidate.of(RELATIONSHIPS_INFORMATION_SCHEMA
                                + "  AND (tc.table_name = ? OR ccu.table_name = ?)\nORDER BY tc.table_name, tc.constraint_name")
                        .bind("table", table).bind("referenced_table", table),
                QueryCandidate.of(RELATIONSHIPS_PG_CATALOG
                                + "  AND (cl.relname = ? OR cl2.relname = ?)\nORDER BY cl.relname, c.conname")
                        .bind("table", table).bind("referenced_table", table));
    }

    @Override
    public CandidateQueries primaryKeysQueries(String table) {
        if (isAll(table)) {
            return CandidateQueries.of(Facet.PRIMARY_KEYS,
                    QueryCandidate.of(PRIMARY_KEYS_INFORMATION_SCHEMA + "ORDER BY tc.table_name, kcu.ordinal_position"),
                    QueryCandidate.of(PRIMARY_KEYS_PG_CATALOG + "ORDER BY cl.relname, att.attnum"));
        }
        return CandidateQueries.of(Facet.PRIMARY_KEYS,
                QueryCandidate.of(PRIMARY_KEYS_INFORMATION_SCHEMA
                        + "  AND tc.table_name = ?\nORDER BY kcu.ordinal_position").bind("table", table),
                QueryCandidate.of(PRIMARY_KEYS_PG_CATALOG
                        + "  AND cl.relname = ?\nORDER BY att.attnum").bind("table", table));
    }

    @Override
    public CandidateQueries indexesQueries(String table) {
        if (isAll(table)) {
            return CandidateQueries.of(Facet.INDEXES,
                    QueryCandidate.of(INDEXES_PG_INDEXES + "ORDER BY tablename, indexname"),
                    QueryCandidate.of(INDEXES_PG_INDEX + "ORDER BY t.relname, i.relname"));
        }
        return CandidateQueries.of(Facet.INDEXES,
                QueryCandidate.of(INDEXES_PG_INDEXES + "  AND tablename = ?\nORDER BY indexname").bind("table", table),
                QueryCandidate.of(INDEXES_PG_INDEX + "  AND t.relname = ?\nORDER BY i.relname").bind("table", table));
    }

    @Override
    public CandidateQueries enumValuesQueries() {
        return CandidateQueries.of(Facet.ENUM_VALUES, QueryCandidate.of(ENUM_VALUES_PG_ENUM));
    }

    @Override
    public CandidateQueries uniqueConstraintsQueries(String table) {
        String informationSchemaGroup = "GROUP BY tc.table_name, tc.constraint_name, tc.constraint_type\n";
        String catalogGroup = "GROUP BY cl.relname, c.conname, c.contype\n";
        if (isAll(table)) {
            return CandidateQueries.of(Facet.UNIQUE_CONSTRAINTS,
                    QueryCandidate.of(UNIQUE_INFORMATION_SCHEMA + informationSchemaGroup
                            + "ORDER BY tc.table_name, tc.constraint_name"),
                    QueryCandidate.of(UNIQUE_PG_CATALOG + catalogGroup + "ORDER BY cl.relname, c.conname"));
        }
        return CandidateQueries.of(Facet.UNIQUE_CONSTRAINTS,
                QueryCandidate.of(UNIQUE_INFORMATION_SCHEMA + "  AND tc.table_name = ?\n" + informationSchemaGroup
                        + "ORDER BY tc.constraint_name").bind("table", table),
                QueryCandidate.of(UNIQUE_PG_CATALOG + "  AND cl.relname = ?\n" + catalogGroup
                        + "ORDER BY c.conname").bind("table", table));
    }

    @Override
    public CandidateQueries tableStatsQueries(String table) {
        if (isAll(table)) {
            return CandidateQueries.of(Facet.TABLE_STATS,
                    QueryCandidate.of(STATS_PG_STAT + "ORDER BY relname"),
                    QueryCandidate.of(STATS_PG_CLASS + "ORDER BY cl.relname"));
        }
        return CandidateQueries.of(Facet.TABLE_STATS,
                QueryCandidate.of(STATS_PG_STAT + "  AND relname = ?").bind("table", table),
                QueryCandidate.of(STATS_PG_CLASS + "  AND cl.relname = ?").bind("table", table));
    }

    static boolean isAll(String table) {
        return table == null || table.isEmpty();
    }
}
