package infra.director.schema.dialect;

import infra.director.schema.CandidateQueries;
import infra.director.schema.QueryCandidate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class DialectStrategiesTest {

    private final DialectStrategy postgres = new PostgresStrategy();
    private final DialectStrategy mysql = new MySqlStrategy();
    private final DialectStrategy generic = new GenericStrategy();

    private static List<CandidateQueries> everyFacet(DialectStrategy strategy, String table) {
        List<CandidateQueries> all = new ArrayList<>();
        all.add(strategy.tablesQueries());
        all.add(strategy.columnsQueries(table.isEmpty() ? "orders" : table));
        all.add(strategy.relationshipsQueries(table));
        all.add(strategy.primaryKeysQueries(table));
        all.add(strategy.indexesQueries(table));
        all.add(strategy.enumValuesQueries());
        all.add(strategy.uniqueConstraintsQueries(table));
        all.add(strategy.tableStatsQueries(table));
        return all;
    }

    @Test
    @DisplayName("Driver names select their strategy, anything else is generic")
    void selection() {
        Assertions.assertEquals("postgres", DialectStrategies.forDriver("postgres").dialectName());
        Assertions.assertEquals("mysql", DialectStrategies.forDriver("mysql").dialectName());
        Assertions.assertEquals("generic", DialectStrategies.forDriver("sqlite").dialectName());
        Assertions.assertEquals("generic", DialectStrategies.forDriver("Postgres").dialectName());
        Assertions.assertEquals("generic", DialectStrategies.forDriver(null).dialectName());
    }

    @Test
    @DisplayName("Every candidate binds exactly as many arguments as it has placeholders")
    void placeholdersMatchArguments() {
        for (DialectStrategy strategy : List.of(postgres, mysql, generic)) {
            for (String table : List.of("", "orders")) {
                for (CandidateQueries queries : everyFacet(strategy, table)) {
                    Assertions.assertFalse(queries.isEmpty(), strategy.dialectName() + " " + queries.operationName());
                    for (QueryCandidate candidate : queries) {
                        Assertions.assertEquals(candidate.placeholderCount(), candidate.argumentValues().size(),
                            strategy.dialectName() + ": " + candidate.getSql());
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Table filters come before GROUP BY and ORDER BY")
    void filterBeforeGrouping() {
        for (DialectStrategy strategy : List.of(postgres, mysql, generic)) {
            for (CandidateQueries queries : everyFacet(strategy, "orders")) {
                for (QueryCandidate candidate : queries) {
                    String sql = candidate.getSql().toUpperCase(Locale.ROOT);
                    int filter = sql.lastIndexOf("= ?");
                    if (filter < 0) {
                        continue;
                    }
                    // aggregates such as STRING_AGG(... ORDER BY ...) sit before the filter
                    int groupBy = sql.lastIndexOf("GROUP BY");
                    int orderBy = sql.lastIndexOf("ORDER BY");
                    if (groupBy >= 0) {
                        Assertions.assertTrue(filter < groupBy, candidate.getSql());
                    }
                    if (orderBy >= 0) {
                        Assertions.assertTrue(filter < orderBy, candidate.getSql());
                    }
                    Assertions.assertFalse(sql.contains("HAVING"), candidate.getSql());
                }
            }
        }
    }

    @Test
    @DisplayName("PostgreSQL tries information_schema before pg_catalog and stays in the public schema")
    void postgresOrdering() {
        CandidateQueries tables = postgres.tablesQueries();
        Assertions.assertEquals(3, tables.size());
        Assertions.assertTrue(tables.get(0).getSql().contains("information_schema.tables"));
        Assertions.assertTrue(tables.get(1).getSql().contains("pg_tables"));
        Assertions.assertTrue(tables.get(2).getSql().contains("pg_class"));

        for (CandidateQueries queries : everyFacet(postgres, "")) {
            for (QueryCandidate candidate : queries) {
                Assertions.assertTrue(candidate.getSql().contains("'public'"), candidate.getSql());
            }
        }
    }

    @Test
    @DisplayName("PostgreSQL catalog columns report enum types with the user-defined marker")
    void postgresCatalogColumnsMarkEnums() {
        QueryCandidate fallback = postgres.columnsQueries("orders").get(1);
        Assertions.assertTrue(fallback.getSql().contains("pg_catalog.pg_attribute"), fallback.getSql());
        Assertions.assertTrue(fallback.getSql().contains("WHEN t.typtype = 'e' THEN '"
            + postgres.userDefinedTypeMarker() + "'"), fallback.getSql());
        Assertions.assertTrue(fallback.getSql().contains("t.typname AS udt_name"), fallback.getSql());
    }

    @Test
    @DisplayName("PostgreSQL relationship filter matches both sides of the key")
    void postgresRelationshipFilter() {
        QueryCandidate candidate = postgres.relationshipsQueries("orders").get(0);
        Assertions.assertEquals(List.of("table", "referenced_table"), candidate.argumentNames());
        Assertions.assertEquals(List.of("orders", "orders"), candidate.argumentValues());
        Assertions.assertTrue(candidate.getSql().contains("ccu.table_name = ?"));
    }

    @Test
    @DisplayName("MySQL stays in the current database and falls back to SHOW statements")
    void mysqlScopeAndFallbacks() {
        for (CandidateQueries queries : everyFacet(mysql, "")) {
            QueryCandidate first = queries.get(0);
            Assertions.assertTrue(first.getSql().contains("DATABASE()"), first.getSql());
        }
        Assertions.assertEquals("SHOW TABLES", mysql.tablesQueries().get(1).getSql());
        Assertions.assertEquals("SHOW COLUMNS FROM `odd``name`", mysql.columnsQueries("odd`name").get(1).getSql());
    }

    @Test
    @DisplayName("Generic strategy tries PostgreSQL style first, then MySQL style")
    void genericOrdering() {
        CandidateQueries tables = generic.tablesQueries();
        Assertions.assertEquals(4, tables.size());
        Assertions.assertTrue(tables.get(0).getSql().contains("'public'"));
        Assertions.assertTrue(tables.get(1).getSql().contains("DATABASE()"));
        Assertions.assertTrue(tables.get(2).getSql().contains("CURRENT_SCHEMA"));
        Assertions.assertEquals("SHOW TABLES", tables.get(3).getSql());

        CandidateQueries pks = generic.primaryKeysQueries("orders");
        Assertions.assertEquals(2, pks.size());
        Assertions.assertTrue(pks.get(0).getSql().contains("'public'"));
        Assertions.assertTrue(pks.get(1).getSql().contains("DATABASE()"));
    }
}
