package infra.director.schema.dialect;

import infra.director.schema.CandidateQueries;
import infra.director.schema.Facet;
import infra.director.schema.QueryCandidate;

/**
 * Strategy for unrecognised drivers: PostgreSQL-style candidates first, then
 * MySQL-style ones, so that an engine speaking either dialect yields results.
 */
public class GenericStrategy implements DialectStrategy {

    public static final String NAME = "generic";

    static final String TABLES_CURRENT_SCHEMA = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = CURRENT_SCHEMA
            ORDER BY table_name""";

    private final PostgresStrategy postgres = new PostgresStrategy();
    private final MySqlStrategy mysql = new MySqlStrategy();

    @Override
    public String dialectName() {
        return NAME;
    }

    @Override
    public CandidateQueries tablesQueries() {
        return CandidateQueries.builder(Facet.TABLES)
                .add(QueryCandidate.of(PostgresStrategy.TABLES_INFORMATION_SCHEMA))
                .add(QueryCandidate.of(MySqlStrategy.TABLES_INFORMATION_SCHEMA))
                .add(QueryCandidate.of(TABLES_CURRENT_SCHEMA))
                .add(QueryCandidate.of(MySqlStrategy.TABLES_SHOW))
                .build();
    }

    @Override
    public CandidateQueries columnsQueries(String table) {
        return CandidateQueries.builder(Facet.COLUMNS)
                .add(QueryCandidate.of(PostgresStrategy.COLUMNS_INFORMATION_SCHEMA).bind("table", table))
                .add(QueryCandidate.of(MySqlStrategy.COLUMNS_INFORMATION_SCHEMA).bind("table", table))
                .build();
    }

    @Override
    public CandidateQueries relationshipsQueries(String table) {
        return firstOfEach(Facet.RELATIONSHIPS, postgres.relationshipsQueries(table), mysql.relationshipsQueries(table));
    }

    @Override
    public CandidateQueries primaryKeysQueries(String table) {
        return firstOfEach(Facet.PRIMARY_KEYS, postgres.primaryKeysQueries(table), mysql.primaryKeysQueries(table));
    }

    @Override
    public CandidateQueries indexesQueries(String table) {
        return firstOfEach(Facet.INDEXES, postgres.indexesQueries(table), mysql.indexesQueries(table));
    }

    @Override
    public CandidateQueries enumValuesQueries() {
        return firstOfEach(Facet.ENUM_VALUES, postgres.enumValuesQueries(), mysql.enumValuesQueries());
    }

    @Override
    public CandidateQueries uniqueConstraintsQueries(String table) {
        return firstOfEach(Facet.UNIQUE_CONSTRAINTS,
                postgres.uniqueConstraintsQueries(table), mysql.uniqueConstraintsQueries(table));
    }

    @Override
    public CandidateQueries tableStatsQueries(String table) {
        return firstOfEach(Facet.TABLE_STATS, postgres.tableStatsQueries(table), mysql.tableStatsQueries(table));
    }

    /**
     * The portable candidate of each dialect, PostgreSQL first.
     * Catalog-internal fallbacks are left out since the engine is unknown.
     */
    private static CandidateQueries firstOfEach(Facet facet, CandidateQueries postgresStyle, CandidateQueries mysqlStyle) {
        return CandidateQueries.builder(facet)
                .add(postgresStyle.get(0))
                .add(mysqlStyle.get(0))
                .build();
    }
}
