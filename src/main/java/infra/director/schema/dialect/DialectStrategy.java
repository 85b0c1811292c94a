package infra.director.schema.dialect;

import infra.director.schema.CandidateQueries;

/**
 * Produces the ordered candidate queries for every introspection facet of one
 * database dialect. Candidates run most precise first; every candidate is
 * restricted to the schema the connection can see.
 *
 * <p>An empty table argument means "all tables" for every table-scoped facet
 * except columns, where the caller rejects it before asking.</p>
 */
public interface DialectStrategy {

    String dialectName();

    CandidateQueries tablesQueries();

    CandidateQueries columnsQueries(String table);

    CandidateQueries relationshipsQueries(String table);

    CandidateQueries primaryKeysQueries(String table);

    CandidateQueries indexesQueries(String table);

    CandidateQueries enumValuesQueries();

    CandidateQueries uniqueConstraintsQueries(String table);

    CandidateQueries tableStatsQueries(String table);

    /**
     * Declared column type that marks a column whose real type lives in <code>udt_name</code>.
     */
    default String userDefinedTypeMarker() {
        return "USER-DEFINED";
    }
}
