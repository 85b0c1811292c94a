package infra.director.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered fallback list of {@link QueryCandidate}s for one facet, most precise first.
 */
public final class CandidateQueries implements Iterable<QueryCandidate> {

    private final Facet facet;
    private final List<QueryCandidate> candidates;

    private CandidateQueries(Facet facet, List<QueryCandidate> candidates) {
        this.facet = facet;
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public static CandidateQueries of(Facet facet, QueryCandidate... candidates) {
        return new CandidateQueries(facet, List.of(candidates));
    }

    public static Builder builder(Facet facet) {
        return new Builder(facet);
    }

    public Facet getFacet() {
        return facet;
    }

    public String operationName() {
        return facet.getOperationName();
    }

    public List<QueryCandidate> asList() {
        return candidates;
    }

    public QueryCandidate get(int index) {
        return candidates.get(index);
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    @Override
    public Iterator<QueryCandidate> iterator() {
        return candidates.iterator();
    }

    public static final class Builder {
        private final Facet facet;
        private final List<QueryCandidate> candidates = new ArrayList<>();

        private Builder(Facet facet) {
            this.facet = facet;
        }

        public Builder add(QueryCandidate candidate) {
            candidates.add(candidate);
            return this;
        }

        public Builder addAll(CandidateQueries other) {
            candidates.addAll(other.candidates);
            return this;
        }

        public CandidateQueries build() {
            return new CandidateQueries(facet, new ArrayList<>(candidates));
        }
    }
}
