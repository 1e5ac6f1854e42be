package com.axiomprofiler.model.facts;

import java.util.List;

/**
 * Read-only view of the facts extracted from a solver trace by the log parser.
 * All collections are dense and addressed by index; the store is assumed to be
 * consistent when handed to the graph builder.
 */
public interface FactStore {

    List<Quantifier> getQuantifiers();

    List<Term> getTerms();

    List<Match> getMatches();

    List<Instantiation> getInstantiations();

    List<ENode> getEnodes();

    List<GivenEquality> getGivenEqualities();

    List<TransEquality> getTransEqualities();

    List<Dependency> getDependencies();

    default Quantifier quantifier(int idx) {
        return getQuantifiers().get(idx);
    }

    default Term term(int idx) {
        return getTerms().get(idx);
    }

    default Match match(int idx) {
        return getMatches().get(idx);
    }

    default Instantiation instantiation(int idx) {
        return getInstantiations().get(idx);
    }

    default ENode enode(int idx) {
        return getEnodes().get(idx);
    }

    default GivenEquality givenEquality(int idx) {
        return getGivenEqualities().get(idx);
    }

    default TransEquality transEquality(int idx) {
        return getTransEqualities().get(idx);
    }
}
