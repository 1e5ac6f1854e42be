package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The match event that caused an instantiation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Match {

    public enum Kind {
        QUANTIFIER,     // Pattern triggered by terms in the e-graph
        MBQI,
        THEORY_SOLVING,
        AXIOM
    }

    private Kind kind;
    private Integer quantifier;     // null for matches discovered without a quantifier
    private Integer pattern;        // Trigger term index

    @Builder.Default
    private List<Integer> blamedTerms = new ArrayList<>();

    /**
     * Whether the match was discovered by the solver rather than triggered by a pattern.
     */
    public boolean isDiscovered() {
        return kind != Kind.QUANTIFIER;
    }
}
