package com.axiomprofiler.model.graph;

/**
 * Causal relation carried by a raw edge.
 */
public enum EdgeKind {
    YIELD,                  // Instantiation -> produced e-node
    BLAME,                  // E-node -> instantiation that matched on it
    EQUALITY_FACT,          // E-node -> given equality establishing its representative
    TEQUALITY_SIMPLE,       // Given equality -> transitive equality
    TEQUALITY_TRANSITIVE,   // Transitive equality -> transitive equality
    BLAME_EQ                // Transitive equality -> instantiation that matched modulo it
}
