package com.axiomprofiler.model.facts;

import com.axiomprofiler.model.graph.EdgeKind;
import com.axiomprofiler.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A causal dependency between two trace entities.
 * Entities are identified by their discovery key (the trace line that introduced them);
 * {@code from == 0} marks an entity without predecessor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dependency {

    private int from;
    private Integer to;
    private NodeKind target;        // Entity introduced at line `to`
    private EdgeKind kind;          // Relation of `from` -> `to`
    private Integer triggerTerm;    // Position in the trigger for BLAME / BLAME_EQ
    private Integer eqOrder;        // Equality ordinal for BLAME_EQ
    private Integer blamed;         // Blamed term index, informational
}
