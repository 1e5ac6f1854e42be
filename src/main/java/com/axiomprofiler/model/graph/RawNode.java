package com.axiomprofiler.model.graph;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A node of the raw instantiation graph. Everything except the visibility flag is
 * fixed once the graph has been built.
 */
@Getter
@ToString
public class RawNode {

    private final int index;            // Origin index, dense and stable
    private final int discoveryKey;     // Trace line that introduced the entity
    private final NodeKind kind;
    private final double cost;
    private final Integer generation;
    private final Integer quantifier;
    private final boolean theoryDiscovered;

    @Setter(AccessLevel.PACKAGE)
    private boolean visible = true;

    @Setter(AccessLevel.PACKAGE)
    private Depth fwdDepth = Depth.ZERO;

    @Setter(AccessLevel.PACKAGE)
    private Depth bwdDepth = Depth.ZERO;

    @Setter(AccessLevel.PACKAGE)
    private int parentCount;

    @Setter(AccessLevel.PACKAGE)
    private int childCount;

    @Setter(AccessLevel.PACKAGE)
    private int costRank;

    public RawNode(int index, int discoveryKey, NodeKind kind, double cost, Integer generation,
                   Integer quantifier, boolean theoryDiscovered) {
        this.index = index;
        this.discoveryKey = discoveryKey;
        this.kind = kind;
        this.cost = cost;
        this.generation = generation;
        this.quantifier = quantifier;
        this.theoryDiscovered = theoryDiscovered;
    }

    public boolean isHidden() {
        return !visible;
    }

    public boolean isInstantiation() {
        return kind.isInstantiation();
    }
}
