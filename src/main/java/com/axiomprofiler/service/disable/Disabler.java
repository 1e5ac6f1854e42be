package com.axiomprofiler.service.disable;

import com.axiomprofiler.model.graph.NodeKind;
import com.axiomprofiler.model.graph.RawNode;

/**
 * Rules that take uninteresting raw nodes out of the visible graph without hiding them.
 * Disabled nodes are bridged by indirect edges instead of breaking causal chains.
 */
public enum Disabler {

    SMART("trivial nodes"),
    ENODES("yield terms"),
    GIVEN_EQUALITIES("yield equalities"),
    ALL_EQUALITIES("all equalities");

    private final String description;

    Disabler(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean disables(RawNode node) {
        NodeKind kind = node.getKind();
        return switch (this) {
            case ENODES -> kind.isEnode();
            case GIVEN_EQUALITIES -> kind.isGivenEquality();
            case ALL_EQUALITIES -> kind.isGivenEquality() || kind.isTransEquality();
            case SMART -> isTrivial(node);
        };
    }

    private static boolean isTrivial(RawNode node) {
        int parents = node.getParentCount();
        int children = node.getChildCount();
        boolean passThrough = parents == 1 && children == 1;
        return switch (node.getKind().getType()) {
            case ENODE, GIVEN_EQUALITY -> children == 0 || passThrough;
            case TRANS_EQUALITY -> parents == 0 || passThrough;
            case INSTANTIATION -> false;
        };
    }
}
