package com.axiomprofiler.model.graph;

import lombok.Value;

/**
 * Which fact store entity a raw graph node stands for: the entity type plus its index
 * into the matching fact store collection.
 */
@Value
public class NodeKind {

    public enum Type {
        INSTANTIATION,
        ENODE,
        GIVEN_EQUALITY,
        TRANS_EQUALITY
    }

    Type type;
    int index;

    public static NodeKind instantiation(int index) {
        return new NodeKind(Type.INSTANTIATION, index);
    }

    public static NodeKind enode(int index) {
        return new NodeKind(Type.ENODE, index);
    }

    public static NodeKind givenEquality(int index) {
        return new NodeKind(Type.GIVEN_EQUALITY, index);
    }

    public static NodeKind transEquality(int index) {
        return new NodeKind(Type.TRANS_EQUALITY, index);
    }

    public boolean isInstantiation() {
        return type == Type.INSTANTIATION;
    }

    public boolean isEnode() {
        return type == Type.ENODE;
    }

    public boolean isGivenEquality() {
        return type == Type.GIVEN_EQUALITY;
    }

    public boolean isTransEquality() {
        return type == Type.TRANS_EQUALITY;
    }

    /**
     * Short label used in rendered graphs, e.g. {@code I12}, {@code E3}, {@code =4}, {@code ≡2}.
     */
    public String shortLabel() {
        return switch (type) {
            case INSTANTIATION -> "I" + index;
            case ENODE -> "E" + index;
            case GIVEN_EQUALITY -> "=" + index;
            case TRANS_EQUALITY -> "≡" + index;
        };
    }
}
