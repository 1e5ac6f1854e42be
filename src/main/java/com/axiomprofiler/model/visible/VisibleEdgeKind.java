package com.axiomprofiler.model.visible;

/**
 * Shape of the raw path behind a visible edge, used to decide what the edge "blames".
 */
public enum VisibleEdgeKind {

    DIRECT,

    /** Instantiation -> ENode -> Instantiation */
    YIELD_BLAME,

    /** Instantiation -> ENode -> GivenEquality -> TransEquality */
    YIELD_EQ,

    /** Instantiation -> ENode -> GivenEquality -> TransEquality (single parent) -> Instantiation */
    YIELD_BLAME_EQ,

    /** Instantiation -> ENode -> GivenEquality -> ... */
    YIELD_EQ_OTHER,

    /** ENode -> GivenEquality -> TransEquality */
    ENODE_EQ,

    /** ENode -> GivenEquality -> TransEquality (single parent) -> Instantiation */
    ENODE_BLAME_EQ,

    /** ENode -> GivenEquality -> ... */
    ENODE_EQ_OTHER,

    UNKNOWN
}
