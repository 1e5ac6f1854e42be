package com.axiomprofiler.model.graph;

import lombok.Value;

@Value
public class RawEdge {

    int index;
    int source;
    int target;
    EdgeKind kind;
    Integer triggerTerm;
    Integer eqOrder;
}
