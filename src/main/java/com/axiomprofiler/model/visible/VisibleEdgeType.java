package com.axiomprofiler.model.visible;

public enum VisibleEdgeType {
    DIRECT,     // Exactly one raw edge
    INDIRECT    // Raw edge path through non-shown nodes
}
