package com.axiomprofiler.model.graph;

public enum Direction {
    INCOMING,
    OUTGOING
}
