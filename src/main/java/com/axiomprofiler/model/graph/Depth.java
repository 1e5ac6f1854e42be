package com.axiomprofiler.model.graph;

import lombok.Value;

/**
 * Minimum and maximum number of hops to the nearest/farthest root (forward depth)
 * or leaf (backward depth).
 */
@Value
public class Depth {

    public static final Depth ZERO = new Depth(0, 0);

    int min;
    int max;
}
