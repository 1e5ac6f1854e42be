package com.axiomprofiler.model.visible;

import lombok.Value;

/**
 * A shown raw node, with the number of its raw neighbours that are not shown.
 */
@Value
public class VisibleNode {

    int rawIndex;
    int hiddenParents;
    int hiddenChildren;
}
