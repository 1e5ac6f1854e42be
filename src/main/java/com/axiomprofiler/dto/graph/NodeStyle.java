package com.axiomprofiler.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Visual styling hints for graph nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStyle {

    private String color;       // Hex color (e.g., "#4CAF50")
    private Integer size;
    private String shape;       // ellipse for instantiations, box for e-nodes, diamond for equalities
    private String borderColor;
    private Integer borderWidth; // Thicker when the node has hidden neighbours
}
