package com.axiomprofiler.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A visible raw node, ready for a graph renderer.
 * Compatible with D3.js, Cytoscape.js, and vis.js.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;              // "n" + origin index
    private int rawIndex;
    private String label;           // Short label, e.g. I12 or E3
    private String type;            // Instantiation, ENode, GivenEquality, TransEquality
    private String group;           // Quantifier name for instantiations, node type otherwise
    private Map<String, Object> properties;
    private NodeStyle style;
}
