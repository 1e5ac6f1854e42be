package com.axiomprofiler.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One visible-graph snapshot in renderer form.
 * Compatible with D3.js, Cytoscape.js, and vis.js graph libraries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphVisualizationResponse {

    private List<GraphNode> nodes;
    private List<GraphEdge> edges;
    private GraphMetadata metadata;
    private List<String> highlightedNodes;  // Node IDs on paths reported by ShowLongestPath
}
