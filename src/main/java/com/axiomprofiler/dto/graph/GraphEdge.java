package com.axiomprofiler.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A visible edge, direct or indirect, ready for a graph renderer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    private String id;
    private String source;      // Source node ID
    private String target;      // Target node ID
    private String type;        // DIRECT or INDIRECT
    private String kind;        // YIELD_BLAME, ENODE_EQ, ...
    private String label;       // Human-readable label for display
    private List<Integer> path; // Raw edge indices behind the edge
    private Map<String, Object> properties;
    private EdgeStyle style;
}
