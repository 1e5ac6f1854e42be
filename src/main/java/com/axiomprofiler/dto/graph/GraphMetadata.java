package com.axiomprofiler.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Summary of a visible graph snapshot for the UI.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphMetadata {

    private String sessionId;
    private long generation;
    private int nodeCount;
    private int edgeCount;
    private int rawNodeCount;
    private int rawEdgeCount;
    private int indirectEdgeCount;
    private List<String> nodeTypes;
    private List<String> edgeKinds;
    private Map<String, Integer> nodeCountByType;
    private Map<String, Integer> edgeCountByKind;
}
