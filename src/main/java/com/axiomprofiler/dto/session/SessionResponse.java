package com.axiomprofiler.dto.session;

import com.axiomprofiler.dto.graph.GraphVisualizationResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * State of a session after a call that changed or created it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String sessionId;
    private long generation;
    private List<String> appliedFilters;    // Descriptions, in application order
    private List<String> disablers;
    private List<List<Integer>> longestPaths;
    private GraphVisualizationResponse graph;
}
