package com.axiomprofiler.model.visible;

import com.axiomprofiler.model.graph.NodeKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * An edge of the visible graph between two shown raw nodes. A direct edge carries the
 * single raw edge it copies; an indirect edge carries the raw edge path it summarises,
 * starting at the source and ending at the target.
 */
@Value
@Builder
public class VisibleEdge {

    int source;             // Raw origin index
    int target;             // Raw origin index
    VisibleEdgeType type;
    List<Integer> path;     // Raw edge indices
    VisibleEdgeKind kind;
    NodeKind blame;         // Node the target's existence is attributed to
    Integer triggerTerm;
    Integer eqOrder;

    public boolean isIndirect() {
        return type == VisibleEdgeType.INDIRECT;
    }
}
