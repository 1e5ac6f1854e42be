package com.axiomprofiler.service.visible;

import com.axiomprofiler.model.graph.EdgeKind;
import com.axiomprofiler.model.graph.NodeKind;
import com.axiomprofiler.model.graph.RawEdge;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.model.visible.VisibleEdge;
import com.axiomprofiler.model.visible.VisibleEdgeKind;
import com.axiomprofiler.model.visible.VisibleEdgeType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

import static com.axiomprofiler.model.graph.EdgeKind.BLAME;
import static com.axiomprofiler.model.graph.EdgeKind.BLAME_EQ;
import static com.axiomprofiler.model.graph.EdgeKind.EQUALITY_FACT;
import static com.axiomprofiler.model.graph.EdgeKind.TEQUALITY_SIMPLE;
import static com.axiomprofiler.model.graph.EdgeKind.YIELD;

/**
 * Builds visible edges and works out which raw node each one blames, from the shape
 * of the raw edge path behind it.
 */
@Component
public class VisibleEdgeClassifier {

    public VisibleEdge direct(RawInstGraph raw, RawEdge edge) {
        return VisibleEdge.builder()
                .source(edge.getSource())
                .target(edge.getTarget())
                .type(VisibleEdgeType.DIRECT)
                .path(List.of(edge.getIndex()))
                .kind(VisibleEdgeKind.DIRECT)
                .blame(raw.node(edge.getSource()).getKind())
                .triggerTerm(edge.getTriggerTerm())
                .eqOrder(edge.getEqOrder())
                .build();
    }

    public VisibleEdge indirect(RawInstGraph raw, List<Integer> path) {
        List<EdgeKind> kinds = path.stream().map(e -> raw.edge(e).getKind()).collect(Collectors.toList());
        RawEdge first = raw.edge(path.get(0));
        RawEdge last = raw.edge(path.get(path.size() - 1));
        VisibleEdge.VisibleEdgeBuilder edge = VisibleEdge.builder()
                .source(first.getSource())
                .target(last.getTarget())
                .type(VisibleEdgeType.INDIRECT)
                .path(List.copyOf(path));

        if (matches(kinds, YIELD, BLAME)) {
            return edge.kind(VisibleEdgeKind.YIELD_BLAME)
                    .blame(nodeAt(raw, path, 1))
                    .triggerTerm(raw.edge(path.get(1)).getTriggerTerm())
                    .build();
        }
        if (matches(kinds, YIELD, EQUALITY_FACT, TEQUALITY_SIMPLE)) {
            return edge.kind(VisibleEdgeKind.YIELD_EQ).blame(nodeAt(raw, path, 2)).build();
        }
        if (matches(kinds, YIELD, EQUALITY_FACT, TEQUALITY_SIMPLE, BLAME_EQ)) {
            return blameEq(edge, raw, path, 3, VisibleEdgeKind.YIELD_BLAME_EQ, VisibleEdgeKind.YIELD_EQ_OTHER)
                    .blame(nodeAt(raw, path, 2))
                    .build();
        }
        if (startsWith(kinds, YIELD, EQUALITY_FACT)) {
            return edge.kind(VisibleEdgeKind.YIELD_EQ_OTHER).blame(nodeAt(raw, path, 2)).build();
        }
        if (matches(kinds, EQUALITY_FACT, TEQUALITY_SIMPLE)) {
            return edge.kind(VisibleEdgeKind.ENODE_EQ).blame(nodeAt(raw, path, 1)).build();
        }
        if (matches(kinds, EQUALITY_FACT, TEQUALITY_SIMPLE, BLAME_EQ)) {
            return blameEq(edge, raw, path, 2, VisibleEdgeKind.ENODE_BLAME_EQ, VisibleEdgeKind.ENODE_EQ_OTHER)
                    .blame(nodeAt(raw, path, 1))
                    .build();
        }
        if (startsWith(kinds, EQUALITY_FACT)) {
            return edge.kind(VisibleEdgeKind.ENODE_EQ_OTHER).blame(nodeAt(raw, path, 1)).build();
        }
        return edge.kind(VisibleEdgeKind.UNKNOWN).blame(raw.node(first.getSource()).getKind()).build();
    }

    // The equality only blames the instantiation when the transitive equality has a single parent.
    private VisibleEdge.VisibleEdgeBuilder blameEq(VisibleEdge.VisibleEdgeBuilder edge, RawInstGraph raw,
                                                   List<Integer> path, int transPosition,
                                                   VisibleEdgeKind single, VisibleEdgeKind other) {
        int trans = raw.edge(path.get(transPosition)).getSource();
        if (raw.node(trans).getParentCount() != 1) {
            return edge.kind(other);
        }
        RawEdge blameEdge = raw.edge(path.get(path.size() - 1));
        return edge.kind(single)
                .triggerTerm(blameEdge.getTriggerTerm())
                .eqOrder(blameEdge.getEqOrder());
    }

    /**
     * Kind of the n-th node along the path; position 0 is the source.
     */
    private NodeKind nodeAt(RawInstGraph raw, List<Integer> path, int position) {
        int node = position == path.size()
                ? raw.edge(path.get(position - 1)).getTarget()
                : raw.edge(path.get(position)).getSource();
        return raw.node(node).getKind();
    }

    private static boolean matches(List<EdgeKind> kinds, EdgeKind... expected) {
        return kinds.size() == expected.length && startsWith(kinds, expected);
    }

    private static boolean startsWith(List<EdgeKind> kinds, EdgeKind... prefix) {
        if (kinds.size() < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (kinds.get(i) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
