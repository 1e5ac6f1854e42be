package com.axiomprofiler.service.visible;

import com.axiomprofiler.model.graph.RawEdge;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.model.visible.VisibleEdge;
import com.axiomprofiler.model.visible.VisibleInstGraph;
import com.axiomprofiler.model.visible.VisibleNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the visible graph from the raw graph: the shown nodes, the raw edges between
 * them, and one indirect edge for every shown pair connected only through non-shown nodes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisibleGraphMaterializer {

    private final VisibleEdgeClassifier edgeClassifier;

    public VisibleInstGraph toVisible(RawInstGraph raw, long generation) {
        BitSet shown = new BitSet(raw.nodeCount());
        for (int i = 0; i < raw.nodeCount(); i++) {
            shown.set(i, raw.isShown(i));
        }
        BitSet leadsToShown = leadsToShown(raw, shown);

        List<VisibleNode> nodes = new ArrayList<>(shown.cardinality());
        for (int i = shown.nextSetBit(0); i >= 0; i = shown.nextSetBit(i + 1)) {
            nodes.add(new VisibleNode(i, hiddenParents(raw, shown, i), hiddenChildren(raw, shown, i)));
        }

        List<VisibleEdge> edges = new ArrayList<>();
        for (RawEdge edge : raw.getEdges()) {
            if (shown.get(edge.getSource()) && shown.get(edge.getTarget())) {
                edges.add(edgeClassifier.direct(raw, edge));
            }
        }
        int direct = edges.size();

        for (int from = shown.nextSetBit(0); from >= 0; from = shown.nextSetBit(from + 1)) {
            for (List<Integer> path : reconnect(raw, shown, leadsToShown, from).values()) {
                edges.add(edgeClassifier.indirect(raw, path));
            }
        }

        log.debug("Materialized generation {}: {} nodes, {} direct and {} indirect edges",
                generation, nodes.size(), direct, edges.size() - direct);
        return new VisibleInstGraph(nodes, edges, generation);
    }

    /**
     * Nodes with at least one shown descendant. Children always have a higher origin index,
     * so one pass in descending index order settles every node.
     */
    private BitSet leadsToShown(RawInstGraph raw, BitSet shown) {
        BitSet leads = new BitSet(raw.nodeCount());
        for (int i = raw.nodeCount() - 1; i >= 0; i--) {
            for (int k = 0; k < raw.outDegree(i); k++) {
                int child = raw.edge(raw.outgoingAt(i, k)).getTarget();
                if (shown.get(child) || leads.get(child)) {
                    leads.set(i);
                    break;
                }
            }
        }
        return leads;
    }

    private int hiddenParents(RawInstGraph raw, BitSet shown, int idx) {
        int hidden = 0;
        for (int k = 0; k < raw.inDegree(idx); k++) {
            if (!shown.get(raw.edge(raw.incomingAt(idx, k)).getSource())) {
                hidden++;
            }
        }
        return hidden;
    }

    private int hiddenChildren(RawInstGraph raw, BitSet shown, int idx) {
        int hidden = 0;
        for (int k = 0; k < raw.outDegree(idx); k++) {
            if (!shown.get(raw.edge(raw.outgoingAt(idx, k)).getTarget())) {
                hidden++;
            }
        }
        return hidden;
    }

    /**
     * Raw edge paths from {@code from} to every shown node it reaches through non-shown nodes only,
     * keyed by target. Paths stop at the first shown node: a hidden node that is itself reachable
     * from a shown descendant is never walked, so the edge goes to that descendant instead.
     * Targets that {@code from} already has a direct edge to are left out.
     *
     * Every search stays inside the hidden region that can still reach a shown node, so the work
     * is bounded by that region rather than by the size of the raw graph.
     */
    private Map<Integer, List<Integer>> reconnect(RawInstGraph raw, BitSet shown, BitSet leadsToShown, int from) {
        Map<Integer, List<Integer>> paths = new LinkedHashMap<>();
        Set<Integer> directTargets = new HashSet<>();
        for (int k = 0; k < raw.outDegree(from); k++) {
            directTargets.add(raw.edge(raw.outgoingAt(from, k)).getTarget());
        }

        for (int k = 0; k < raw.outDegree(from); k++) {
            int fromEdge = raw.outgoingAt(from, k);
            int fromChild = raw.edge(fromEdge).getTarget();
            if (shown.get(fromChild) || !leadsToShown.get(fromChild)) {
                continue;
            }
            HiddenRegion region = HiddenRegion.explore(raw, shown, leadsToShown, fromChild);
            Set<Integer> behindShown = region.reachableFromFrontier(raw, leadsToShown);

            // Depth-first over hidden nodes that still lead somewhere shown; predecessor edges rebuild the path.
            Map<Integer, Integer> predecessor = new LinkedHashMap<>();
            predecessor.put(fromChild, fromEdge);
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(fromChild);
            while (!stack.isEmpty()) {
                int current = stack.pop();
                for (int j = 0; j < raw.outDegree(current); j++) {
                    int e = raw.outgoingAt(current, j);
                    int next = raw.edge(e).getTarget();
                    if (shown.get(next)) {
                        if (!directTargets.contains(next) && !paths.containsKey(next)) {
                            paths.put(next, pathTo(raw, predecessor, current, e));
                        }
                    } else if (leadsToShown.get(next) && !behindShown.contains(next)
                            && !predecessor.containsKey(next)) {
                        predecessor.put(next, e);
                        stack.push(next);
                    }
                }
            }
        }
        return paths;
    }

    private List<Integer> pathTo(RawInstGraph raw, Map<Integer, Integer> predecessor, int last, int finalEdge) {
        Deque<Integer> path = new ArrayDeque<>();
        path.addFirst(finalEdge);
        int node = last;
        while (predecessor.containsKey(node)) {
            int edge = predecessor.get(node);
            path.addFirst(edge);
            node = raw.edge(edge).getSource();
        }
        return new ArrayList<>(path);
    }

    /**
     * Hidden nodes reachable from one hidden child without crossing a shown node, restricted to
     * those that can still reach a shown node, plus the shown nodes where that walk stops.
     */
    private static final class HiddenRegion {

        private final Set<Integer> hidden = new HashSet<>();
        private final Set<Integer> frontier = new LinkedHashSet<>();
        private int maxHidden;

        static HiddenRegion explore(RawInstGraph raw, BitSet shown, BitSet leadsToShown, int start) {
            HiddenRegion region = new HiddenRegion();
            Deque<Integer> stack = new ArrayDeque<>();
            region.hidden.add(start);
            region.maxHidden = start;
            stack.push(start);
            while (!stack.isEmpty()) {
                int current = stack.pop();
                for (int k = 0; k < raw.outDegree(current); k++) {
                    int next = raw.edge(raw.outgoingAt(current, k)).getTarget();
                    if (shown.get(next)) {
                        region.frontier.add(next);
                    } else if (leadsToShown.get(next) && region.hidden.add(next)) {
                        region.maxHidden = Math.max(region.maxHidden, next);
                        stack.push(next);
                    }
                }
            }
            return region;
        }

        /**
         * Region nodes that some frontier node reaches. Origin indices grow along every edge, so
         * nothing past the highest region index can lead back into the region.
         */
        Set<Integer> reachableFromFrontier(RawInstGraph raw, BitSet leadsToShown) {
            Set<Integer> seen = new HashSet<>();
            Set<Integer> behind = new HashSet<>();
            Deque<Integer> stack = new ArrayDeque<>(frontier);
            while (!stack.isEmpty()) {
                int current = stack.pop();
                for (int k = 0; k < raw.outDegree(current); k++) {
                    int next = raw.edge(raw.outgoingAt(current, k)).getTarget();
                    if (next > maxHidden || !leadsToShown.get(next) || !seen.add(next)) {
                        continue;
                    }
                    if (hidden.contains(next)) {
                        behind.add(next);
                    }
                    stack.push(next);
                }
            }
            return behind;
        }
    }
}
