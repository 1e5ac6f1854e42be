package com.axiomprofiler.model.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * The full causal graph of one trace. Topology is fixed at construction; only the
 * per-node visibility flag and the disabled marks change afterwards.
 *
 * Edges always point from a lower to a higher origin index, so ascending index order
 * is a topological order.
 */
public class RawInstGraph {

    private final List<RawNode> nodes;
    private final List<RawEdge> edges;
    private final int[][] outgoing;
    private final int[][] incoming;
    private final List<Integer> costRanked;
    private final List<Integer> branchingRanked;
    private final BitSet disabled = new BitSet();

    public RawInstGraph(List<RawNode> nodes, List<RawEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.outgoing = new int[nodes.size()][];
        this.incoming = new int[nodes.size()][];
        buildAdjacency();
        computeDepths();
        this.costRanked = rank(Comparator.comparingDouble(RawNode::getCost).reversed()
                .thenComparingInt(RawNode::getIndex));
        for (int rank = 0; rank < costRanked.size(); rank++) {
            this.nodes.get(costRanked.get(rank)).setCostRank(rank);
        }
        this.branchingRanked = rank(Comparator.comparingInt(RawNode::getChildCount).reversed()
                .thenComparingInt(RawNode::getIndex));
    }

    // ========================= CONSTRUCTION PASS =========================

    private void buildAdjacency() {
        int[] outDegree = new int[nodes.size()];
        int[] inDegree = new int[nodes.size()];
        for (RawEdge edge : edges) {
            outDegree[edge.getSource()]++;
            inDegree[edge.getTarget()]++;
        }
        for (int i = 0; i < nodes.size(); i++) {
            outgoing[i] = new int[outDegree[i]];
            incoming[i] = new int[inDegree[i]];
            nodes.get(i).setChildCount(outDegree[i]);
            nodes.get(i).setParentCount(inDegree[i]);
        }
        int[] outFill = new int[nodes.size()];
        int[] inFill = new int[nodes.size()];
        for (RawEdge edge : edges) {
            outgoing[edge.getSource()][outFill[edge.getSource()]++] = edge.getIndex();
            incoming[edge.getTarget()][inFill[edge.getTarget()]++] = edge.getIndex();
        }
    }

    private void computeDepths() {
        for (int i = 0; i < nodes.size(); i++) {
            if (incoming[i].length == 0) {
                continue;
            }
            int min = Integer.MAX_VALUE;
            int max = 0;
            for (int e : incoming[i]) {
                Depth parent = nodes.get(edges.get(e).getSource()).getFwdDepth();
                min = Math.min(min, parent.getMin() + 1);
                max = Math.max(max, parent.getMax() + 1);
            }
            nodes.get(i).setFwdDepth(new Depth(min, max));
        }
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (outgoing[i].length == 0) {
                continue;
            }
            int min = Integer.MAX_VALUE;
            int max = 0;
            for (int e : outgoing[i]) {
                Depth child = nodes.get(edges.get(e).getTarget()).getBwdDepth();
                min = Math.min(min, child.getMin() + 1);
                max = Math.max(max, child.getMax() + 1);
            }
            nodes.get(i).setBwdDepth(new Depth(min, max));
        }
    }

    private List<Integer> rank(Comparator<RawNode> order) {
        List<Integer> ranked = new ArrayList<>(nodes.size());
        nodes.stream().sorted(order).forEach(node -> ranked.add(node.getIndex()));
        return Collections.unmodifiableList(ranked);
    }

    // ========================= TOPOLOGY =========================

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean contains(int idx) {
        return idx >= 0 && idx < nodes.size();
    }

    public RawNode node(int idx) {
        return nodes.get(idx);
    }

    public RawEdge edge(int idx) {
        return edges.get(idx);
    }

    public List<RawNode> getNodes() {
        return nodes;
    }

    public List<RawEdge> getEdges() {
        return edges;
    }

    public int outDegree(int idx) {
        return outgoing[idx].length;
    }

    public int inDegree(int idx) {
        return incoming[idx].length;
    }

    /**
     * The {@code k}-th edge leaving {@code idx}, without copying the adjacency array.
     */
    public int outgoingAt(int idx, int k) {
        return outgoing[idx][k];
    }

    /**
     * The {@code k}-th edge entering {@code idx}, without copying the adjacency array.
     */
    public int incomingAt(int idx, int k) {
        return incoming[idx][k];
    }

    public List<Integer> neighbours(int idx, Direction direction) {
        List<Integer> result = new ArrayList<>();
        if (direction == Direction.OUTGOING) {
            for (int e : outgoing[idx]) {
                result.add(edges.get(e).getTarget());
            }
        } else {
            for (int e : incoming[idx]) {
                result.add(edges.get(e).getSource());
            }
        }
        return result;
    }

    /**
     * Node indices by (cost descending, origin index ascending).
     */
    public List<Integer> getCostRanked() {
        return costRanked;
    }

    /**
     * Node indices by (child count descending, origin index ascending).
     */
    public List<Integer> getBranchingRanked() {
        return branchingRanked;
    }

    // ========================= VISIBILITY =========================

    public void setVisibilityWhen(boolean hidden, Predicate<RawNode> predicate) {
        for (RawNode node : nodes) {
            if (predicate.test(node)) {
                node.setVisible(!hidden);
            }
        }
    }

    public void setVisibilityMany(boolean hidden, Collection<Integer> indices) {
        for (int idx : indices) {
            nodes.get(idx).setVisible(!hidden);
        }
    }

    public void resetVisibilityTo(boolean hidden) {
        for (RawNode node : nodes) {
            node.setVisible(!hidden);
        }
    }

    public int visibleNodeCount() {
        return (int) nodes.stream().filter(RawNode::isVisible).count();
    }

    public BitSet visibilitySnapshot() {
        BitSet snapshot = new BitSet(nodes.size());
        for (RawNode node : nodes) {
            snapshot.set(node.getIndex(), node.isVisible());
        }
        return snapshot;
    }

    public void restoreVisibility(BitSet snapshot) {
        for (RawNode node : nodes) {
            node.setVisible(snapshot.get(node.getIndex()));
        }
    }

    /**
     * Keeps the {@code n} highest cost-ranked visible instantiations and hides every other node.
     */
    public void keepFirstNCost(int n) {
        keepFirstN(n, costRanked, RawNode::isInstantiation);
    }

    /**
     * Keeps the {@code n} visible nodes with the most children and hides every other node.
     */
    public void keepFirstNChildren(int n) {
        keepFirstN(n, branchingRanked, node -> true);
    }

    private void keepFirstN(int n, List<Integer> ranked, Predicate<RawNode> eligible) {
        BitSet keep = new BitSet(nodes.size());
        int kept = 0;
        for (int idx : ranked) {
            if (kept >= n) {
                break;
            }
            RawNode node = nodes.get(idx);
            if (node.isVisible() && eligible.test(node)) {
                keep.set(idx);
                kept++;
            }
        }
        for (RawNode node : nodes) {
            if (!keep.get(node.getIndex())) {
                node.setVisible(false);
            }
        }
    }

    // ========================= DISABLED MARKS =========================

    public boolean isDisabled(int idx) {
        return disabled.get(idx);
    }

    public int disabledCount() {
        return disabled.cardinality();
    }

    public void resetDisabledTo(IntPredicate disable) {
        disabled.clear();
        for (int i = 0; i < nodes.size(); i++) {
            if (disable.test(i)) {
                disabled.set(i);
            }
        }
    }

    /**
     * Whether the node takes part in materialization: visible and not disabled.
     */
    public boolean isShown(int idx) {
        return nodes.get(idx).isVisible() && !disabled.get(idx);
    }

    // ========================= REACHABILITY =========================

    /**
     * All nodes reachable from {@code root} in the given direction, {@code root} included.
     */
    public BitSet reachable(int root, Direction direction) {
        BitSet seeds = new BitSet(nodes.size());
        seeds.set(root);
        return reachableFromMany(seeds, direction);
    }

    /**
     * All nodes reachable from any of the seeds in the given direction, seeds included.
     */
    public BitSet reachableFromMany(BitSet seeds, Direction direction) {
        BitSet seen = (BitSet) seeds.clone();
        Deque<Integer> stack = new ArrayDeque<>();
        seeds.stream().forEach(stack::push);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            int[] adjacent = direction == Direction.OUTGOING ? outgoing[current] : incoming[current];
            for (int e : adjacent) {
                RawEdge edge = edges.get(e);
                int next = direction == Direction.OUTGOING ? edge.getTarget() : edge.getSource();
                if (!seen.get(next)) {
                    seen.set(next);
                    stack.push(next);
                }
            }
        }
        return seen;
    }

    /**
     * Longest causal path through {@code idx}, from a root to a leaf. Among equally long
     * paths, each step away from {@code idx} picks the neighbour with the lowest origin index.
     */
    public List<Integer> longestPathThrough(int idx) {
        Deque<Integer> path = new ArrayDeque<>();
        path.add(idx);
        int current = idx;
        while (incoming[current].length > 0) {
            int wanted = nodes.get(current).getFwdDepth().getMax() - 1;
            int best = -1;
            for (int e : incoming[current]) {
                int parent = edges.get(e).getSource();
                if (nodes.get(parent).getFwdDepth().getMax() == wanted && (best == -1 || parent < best)) {
                    best = parent;
                }
            }
            if (best == -1) {
                throw new IllegalStateException("Forward depth of node " + current + " is inconsistent");
            }
            path.addFirst(best);
            current = best;
        }
        current = idx;
        while (outgoing[current].length > 0) {
            int wanted = nodes.get(current).getBwdDepth().getMax() - 1;
            int best = -1;
            for (int e : outgoing[current]) {
                int child = edges.get(e).getTarget();
                if (nodes.get(child).getBwdDepth().getMax() == wanted && (best == -1 || child < best)) {
                    best = child;
                }
            }
            if (best == -1) {
                throw new IllegalStateException("Backward depth of node " + current + " is inconsistent");
            }
            path.addLast(best);
            current = best;
        }
        return new ArrayList<>(path);
    }
}
