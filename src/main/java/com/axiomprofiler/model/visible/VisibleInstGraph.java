package com.axiomprofiler.model.visible;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of what the user currently sees. Rebuilt from the raw graph after
 * every visibility or disabling change; {@link #getGeneration()} tells snapshots apart.
 */
@Getter
public class VisibleInstGraph {

    private final List<VisibleNode> nodes;
    private final List<VisibleEdge> edges;
    private final long generation;
    private final Map<Integer, Integer> reverse;

    public VisibleInstGraph(List<VisibleNode> nodes, List<VisibleEdge> edges, long generation) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.generation = generation;
        Map<Integer, Integer> positions = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            positions.put(this.nodes.get(i).getRawIndex(), i);
        }
        this.reverse = Collections.unmodifiableMap(positions);
    }

    public static VisibleInstGraph empty(long generation) {
        return new VisibleInstGraph(List.of(), List.of(), generation);
    }

    /**
     * Does the snapshot contain the raw node with the given origin index?
     */
    public boolean contains(int rawIndex) {
        return reverse.containsKey(rawIndex);
    }

    public VisibleNode node(int rawIndex) {
        Integer position = reverse.get(rawIndex);
        if (position == null) {
            throw new IllegalArgumentException("Node " + rawIndex + " is not visible");
        }
        return nodes.get(position);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public long indirectEdgeCount() {
        return edges.stream().filter(VisibleEdge::isIndirect).count();
    }
}
