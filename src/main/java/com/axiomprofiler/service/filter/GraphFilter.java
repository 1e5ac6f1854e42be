package com.axiomprofiler.service.filter;

import com.axiomprofiler.exception.InvalidFilterException;
import com.axiomprofiler.model.facts.DisplayConfiguration;
import com.axiomprofiler.model.facts.FactStore;
import com.axiomprofiler.model.facts.Quantifier;
import com.axiomprofiler.model.graph.Direction;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.model.graph.RawNode;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Value;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * A visibility filter over the raw instantiation graph. The set of filters is closed: the
 * constructor is private, every variant is declared below and registered as a JSON subtype,
 * keyed by the {@code type} property.
 *
 * Filters validate their arguments before touching the graph, so a rejected filter leaves
 * visibility unchanged.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GraphFilter.MaxNodeIdx.class, name = "MaxNodeIdx"),
        @JsonSubTypes.Type(value = GraphFilter.MinNodeIdx.class, name = "MinNodeIdx"),
        @JsonSubTypes.Type(value = GraphFilter.IgnoreTheorySolving.class, name = "IgnoreTheorySolving"),
        @JsonSubTypes.Type(value = GraphFilter.IgnoreQuantifier.class, name = "IgnoreQuantifier"),
        @JsonSubTypes.Type(value = GraphFilter.IgnoreAllButQuantifier.class, name = "IgnoreAllButQuantifier"),
        @JsonSubTypes.Type(value = GraphFilter.MaxInsts.class, name = "MaxInsts"),
        @JsonSubTypes.Type(value = GraphFilter.MaxBranching.class, name = "MaxBranching"),
        @JsonSubTypes.Type(value = GraphFilter.ShowNeighbours.class, name = "ShowNeighbours"),
        @JsonSubTypes.Type(value = GraphFilter.VisitSubTreeWithRoot.class, name = "VisitSubTreeWithRoot"),
        @JsonSubTypes.Type(value = GraphFilter.VisitSourceTree.class, name = "VisitSourceTree"),
        @JsonSubTypes.Type(value = GraphFilter.MaxDepth.class, name = "MaxDepth"),
        @JsonSubTypes.Type(value = GraphFilter.ShowLongestPath.class, name = "ShowLongestPath"),
        @JsonSubTypes.Type(value = GraphFilter.ShowNamedQuantifier.class, name = "ShowNamedQuantifier")
})
public abstract class GraphFilter {

    private GraphFilter() {
    }

    public abstract FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config);

    /**
     * Human-readable summary, e.g. "Hide all nodes 12 and above".
     */
    public abstract String description();

    // ========================= INDEX & CLASSIFICATION =========================

    /** Hides every node with origin index {@code n} or above. */
    @Value
    public static class MaxNodeIdx extends GraphFilter {
        int n;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNonNegative(n, "MaxNodeIdx");
            graph.setVisibilityWhen(true, node -> node.getIndex() >= n);
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return "Hide all nodes " + n + " and above";
        }
    }

    /** Hides every node with origin index below {@code n}. */
    @Value
    public static class MinNodeIdx extends GraphFilter {
        int n;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNonNegative(n, "MinNodeIdx");
            graph.setVisibilityWhen(true, node -> node.getIndex() < n);
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return "Hide all nodes below " + n;
        }
    }

    @Value
    public static class IgnoreTheorySolving extends GraphFilter {

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            graph.setVisibilityWhen(true, node -> node.isInstantiation() && node.isTheoryDiscovered());
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return "Hide all nodes related to theory solving";
        }
    }

    /** Hides instantiations of quantifier {@code quantifier}; {@code null} matches instantiations without one. */
    @Value
    public static class IgnoreQuantifier extends GraphFilter {
        Integer quantifier;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            graph.setVisibilityWhen(true,
                    node -> node.isInstantiation() && Objects.equals(node.getQuantifier(), quantifier));
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return quantifier == null
                    ? "Hide all nodes without an associated quantifier"
                    : "Hide all nodes of quantifier " + quantifier;
        }
    }

    @Value
    public static class IgnoreAllButQuantifier extends GraphFilter {
        Integer quantifier;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            graph.setVisibilityWhen(true,
                    node -> node.isInstantiation() && !Objects.equals(node.getQuantifier(), quantifier));
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return quantifier == null
                    ? "Hide all nodes with an associated quantifier"
                    : "Hide all nodes not associated to quantifier " + quantifier;
        }
    }

    // ========================= RANKED SELECTION =========================

    /**
     * Keeps the {@code n} highest cost-ranked instantiations among the visible nodes.
     * Everything else, including non-instantiation nodes, is hidden.
     */
    @Value
    public static class MaxInsts extends GraphFilter {
        int n;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNonNegative(n, "MaxInsts");
            graph.keepFirstNCost(n);
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return "Hide all but the " + n + " most expensive nodes";
        }
    }

    @Value
    public static class MaxBranching extends GraphFilter {
        int n;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNonNegative(n, "MaxBranching");
            graph.keepFirstNChildren(n);
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return "Hide all but " + n + " nodes with the most children";
        }
    }

    // ========================= STRUCTURAL =========================

    /** Shows the direct parents or children of a node, whatever earlier filters hid. */
    @Value
    public static class ShowNeighbours extends GraphFilter {
        int node;
        Direction direction;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNode(graph, node);
            if (direction == null) {
                throw new InvalidFilterException("ShowNeighbours requires a direction");
            }
            graph.setVisibilityMany(false, graph.neighbours(node, direction));
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return direction == Direction.INCOMING
                    ? "Show the parents of node " + node
                    : "Show the children of node " + node;
        }
    }

    /**
     * Descendant closure of {@code node}, the node included. With {@code retain} everything
     * outside the closure is hidden; otherwise the closure itself is hidden.
     */
    @Value
    public static class VisitSubTreeWithRoot extends GraphFilter {
        int node;
        boolean retain;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNode(graph, node);
            visitClosure(graph, graph.reachable(node, Direction.OUTGOING), retain);
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return (retain ? "Show" : "Hide") + " node " + node + " and its descendants";
        }
    }

    @Value
    public static class VisitSourceTree extends GraphFilter {
        int node;
        boolean retain;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNode(graph, node);
            visitClosure(graph, graph.reachable(node, Direction.INCOMING), retain);
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return (retain ? "Show" : "Hide") + " node " + node + " and its ancestors";
        }
    }

    /** Hides nodes whose shortest distance from a root exceeds {@code depth}. */
    @Value
    public static class MaxDepth extends GraphFilter {
        int depth;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNonNegative(depth, "MaxDepth");
            graph.setVisibilityWhen(true, node -> node.getFwdDepth().getMin() > depth);
            return FilterOutput.none();
        }

        @Override
        public String description() {
            return "Hide all nodes above depth " + depth;
        }
    }

    /**
     * Shows only the longest root-to-leaf path through {@code node}, computed on the full graph
     * regardless of current visibility. Ties go to the lowest origin index at every step.
     */
    @Value
    public static class ShowLongestPath extends GraphFilter {
        int node;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            requireNode(graph, node);
            List<Integer> path = graph.longestPathThrough(node);
            graph.resetVisibilityTo(true);
            graph.setVisibilityMany(false, path);
            return FilterOutput.longestPath(path);
        }

        @Override
        public String description() {
            return "Show only nodes on the longest path through node " + node;
        }
    }

    /** Keeps only instantiations whose quantifier is displayed as {@code name}. */
    @Value
    public static class ShowNamedQuantifier extends GraphFilter {
        String name;

        @Override
        public FilterOutput apply(RawInstGraph graph, FactStore facts, DisplayConfiguration config) {
            if (name == null) {
                throw new InvalidFilterException("ShowNamedQuantifier requires a name");
            }
            graph.setVisibilityWhen(true, node -> node.isInstantiation() && !hasName(node, facts, config));
            return FilterOutput.none();
        }

        private boolean hasName(RawNode node, FactStore facts, DisplayConfiguration config) {
            if (node.getQuantifier() == null) {
                return false;
            }
            Quantifier quantifier = facts.quantifier(node.getQuantifier());
            return name.equals(quantifier.displayName(config));
        }

        @Override
        public String description() {
            return "Show nodes of quantifier \"" + name + "\"";
        }
    }

    // ========================= SHARED CHECKS =========================

    private static void requireNode(RawInstGraph graph, int node) {
        if (!graph.contains(node)) {
            throw new InvalidFilterException(
                    "Node " + node + " does not exist (graph has " + graph.nodeCount() + " nodes)");
        }
    }

    private static void requireNonNegative(int value, String filter) {
        if (value < 0) {
            throw new InvalidFilterException(filter + " requires a non-negative value, got " + value);
        }
    }

    private static void visitClosure(RawInstGraph graph, BitSet closure, boolean retain) {
        graph.setVisibilityWhen(true, node -> closure.get(node.getIndex()) != retain);
    }
}
