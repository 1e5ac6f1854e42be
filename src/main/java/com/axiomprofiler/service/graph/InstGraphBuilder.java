package com.axiomprofiler.service.graph;

import com.axiomprofiler.exception.GraphCycleException;
import com.axiomprofiler.exception.InconsistentFactStoreException;
import com.axiomprofiler.model.facts.Dependency;
import com.axiomprofiler.model.facts.FactStore;
import com.axiomprofiler.model.facts.Instantiation;
import com.axiomprofiler.model.facts.Match;
import com.axiomprofiler.model.graph.NodeKind;
import com.axiomprofiler.model.graph.RawEdge;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.model.graph.RawNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the raw instantiation graph from a fact store.
 *
 * Nodes are created in dependency order, one per distinct discovery key, so the origin
 * index of a node is its discovery rank. Edges are added in a second pass and must point
 * from an earlier to a later node.
 */
@Service
@Slf4j
public class InstGraphBuilder {

    public RawInstGraph build(FactStore facts) {
        List<RawNode> nodes = new ArrayList<>();
        Map<Integer, Integer> nodeByKey = new HashMap<>();

        for (Dependency dependency : facts.getDependencies()) {
            Integer to = dependency.getTo();
            if (to == null || nodeByKey.containsKey(to)) {
                continue;
            }
            int index = nodes.size();
            nodes.add(createNode(index, to, dependency.getTarget(), facts));
            nodeByKey.put(to, index);
        }

        List<RawEdge> edges = new ArrayList<>();
        for (Dependency dependency : facts.getDependencies()) {
            if (dependency.getTo() == null || dependency.getFrom() <= 0) {
                continue;
            }
            Integer source = nodeByKey.get(dependency.getFrom());
            if (source == null) {
                throw new InconsistentFactStoreException(
                        "Dependency refers to unknown source entity at line " + dependency.getFrom());
            }
            int target = nodeByKey.get(dependency.getTo());
            if (source >= target) {
                throw new GraphCycleException(source, target);
            }
            if (dependency.getKind() == null) {
                throw new InconsistentFactStoreException(
                        "Dependency " + dependency.getFrom() + " -> " + dependency.getTo() + " has no edge kind");
            }
            edges.add(new RawEdge(edges.size(), source, target, dependency.getKind(),
                    dependency.getTriggerTerm(), dependency.getEqOrder()));
        }

        RawInstGraph graph = new RawInstGraph(nodes, edges);
        log.info("Built instantiation graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private RawNode createNode(int index, int discoveryKey, NodeKind kind, FactStore facts) {
        if (kind == null) {
            throw new InconsistentFactStoreException("Entity at line " + discoveryKey + " has no kind");
        }
        switch (kind.getType()) {
            case INSTANTIATION -> {
                requireIndex(kind, facts.getInstantiations().size());
                Instantiation inst = facts.instantiation(kind.getIndex());
                if (inst.getMatch() < 0 || inst.getMatch() >= facts.getMatches().size()) {
                    throw new InconsistentFactStoreException(
                            "Instantiation " + kind.getIndex() + " refers to unknown match " + inst.getMatch());
                }
                Match match = facts.match(inst.getMatch());
                Integer quantifier = match.getQuantifier();
                if (quantifier != null && (quantifier < 0 || quantifier >= facts.getQuantifiers().size())) {
                    throw new InconsistentFactStoreException(
                            "Match " + inst.getMatch() + " refers to unknown quantifier " + quantifier);
                }
                return new RawNode(index, discoveryKey, kind, inst.getCost(), inst.getZ3Generation(),
                        quantifier, match.isDiscovered());
            }
            case ENODE -> requireIndex(kind, facts.getEnodes().size());
            case GIVEN_EQUALITY -> requireIndex(kind, facts.getGivenEqualities().size());
            case TRANS_EQUALITY -> requireIndex(kind, facts.getTransEqualities().size());
        }
        return new RawNode(index, discoveryKey, kind, 0.0, null, null, false);
    }

    private void requireIndex(NodeKind kind, int size) {
        if (kind.getIndex() < 0 || kind.getIndex() >= size) {
            throw new InconsistentFactStoreException("Unknown " + kind.getType() + " " + kind.getIndex());
        }
    }
}
