package com.axiomprofiler.service.visualization;

import com.axiomprofiler.dto.graph.EdgeStyle;
import com.axiomprofiler.dto.graph.GraphEdge;
import com.axiomprofiler.dto.graph.GraphMetadata;
import com.axiomprofiler.dto.graph.GraphNode;
import com.axiomprofiler.dto.graph.GraphVisualizationResponse;
import com.axiomprofiler.dto.graph.NodeStyle;
import com.axiomprofiler.dto.session.SessionResponse;
import com.axiomprofiler.model.facts.DisplayConfiguration;
import com.axiomprofiler.model.facts.FactStore;
import com.axiomprofiler.model.graph.NodeKind;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.model.graph.RawNode;
import com.axiomprofiler.model.visible.VisibleEdge;
import com.axiomprofiler.model.visible.VisibleInstGraph;
import com.axiomprofiler.model.visible.VisibleNode;
import com.axiomprofiler.service.filter.FilterOutput;
import com.axiomprofiler.service.filter.GraphFilter;
import com.axiomprofiler.service.session.InstGraphSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Service for converting visible graph snapshots to visualization-friendly DTOs.
 * Produces output compatible with D3.js, Cytoscape.js, and vis.js.
 */
@Service
@Slf4j
public class GraphVisualizationService {

    // Node type colors for visualization
    private static final Map<NodeKind.Type, String> NODE_COLORS = Map.of(
            NodeKind.Type.INSTANTIATION, "#2196F3",
            NodeKind.Type.ENODE, "#4CAF50",
            NodeKind.Type.GIVEN_EQUALITY, "#FF9800",
            NodeKind.Type.TRANS_EQUALITY, "#9C27B0"
    );

    private static final String THEORY_COLOR = "#607D8B";
    private static final String DIRECT_EDGE_COLOR = "#424242";
    private static final String INDIRECT_EDGE_COLOR = "#9E9E9E";

    /**
     * Build the visualization of a session's current snapshot.
     */
    public GraphVisualizationResponse buildVisualization(InstGraphSession session) {
        return session.readGraph(raw -> buildSessionVisualization(session, raw));
    }

    public GraphVisualizationResponse buildVisualization(String sessionId, VisibleInstGraph visible, RawInstGraph raw,
                                                         FactStore facts, DisplayConfiguration config) {
        log.debug("[GraphViz] Converting generation {} of session {}: {} nodes, {} edges",
                visible.getGeneration(), sessionId, visible.nodeCount(), visible.edgeCount());
        List<GraphNode> nodes = new ArrayList<>(visible.nodeCount());
        for (VisibleNode node : visible.getNodes()) {
            nodes.add(convertNode(node, raw.node(node.getRawIndex()), facts, config));
        }
        List<GraphEdge> edges = new ArrayList<>(visible.edgeCount());
        for (VisibleEdge edge : visible.getEdges()) {
            edges.add(convertEdge(edge));
        }

        return GraphVisualizationResponse.builder()
                .nodes(nodes)
                .edges(edges)
                .metadata(buildMetadata(nodes, edges, sessionId, visible, raw))
                .build();
    }

    /**
     * Build the response returned after a session was created or changed.
     */
    public SessionResponse buildSessionResponse(InstGraphSession session) {
        return session.readGraph(raw -> SessionResponse.builder()
                .sessionId(session.getId())
                .generation(session.getGeneration())
                .appliedFilters(session.getAppliedChain().stream()
                        .map(GraphFilter::description)
                        .collect(Collectors.toList()))
                .disablers(session.getDisablers().stream()
                        .map(Enum::name)
                        .collect(Collectors.toList()))
                .longestPaths(session.getLastOutputs().stream()
                        .filter(output -> output.getType() == FilterOutput.Type.LONGEST_PATH)
                        .map(FilterOutput::getPath)
                        .collect(Collectors.toList()))
                .graph(buildSessionVisualization(session, raw))
                .build());
    }

    private GraphVisualizationResponse buildSessionVisualization(InstGraphSession session, RawInstGraph raw) {
        GraphVisualizationResponse response = buildVisualization(session.getId(), session.getVisible(), raw,
                session.getFacts(), session.getDisplayConfiguration());
        response.setHighlightedNodes(session.getLastOutputs().stream()
                .filter(output -> output.getType() == FilterOutput.Type.LONGEST_PATH)
                .flatMap(output -> output.getPath().stream())
                .distinct()
                .map(GraphVisualizationService::nodeId)
                .collect(Collectors.toList()));
        return response;
    }

    // ==================== Conversion Methods ====================

    private GraphNode convertNode(VisibleNode visibleNode, RawNode node, FactStore facts, DisplayConfiguration config) {
        NodeKind kind = node.getKind();
        String quantifierName = node.getQuantifier() != null
                ? facts.quantifier(node.getQuantifier()).displayName(config)
                : null;

        Map<String, Object> props = new HashMap<>();
        props.put("discoveryKey", node.getDiscoveryKey());
        props.put("entityIndex", kind.getIndex());
        props.put("cost", node.getCost());
        props.put("costRank", node.getCostRank());
        props.put("minDepth", node.getFwdDepth().getMin());
        props.put("maxDepth", node.getFwdDepth().getMax());
        props.put("hiddenParents", visibleNode.getHiddenParents());
        props.put("hiddenChildren", visibleNode.getHiddenChildren());
        if (node.getGeneration() != null) {
            props.put("generation", node.getGeneration());
        }
        if (quantifierName != null) {
            props.put("quantifier", quantifierName);
        }
        if (kind.isInstantiation()) {
            props.put("theoryDiscovered", node.isTheoryDiscovered());
        }

        boolean hasHiddenNeighbours = visibleNode.getHiddenParents() > 0 || visibleNode.getHiddenChildren() > 0;
        return GraphNode.builder()
                .id(nodeId(node.getIndex()))
                .rawIndex(node.getIndex())
                .label(kind.shortLabel())
                .type(typeName(kind.getType()))
                .group(quantifierName != null ? quantifierName : typeName(kind.getType()))
                .properties(props)
                .style(NodeStyle.builder()
                        .color(node.isTheoryDiscovered() ? THEORY_COLOR : NODE_COLORS.get(kind.getType()))
                        .shape(shapeOf(kind.getType()))
                        .size(kind.isInstantiation() ? 30 : 20)
                        .borderColor(hasHiddenNeighbours ? "#212121" : null)
                        .borderWidth(hasHiddenNeighbours ? 3 : 1)
                        .build())
                .build();
    }

    private GraphEdge convertEdge(VisibleEdge edge) {
        String source = nodeId(edge.getSource());
        String target = nodeId(edge.getTarget());
        Map<String, Object> props = new HashMap<>();
        props.put("blame", edge.getBlame().shortLabel());
        if (edge.getTriggerTerm() != null) {
            props.put("triggerTerm", edge.getTriggerTerm());
        }
        if (edge.getEqOrder() != null) {
            props.put("eqOrder", edge.getEqOrder());
        }

        return GraphEdge.builder()
                .id(source + "-" + edge.getType() + "-" + target + "-" + edge.getPath().get(0))
                .source(source)
                .target(target)
                .type(edge.getType().name())
                .kind(edge.getKind().name())
                .label(edge.getKind().name().toLowerCase().replace("_", " "))
                .path(edge.getPath())
                .properties(props)
                .style(EdgeStyle.builder()
                        .color(edge.isIndirect() ? INDIRECT_EDGE_COLOR : DIRECT_EDGE_COLOR)
                        .width(edge.isIndirect() ? 1 : 2)
                        .lineStyle(edge.isIndirect() ? "dashed" : "solid")
                        .arrowShape("triangle")
                        .build())
                .build();
    }

    private GraphMetadata buildMetadata(List<GraphNode> nodes, List<GraphEdge> edges, String sessionId,
                                        VisibleInstGraph visible, RawInstGraph raw) {
        Map<String, Integer> nodeCountByType = nodes.stream()
                .collect(Collectors.groupingBy(GraphNode::getType, TreeMap::new, Collectors.summingInt(n -> 1)));
        Map<String, Integer> edgeCountByKind = edges.stream()
                .collect(Collectors.groupingBy(GraphEdge::getKind, TreeMap::new, Collectors.summingInt(e -> 1)));

        return GraphMetadata.builder()
                .sessionId(sessionId)
                .generation(visible.getGeneration())
                .nodeCount(nodes.size())
                .edgeCount(edges.size())
                .rawNodeCount(raw.nodeCount())
                .rawEdgeCount(raw.edgeCount())
                .indirectEdgeCount((int) visible.indirectEdgeCount())
                .nodeTypes(new ArrayList<>(nodeCountByType.keySet()))
                .edgeKinds(new ArrayList<>(edgeCountByKind.keySet()))
                .nodeCountByType(nodeCountByType)
                .edgeCountByKind(edgeCountByKind)
                .build();
    }

    // ==================== Helper Methods ====================

    static String nodeId(int rawIndex) {
        return "n" + rawIndex;
    }

    static String typeName(NodeKind.Type type) {
        return switch (type) {
            case INSTANTIATION -> "Instantiation";
            case ENODE -> "ENode";
            case GIVEN_EQUALITY -> "GivenEquality";
            case TRANS_EQUALITY -> "TransEquality";
        };
    }

    private static String shapeOf(NodeKind.Type type) {
        return switch (type) {
            case INSTANTIATION -> "ellipse";
            case ENODE -> "box";
            case GIVEN_EQUALITY, TRANS_EQUALITY -> "diamond";
        };
    }
}
