package com.axiomprofiler.service.visualization;

import com.axiomprofiler.dto.graph.GraphEdge;
import com.axiomprofiler.dto.graph.GraphNode;
import com.axiomprofiler.dto.graph.GraphVisualizationResponse;
import com.axiomprofiler.dto.session.SessionResponse;
import com.axiomprofiler.model.facts.DisplayConfiguration;
import com.axiomprofiler.model.graph.EdgeKind;
import com.axiomprofiler.service.disable.Disabler;
import com.axiomprofiler.service.disable.DisablerEngine;
import com.axiomprofiler.service.filter.GraphFilter;
import com.axiomprofiler.service.session.InstGraphSession;
import com.axiomprofiler.service.visible.VisibleEdgeClassifier;
import com.axiomprofiler.service.visible.VisibleGraphMaterializer;
import com.axiomprofiler.support.TraceBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GraphVisualizationServiceTest {

    private final GraphVisualizationService visualizationService = new GraphVisualizationService();

    private InstGraphSession session;

    /**
     * I0(prf) -> E1 -> I2(theory)
     */
    @BeforeEach
    void setUp() {
        TraceBuilder trace = new TraceBuilder();
        int prf = trace.unnamedQuantifier("prf", 3);
        int i0 = trace.inst(5.0, prf);
        int e1 = trace.enode();
        int i2 = trace.theoryInst(1.0);
        trace.yield(i0, e1).edge(e1, i2, EdgeKind.BLAME, 0, null);
        session = new InstGraphSession("s-42", trace.facts(), trace.graph(), DisplayConfiguration.defaults(),
                new DisablerEngine(), new VisibleGraphMaterializer(new VisibleEdgeClassifier()));
    }

    @Test
    void convertsNodesWithLabelsTypesAndQuantifierGroups() {
        GraphVisualizationResponse response = visualizationService.buildVisualization(session);

        assertThat(response.getNodes()).extracting(GraphNode::getId).containsExactly("n0", "n1", "n2");
        GraphNode inst = response.getNodes().get(0);
        assertThat(inst.getLabel()).isEqualTo("I0");
        assertThat(inst.getType()).isEqualTo("Instantiation");
        assertThat(inst.getGroup()).isEqualTo("prf!3");
        assertThat(inst.getProperties()).containsEntry("cost", 5.0).containsEntry("quantifier", "prf!3");
        assertThat(response.getNodes().get(1).getType()).isEqualTo("ENode");
        assertThat(response.getNodes().get(1).getStyle().getShape()).isEqualTo("box");
        assertThat(response.getNodes().get(2).getProperties()).containsEntry("theoryDiscovered", true);
    }

    @Test
    void marksIndirectEdgesAndNodesWithHiddenNeighbours() {
        session.setDisablers(EnumSet.of(Disabler.ENODES));

        GraphVisualizationResponse response = visualizationService.buildVisualization(session);

        assertThat(response.getNodes()).extracting(GraphNode::getId).containsExactly("n0", "n2");
        GraphEdge edge = response.getEdges().get(0);
        assertThat(edge.getId()).isEqualTo("n0-INDIRECT-n2-0");
        assertThat(edge.getType()).isEqualTo("INDIRECT");
        assertThat(edge.getKind()).isEqualTo("YIELD_BLAME");
        assertThat(edge.getPath()).containsExactly(0, 1);
        assertThat(edge.getStyle().getLineStyle()).isEqualTo("dashed");
        assertThat(edge.getProperties()).containsEntry("blame", "E0");
        assertThat(response.getNodes().get(0).getStyle().getBorderWidth()).isEqualTo(3);
        assertThat(response.getMetadata().getIndirectEdgeCount()).isEqualTo(1);
    }

    @Test
    void metadataCarriesSessionAndGeneration() {
        session.applyChain(List.of(new GraphFilter.IgnoreTheorySolving()));

        GraphVisualizationResponse response = visualizationService.buildVisualization(session);

        assertThat(response.getMetadata().getSessionId()).isEqualTo("s-42");
        assertThat(response.getMetadata().getGeneration()).isEqualTo(1);
        assertThat(response.getMetadata().getNodeCount()).isEqualTo(2);
        assertThat(response.getMetadata().getRawNodeCount()).isEqualTo(3);
        assertThat(response.getMetadata().getNodeCountByType())
                .containsEntry("Instantiation", 1)
                .containsEntry("ENode", 1);
        assertThat(response.getMetadata().getEdgeCountByKind()).containsEntry("DIRECT", 1);
        assertThat(response.getHighlightedNodes()).isEmpty();
    }

    @Test
    void sessionResponseListsDescriptionsAndLongestPaths() {
        session.applyChain(List.of(new GraphFilter.ShowLongestPath(1)));

        SessionResponse response = visualizationService.buildSessionResponse(session);

        assertThat(response.getSessionId()).isEqualTo("s-42");
        assertThat(response.getAppliedFilters()).containsExactly("Show only nodes on the longest path through node 1");
        assertThat(response.getLongestPaths()).containsExactly(List.of(0, 1, 2));
        assertThat(response.getGraph().getNodes()).hasSize(3);
        assertThat(response.getGraph().getHighlightedNodes()).containsExactly("n0", "n1", "n2");
    }
}
