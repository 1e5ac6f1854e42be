package com.axiomprofiler.service.graph;

import com.axiomprofiler.exception.GraphCycleException;
import com.axiomprofiler.exception.InconsistentFactStoreException;
import com.axiomprofiler.model.facts.Dependency;
import com.axiomprofiler.model.facts.InMemoryFactStore;
import com.axiomprofiler.model.graph.Depth;
import com.axiomprofiler.model.graph.EdgeKind;
import com.axiomprofiler.model.graph.NodeKind;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.support.TraceBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstGraphBuilderTest {

    private final InstGraphBuilder builder = new InstGraphBuilder();

    @Test
    void createsOneNodePerDiscoveryKey_inDiscoveryOrder() {
        TraceBuilder trace = new TraceBuilder();
        int q = trace.quantifier("prf");
        int i0 = trace.inst(3.0, q);
        int e1 = trace.enode();
        int i2 = trace.inst(1.0, q);
        trace.yield(i0, e1).edge(e1, i2, EdgeKind.BLAME, 0, null);

        RawInstGraph graph = builder.build(trace.facts());

        assertThat(graph.nodeCount()).isEqualTo(3);
        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.node(0).getKind()).isEqualTo(NodeKind.instantiation(0));
        assertThat(graph.node(1).getKind()).isEqualTo(NodeKind.enode(0));
        assertThat(graph.node(2).getKind()).isEqualTo(NodeKind.instantiation(1));
        assertThat(graph.node(1).getDiscoveryKey()).isEqualTo(TraceBuilder.keyOf(1));
        assertThat(graph.edge(1).getKind()).isEqualTo(EdgeKind.BLAME);
        assertThat(graph.edge(1).getTriggerTerm()).isZero();
    }

    @Test
    void copiesCostQuantifierAndTheoryFlagFromInstantiationAndMatch() {
        TraceBuilder trace = new TraceBuilder();
        int q = trace.quantifier("prf");
        trace.inst(7.5, q);
        trace.theoryInst(2.0);
        trace.enode();

        RawInstGraph graph = builder.build(trace.facts());

        assertThat(graph.node(0).getCost()).isEqualTo(7.5);
        assertThat(graph.node(0).getQuantifier()).isEqualTo(q);
        assertThat(graph.node(0).isTheoryDiscovered()).isFalse();
        assertThat(graph.node(0).getGeneration()).isEqualTo(1);
        assertThat(graph.node(1).isTheoryDiscovered()).isTrue();
        assertThat(graph.node(1).getQuantifier()).isNull();
        assertThat(graph.node(2).getCost()).isZero();
        assertThat(graph.node(2).isInstantiation()).isFalse();
    }

    @Test
    void computesDepthsCountsAndRanks() {
        // 0 -> 1 -> 3, 0 -> 2 -> 3, 2 -> 4
        TraceBuilder trace = new TraceBuilder();
        int a = trace.inst(1.0, null);
        int b = trace.inst(4.0, null);
        int c = trace.inst(4.0, null);
        int d = trace.inst(9.0, null);
        int e = trace.inst(0.5, null);
        trace.yield(a, b).yield(a, c).yield(b, d).yield(c, d).yield(c, e);

        RawInstGraph graph = builder.build(trace.facts());

        assertThat(graph.node(a).getFwdDepth()).isEqualTo(Depth.ZERO);
        assertThat(graph.node(d).getFwdDepth()).isEqualTo(new Depth(2, 2));
        assertThat(graph.node(a).getBwdDepth()).isEqualTo(new Depth(2, 2));
        assertThat(graph.node(c).getBwdDepth()).isEqualTo(new Depth(1, 1));
        assertThat(graph.node(d).getParentCount()).isEqualTo(2);
        assertThat(graph.node(c).getChildCount()).isEqualTo(2);

        assertThat(graph.getCostRanked()).containsExactly(d, b, c, a, e);
        assertThat(graph.node(d).getCostRank()).isZero();
        assertThat(graph.node(b).getCostRank()).isEqualTo(1);
        assertThat(graph.node(c).getCostRank()).isEqualTo(2);
        assertThat(graph.getBranchingRanked()).containsExactly(a, c, b, d, e);
    }

    @Test
    void reusesExistingNodeWhenTheSameEntityIsReferencedTwice() {
        TraceBuilder trace = new TraceBuilder();
        int i0 = trace.inst(1.0, null);
        int e1 = trace.enode();
        trace.yield(i0, e1).yield(i0, e1);

        RawInstGraph graph = builder.build(trace.facts());

        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.node(e1).getParentCount()).isEqualTo(2);
    }

    @Test
    void emptyFactStoreYieldsEmptyGraph() {
        RawInstGraph graph = builder.build(InMemoryFactStore.empty());

        assertThat(graph.nodeCount()).isZero();
        assertThat(graph.edgeCount()).isZero();
        assertThat(graph.getCostRanked()).isEmpty();
    }

    @Test
    void rejectsDependencyFromUnknownEntity() {
        TraceBuilder trace = new TraceBuilder();
        trace.inst(1.0, null);
        InMemoryFactStore facts = trace.facts();
        facts.getDependencies().add(Dependency.builder()
                .from(99)
                .to(TraceBuilder.keyOf(0))
                .target(NodeKind.instantiation(0))
                .kind(EdgeKind.YIELD)
                .build());

        assertThatThrownBy(() -> builder.build(facts))
                .isInstanceOf(InconsistentFactStoreException.class)
                .hasMessageContaining("99");
    }

    @Test
    void rejectsEdgeAgainstDiscoveryOrder() {
        TraceBuilder trace = new TraceBuilder();
        int first = trace.inst(1.0, null);
        int second = trace.inst(1.0, null);
        trace.yield(second, first);

        assertThatThrownBy(() -> builder.build(trace.facts()))
                .isInstanceOf(GraphCycleException.class)
                .satisfies(ex -> {
                    GraphCycleException cycle = (GraphCycleException) ex;
                    assertThat(cycle.getSource()).isEqualTo(second);
                    assertThat(cycle.getTarget()).isEqualTo(first);
                });
    }

    @Test
    void rejectsSelfLoop() {
        TraceBuilder trace = new TraceBuilder();
        int only = trace.inst(1.0, null);
        trace.yield(only, only);

        assertThatThrownBy(() -> builder.build(trace.facts())).isInstanceOf(GraphCycleException.class);
    }

    @Test
    void rejectsInstantiationWithUnknownMatch() {
        TraceBuilder trace = new TraceBuilder();
        trace.inst(1.0, null);
        InMemoryFactStore facts = trace.facts();
        facts.getInstantiations().get(0).setMatch(5);

        assertThatThrownBy(() -> builder.build(facts))
                .isInstanceOf(InconsistentFactStoreException.class)
                .hasMessageContaining("unknown match");
    }

    @Test
    void rejectsNodeKindOutsideItsCollection() {
        InMemoryFactStore facts = InMemoryFactStore.empty();
        facts.getDependencies().add(Dependency.builder().from(0).to(1).target(NodeKind.enode(3)).build());

        assertThatThrownBy(() -> builder.build(facts)).isInstanceOf(InconsistentFactStoreException.class);
    }
}
