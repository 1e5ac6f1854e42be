package com.axiomprofiler.service.disable;

import com.axiomprofiler.model.graph.EdgeKind;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.support.TraceBuilder;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class DisablerEngineTest {

    private final DisablerEngine engine = new DisablerEngine();

    /**
     * I0 -> E1 -> I2, I0 -> E3, I0 -> E4 -> {I2, I5}
     */
    private RawInstGraph enodeGraph() {
        TraceBuilder trace = new TraceBuilder();
        int i0 = trace.inst(1.0, null);
        int e1 = trace.enode();
        int i2 = trace.inst(1.0, null);
        int e3 = trace.enode();
        int e4 = trace.enode();
        int i5 = trace.inst(1.0, null);
        trace.yield(i0, e1).edge(e1, i2, EdgeKind.BLAME)
                .yield(i0, e3)
                .yield(i0, e4).edge(e4, i2, EdgeKind.BLAME).edge(e4, i5, EdgeKind.BLAME);
        return trace.graph();
    }

    /**
     * E0 -> G1 -> T2 -> I3, plus a parentless T4
     */
    private RawInstGraph equalityGraph() {
        TraceBuilder trace = new TraceBuilder();
        int e0 = trace.enode();
        int g1 = trace.givenEquality();
        int t2 = trace.transEquality();
        int i3 = trace.inst(1.0, null);
        trace.transEquality();
        trace.edge(e0, g1, EdgeKind.EQUALITY_FACT)
                .edge(g1, t2, EdgeKind.TEQUALITY_SIMPLE)
                .edge(t2, i3, EdgeKind.BLAME_EQ, 0, 0);
        return trace.graph();
    }

    private List<Integer> disabled(RawInstGraph graph) {
        return IntStream.range(0, graph.nodeCount()).filter(graph::isDisabled).boxed().collect(Collectors.toList());
    }

    @Test
    void smartDisablesLeafAndPassThroughEnodes() {
        RawInstGraph graph = enodeGraph();

        engine.classify(EnumSet.of(Disabler.SMART), graph);

        assertThat(disabled(graph)).containsExactly(1, 3);
    }

    @Test
    void smartDisablesPassThroughAndParentlessEqualities() {
        RawInstGraph graph = equalityGraph();

        engine.classify(EnumSet.of(Disabler.SMART), graph);

        // E0 is a root with one child, so it carries branching information.
        assertThat(disabled(graph)).containsExactly(1, 2, 4);
    }

    @Test
    void kindDisablersMatchOnNodeType() {
        RawInstGraph graph = equalityGraph();

        engine.classify(EnumSet.of(Disabler.ENODES), graph);
        assertThat(disabled(graph)).containsExactly(0);

        engine.classify(EnumSet.of(Disabler.GIVEN_EQUALITIES), graph);
        assertThat(disabled(graph)).containsExactly(1);

        engine.classify(EnumSet.of(Disabler.ALL_EQUALITIES), graph);
        assertThat(disabled(graph)).containsExactly(1, 2, 4);
    }

    @Test
    void disablersCombineWithOr() {
        RawInstGraph graph = equalityGraph();

        engine.classify(EnumSet.of(Disabler.ENODES, Disabler.GIVEN_EQUALITIES), graph);

        assertThat(disabled(graph)).containsExactly(0, 1);
    }

    @Test
    void instantiationsAreNeverDisabled() {
        RawInstGraph graph = enodeGraph();

        engine.classify(EnumSet.allOf(Disabler.class), graph);

        assertThat(disabled(graph)).doesNotContain(0, 2, 5);
    }

    @Test
    void classificationNeverTouchesVisibility() {
        RawInstGraph graph = enodeGraph();
        graph.setVisibilityMany(true, List.of(1, 4));
        BitSet before = graph.visibilitySnapshot();

        for (Set<Disabler> disablers : List.of(EnumSet.of(Disabler.SMART), EnumSet.allOf(Disabler.class),
                EnumSet.noneOf(Disabler.class))) {
            engine.classify(disablers, graph);
            assertThat(graph.visibilitySnapshot()).isEqualTo(before);
        }
    }

    @Test
    void emptyDisablerSetClearsPreviousMarks() {
        RawInstGraph graph = enodeGraph();
        engine.classify(EnumSet.of(Disabler.ENODES), graph);

        engine.classify(EnumSet.noneOf(Disabler.class), graph);

        assertThat(graph.disabledCount()).isZero();
    }

    @Test
    void descriptionsNameWhatIsDisabled() {
        assertThat(Disabler.SMART.getDescription()).isEqualTo("trivial nodes");
        assertThat(Disabler.ENODES.getDescription()).isEqualTo("yield terms");
    }
}
