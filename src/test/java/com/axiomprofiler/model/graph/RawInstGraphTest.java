package com.axiomprofiler.model.graph;

import com.axiomprofiler.support.TraceBuilder;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class RawInstGraphTest {

    /** A0 -> B1 -> D3, A0 -> C2 -> D3 */
    private RawInstGraph diamond() {
        TraceBuilder trace = new TraceBuilder();
        int a = trace.inst(1.0, null);
        int b = trace.inst(1.0, null);
        int c = trace.inst(1.0, null);
        int d = trace.inst(1.0, null);
        trace.yield(a, b).yield(a, c).yield(b, d).yield(c, d);
        return trace.graph();
    }

    @Test
    void longestPathThroughDiamondSinkPrefersLowerIndexParent() {
        RawInstGraph graph = diamond();

        assertThat(graph.longestPathThrough(3)).containsExactly(0, 1, 3);
        assertThat(graph.longestPathThrough(2)).containsExactly(0, 2, 3);
        assertThat(graph.longestPathThrough(0)).containsExactly(0, 1, 3);
    }

    @Test
    void longestPathFollowsDeeperBranchOverLowerIndex() {
        // 0 -> 1, 0 -> 2 -> 3
        TraceBuilder trace = new TraceBuilder();
        int root = trace.inst(1.0, null);
        int shallow = trace.inst(1.0, null);
        int deep = trace.inst(1.0, null);
        int leaf = trace.inst(1.0, null);
        trace.yield(root, shallow).yield(root, deep).yield(deep, leaf);

        assertThat(trace.graph().longestPathThrough(root)).containsExactly(root, deep, leaf);
    }

    @Test
    void reachableIncludesRootAndFollowsDirection() {
        RawInstGraph graph = diamond();

        BitSet descendants = graph.reachable(1, Direction.OUTGOING);
        BitSet ancestors = graph.reachable(1, Direction.INCOMING);

        assertThat(descendants.stream().boxed().collect(Collectors.toList())).containsExactly(1, 3);
        assertThat(ancestors.stream().boxed().collect(Collectors.toList())).containsExactly(0, 1);
    }

    @Test
    void snapshotAndRestoreRoundTripVisibility() {
        RawInstGraph graph = diamond();
        graph.setVisibilityMany(true, List.of(1, 2));
        BitSet snapshot = graph.visibilitySnapshot();

        graph.resetVisibilityTo(false);
        assertThat(graph.visibleNodeCount()).isEqualTo(4);

        graph.restoreVisibility(snapshot);
        assertThat(graph.node(1).isHidden()).isTrue();
        assertThat(graph.node(2).isHidden()).isTrue();
        assertThat(graph.visibleNodeCount()).isEqualTo(2);
    }

    @Test
    void shownRequiresVisibleAndNotDisabled() {
        RawInstGraph graph = diamond();
        graph.resetDisabledTo(idx -> idx == 2);
        graph.setVisibilityMany(true, List.of(1));

        assertThat(graph.isShown(0)).isTrue();
        assertThat(graph.isShown(1)).isFalse();
        assertThat(graph.isShown(2)).isFalse();
        assertThat(graph.node(2).isVisible()).isTrue();
        assertThat(graph.disabledCount()).isEqualTo(1);
    }

    @Test
    void neighboursListsParentsAndChildren() {
        RawInstGraph graph = diamond();

        assertThat(graph.neighbours(3, Direction.INCOMING)).containsExactly(1, 2);
        assertThat(graph.neighbours(0, Direction.OUTGOING)).containsExactly(1, 2);
        assertThat(graph.neighbours(0, Direction.INCOMING)).isEmpty();
    }

    @Test
    void adjacencyAccessorsFollowInsertionOrder() {
        RawInstGraph graph = diamond();

        assertThat(graph.outDegree(0)).isEqualTo(2);
        assertThat(graph.inDegree(3)).isEqualTo(2);
        assertThat(graph.inDegree(0)).isZero();
        assertThat(graph.edge(graph.outgoingAt(0, 0)).getTarget()).isEqualTo(1);
        assertThat(graph.edge(graph.outgoingAt(0, 1)).getTarget()).isEqualTo(2);
        assertThat(graph.edge(graph.incomingAt(3, 1)).getSource()).isEqualTo(2);
    }
}
