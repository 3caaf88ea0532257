package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.TestGraphs;
import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.graph.AdjacencyIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static io.github.vishalmysore.legalnet.TestGraphs.edge;
import static org.junit.jupiter.api.Assertions.*;

class NeighborExpanderTest {

    private static final Set<EdgeType> ALL_EDGES = EnumSet.allOf(EdgeType.class);

    // Chain A - B - C - D - E plus a fan out of B
    private static final List<GraphEdge> CHAIN = List.of(
            edge("A", "B", EdgeType.REFERENCE),
            edge("B", "C", EdgeType.DEFINITION),
            edge("C", "D", EdgeType.HIERARCHY),
            edge("D", "E", EdgeType.REFERENCE),
            edge("B", "F1", EdgeType.REFERENCE),
            edge("B", "F2", EdgeType.REFERENCE));

    private final NeighborExpander expander = new NeighborExpander(AdjacencyIndex.build(CHAIN));

    @Test
    void depthZeroReturnsSeeds() {
        assertEquals(Set.of("A"), expander.expand(Set.of("A"), 0, 0, ALL_EDGES));
    }

    @Test
    void eachHopAddsTheNextLayer() {
        assertEquals(Set.of("A", "B"), expander.expand(Set.of("A"), 1, 0, ALL_EDGES));
        assertEquals(Set.of("A", "B", "C", "F1", "F2"), expander.expand(Set.of("A"), 2, 0, ALL_EDGES));
        assertEquals(Set.of("A", "B", "C", "F1", "F2", "D"), expander.expand(Set.of("A"), 3, 0, ALL_EDGES));
    }

    @Test
    @DisplayName("an empty edge-type allow-list follows no edges")
    void emptyAllowListFollowsNothing() {
        assertEquals(Set.of("A"), expander.expand(Set.of("A"), 5, 0, EnumSet.noneOf(EdgeType.class)));
    }

    @Test
    void onlyAllowedEdgeTypesAreFollowed() {
        Set<String> expanded = expander.expand(Set.of("B"), 3, 0, EnumSet.of(EdgeType.REFERENCE));
        assertEquals(Set.of("B", "A", "F1", "F2"), expanded);
    }

    @Test
    void neighborCapKeepsAdjacencyOrder() {
        // B's adjacency: A, C, F1, F2
        assertEquals(List.of("B", "A", "C"), List.copyOf(expander.expand(Set.of("B"), 1, 2, ALL_EDGES)));
    }

    @Test
    void neighborCapAppliesAfterTypeFilter() {
        assertEquals(List.of("B", "A", "F1"),
                List.copyOf(expander.expand(Set.of("B"), 1, 2, EnumSet.of(EdgeType.REFERENCE))));
    }

    @Test
    void stopsWhenNoNewNodesAppear() {
        NeighborExpander pair = new NeighborExpander(AdjacencyIndex.build(TestGraphs.abcEdges()));
        assertEquals(Set.of("A", "B", "C"), pair.expand(Set.of("A"), 100, 0, ALL_EDGES));
    }

    @Test
    void deeperExpansionIsSuperset() {
        Set<String> previous = expander.expand(Set.of("E"), 0, 0, ALL_EDGES);
        for (int depth = 1; depth <= 6; depth++) {
            Set<String> current = expander.expand(Set.of("E"), depth, 1, ALL_EDGES);
            assertTrue(current.containsAll(previous), "depth " + depth + " lost nodes");
            previous = current;
        }
    }

    @Test
    void unknownSeedIsKeptWithoutNeighbors() {
        assertEquals(Set.of("Z"), expander.expand(Set.of("Z"), 2, 0, ALL_EDGES));
    }
}
