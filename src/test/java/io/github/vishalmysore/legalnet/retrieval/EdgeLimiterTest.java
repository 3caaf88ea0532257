package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.TestGraphs;
import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.ranking.RankingMode;
import io.github.vishalmysore.legalnet.search.SearchLogic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EdgeLimiterTest {

    private FilteredGraph star;

    @BeforeEach
    void setUp() {
        NetworkBuilder builder = new NetworkBuilder(TestGraphs.starNodes(), TestGraphs.starEdges());
        star = builder.buildNetwork(NetworkQuery.builder()
                .allowedEdgeTypes(EnumSet.allOf(EdgeType.class))
                .maxTotalNodes(10)
                .build());
    }

    @Test
    void underTheLimitReturnsSameGraph() {
        assertSame(star, EdgeLimiter.limit(star, 4));
    }

    @Test
    void keepsEdgesBetweenBestConnectedNodes() {
        FilteredGraph limited = EdgeLimiter.limit(star, 2);

        List<String> edges = limited.getEdges().stream()
                .map(e -> e.getSourceId() + "-" + e.getTargetId())
                .collect(Collectors.toList());
        assertEquals(List.of("A-B", "A-D"), edges);
        assertEquals(List.of("A", "B", "D"), List.copyOf(limited.nodeIds()));
        assertEquals(2, limited.getNodes().get(0).getDegree());
    }

    @Test
    void marksResultTruncatedAndKeepsMatchedCount() {
        FilteredGraph limited = EdgeLimiter.limit(star, 1);

        assertTrue(limited.isTruncated());
        assertEquals(star.getMatchedCount(), limited.getMatchedCount());
        for (GraphEdge edge : limited.getEdges()) {
            assertTrue(limited.nodeIds().contains(edge.getSourceId()));
            assertTrue(limited.nodeIds().contains(edge.getTargetId()));
        }
    }

    @Test
    void dropsEdgelessNodesEvenUnderTheLimit() {
        NetworkBuilder builder = new NetworkBuilder(TestGraphs.starNodes(), TestGraphs.starEdges());
        FilteredGraph onlyHub = builder.buildNetwork(NetworkQuery.builder()
                .allowedEdgeTypes(EnumSet.allOf(EdgeType.class))
                .maxTotalNodes(1)
                .build(), SearchLogic.OR, RankingMode.GLOBAL);
        assertEquals(List.of("A"), List.copyOf(onlyHub.nodeIds()));
        assertEquals(0, onlyHub.getNodes().get(0).getDegree());

        FilteredGraph limited = EdgeLimiter.limit(onlyHub, 4000);

        assertTrue(limited.getNodes().isEmpty());
        assertTrue(limited.getEdges().isEmpty());
        assertTrue(limited.isTruncated());
        assertEquals(onlyHub.getMatchedCount(), limited.getMatchedCount());
    }

    @Test
    void untruncatedResultUnderTheLimitStaysUntruncated() {
        assertFalse(EdgeLimiter.limit(star, 10).isTruncated());
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> EdgeLimiter.limit(star, 0));
    }
}
