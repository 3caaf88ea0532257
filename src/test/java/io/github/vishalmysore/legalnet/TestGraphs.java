package io.github.vishalmysore.legalnet;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.domain.NodeType;

import java.util.List;

/**
 * Small hand-built graphs shared by the tests.
 */
public final class TestGraphs {

    private TestGraphs() {
    }

    public static GraphNode node(String id, NodeType type) {
        return GraphNode.builder().id(id).name(id).nodeType(type).timeScope("2024").build();
    }

    public static GraphEdge edge(String source, String target, EdgeType type) {
        return GraphEdge.builder()
                .sourceId(source)
                .targetId(target)
                .edgeType(type)
                .action(type.wireName())
                .timeScope("2024")
                .build();
    }

    /** A(section) -reference- B(entity) -definition- C(concept). */
    public static List<GraphNode> abcNodes() {
        return List.of(node("A", NodeType.SECTION), node("B", NodeType.ENTITY), node("C", NodeType.CONCEPT));
    }

    public static List<GraphEdge> abcEdges() {
        return List.of(edge("A", "B", EdgeType.REFERENCE), edge("B", "C", EdgeType.DEFINITION));
    }

    /**
     * Star around A: A has degree 3 (B, D, E), C hangs off B with degree 1.
     */
    public static List<GraphNode> starNodes() {
        return List.of(
                node("A", NodeType.SECTION),
                node("B", NodeType.ENTITY),
                node("C", NodeType.CONCEPT),
                node("D", NodeType.SECTION),
                node("E", NodeType.ENTITY));
    }

    public static List<GraphEdge> starEdges() {
        return List.of(
                edge("A", "B", EdgeType.REFERENCE),
                edge("B", "C", EdgeType.DEFINITION),
                edge("A", "D", EdgeType.HIERARCHY),
                edge("A", "E", EdgeType.REFERENCE));
    }
}
