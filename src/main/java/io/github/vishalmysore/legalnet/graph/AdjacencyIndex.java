package io.github.vishalmysore.legalnet.graph;

import io.github.vishalmysore.legalnet.domain.GraphEdge;

import java.util.*;

/**
 * Maps each node identifier to its incident edges. Every edge is inserted
 * twice, once per direction, so a node sees the same neighbours whichever
 * endpoint it occupied in the edge record. List order follows edge order.
 *
 * Built once per snapshot and read-only afterwards.
 */
public class AdjacencyIndex {

    private final Map<String, List<Adjacency>> adjacencyList;

    private AdjacencyIndex(Map<String, List<Adjacency>> adjacencyList) {
        this.adjacencyList = adjacencyList;
    }

    public static AdjacencyIndex build(Collection<GraphEdge> edges) {
        Map<String, List<Adjacency>> adjacency = new HashMap<>();
        for (GraphEdge edge : edges) {
            adjacency.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>())
                    .add(new Adjacency(edge.getTargetId(), edge.getEdgeType()));
            adjacency.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>())
                    .add(new Adjacency(edge.getSourceId(), edge.getEdgeType()));
        }
        Map<String, List<Adjacency>> frozen = new HashMap<>(adjacency.size() * 2);
        adjacency.forEach((id, list) -> frozen.put(id, Collections.unmodifiableList(list)));
        return new AdjacencyIndex(frozen);
    }

    public List<Adjacency> neighbors(String nodeId) {
        return adjacencyList.getOrDefault(nodeId, Collections.emptyList());
    }

    /**
     * Snapshot-wide degree: number of incident edges of any type.
     */
    public int degree(String nodeId) {
        return neighbors(nodeId).size();
    }

    public int size() {
        return adjacencyList.size();
    }

    public boolean isEmpty() {
        return adjacencyList.isEmpty();
    }
}
