package io.github.vishalmysore.legalnet.ranking;

import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.graph.AdjacencyIndex;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Degree-based top-N selection. Both policies sort by descending degree
 * with a stable sort, so ties keep candidate iteration order.
 */
public final class DegreeRanking {

    private DegreeRanking() {
    }

    /**
     * Ranks by snapshot-wide degree, ignoring any filter applied to the query.
     */
    public static List<String> byGlobalDegree(Collection<String> candidates, AdjacencyIndex index, int maxNodes) {
        Map<String, Integer> degrees = new HashMap<>();
        for (String nodeId : candidates) {
            degrees.put(nodeId, index.degree(nodeId));
        }
        return topByDegree(new ArrayList<>(candidates), degrees, maxNodes);
    }

    /**
     * Ranks by degree within the filtered edge set. Candidates touched by no
     * filtered edge are excluded before ranking.
     */
    public static List<String> bySubgraphDegree(Collection<String> candidates, List<GraphEdge> filteredEdges,
            int maxNodes) {
        Map<String, Integer> degrees = localDegrees(filteredEdges);
        List<String> ranked = candidates.stream()
                .filter(degrees::containsKey)
                .collect(Collectors.toCollection(ArrayList::new));
        return topByDegree(ranked, degrees, maxNodes);
    }

    /**
     * Number of edges in {@code edges} incident to each node.
     */
    public static Map<String, Integer> localDegrees(List<GraphEdge> edges) {
        Map<String, Integer> degrees = new HashMap<>();
        for (GraphEdge edge : edges) {
            degrees.merge(edge.getSourceId(), 1, Integer::sum);
            degrees.merge(edge.getTargetId(), 1, Integer::sum);
        }
        return degrees;
    }

    private static List<String> topByDegree(List<String> nodeIds, Map<String, Integer> degrees, int maxNodes) {
        nodeIds.sort((a, b) -> Integer.compare(degrees.getOrDefault(b, 0), degrees.getOrDefault(a, 0)));
        return nodeIds.size() > maxNodes ? new ArrayList<>(nodeIds.subList(0, maxNodes)) : nodeIds;
    }
}
