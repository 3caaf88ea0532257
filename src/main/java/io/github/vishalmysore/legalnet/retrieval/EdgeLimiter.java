package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.ranking.DegreeRanking;

import java.util.*;
import java.util.logging.Logger;

/**
 * Prepares a built network for display: caps the number of edges, keeping
 * edges between well-connected nodes first, and drops every node left
 * without an edge. The latter applies even when the edge count is already
 * under the cap.
 */
public final class EdgeLimiter {
    private static final Logger log = Logger.getLogger(EdgeLimiter.class.getName());

    private EdgeLimiter() {
    }

    public static FilteredGraph limit(FilteredGraph graph, int maxEdges) {
        if (maxEdges <= 0) {
            throw new IllegalArgumentException("maxEdges must be > 0, was " + maxEdges);
        }

        boolean cut = graph.getEdges().size() > maxEdges;
        List<GraphEdge> kept = cut ? topEdges(graph.getEdges(), maxEdges) : graph.getEdges();

        Map<String, Integer> keptDegrees = DegreeRanking.localDegrees(kept);
        List<ResultNode> nodes = new ArrayList<>();
        for (ResultNode node : graph.getNodes()) {
            Integer degree = keptDegrees.get(node.getId());
            if (degree != null) {
                nodes.add(new ResultNode(node.getNode(), degree));
            }
        }
        if (!cut && nodes.size() == graph.getNodes().size()) {
            return graph;
        }

        log.info("Edge limit " + maxEdges + " applied: " + graph.getEdges().size() + " -> " + kept.size()
                + " edges, " + graph.getNodes().size() + " -> " + nodes.size() + " nodes");
        return new FilteredGraph(Collections.unmodifiableList(nodes), Collections.unmodifiableList(kept),
                graph.isTruncated() || cut, graph.getMatchedCount());
    }

    private static List<GraphEdge> topEdges(List<GraphEdge> edges, int maxEdges) {
        Map<String, Integer> degrees = DegreeRanking.localDegrees(edges);
        List<GraphEdge> ranked = new ArrayList<>(edges);
        ranked.sort(Comparator.comparingInt((GraphEdge e) -> endpointDegree(degrees, e)).reversed());

        // restore result order for the kept edges
        Set<GraphEdge> keptSet = Collections.newSetFromMap(new IdentityHashMap<>());
        keptSet.addAll(ranked.subList(0, maxEdges));
        List<GraphEdge> kept = new ArrayList<>(maxEdges);
        for (GraphEdge edge : edges) {
            if (keptSet.contains(edge)) {
                kept.add(edge);
            }
        }
        return kept;
    }

    private static int endpointDegree(Map<String, Integer> degrees, GraphEdge edge) {
        return degrees.getOrDefault(edge.getSourceId(), 0) + degrees.getOrDefault(edge.getTargetId(), 0);
    }
}
