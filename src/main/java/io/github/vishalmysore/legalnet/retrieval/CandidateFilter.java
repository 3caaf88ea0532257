package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.graph.GraphSnapshot;

import java.util.*;

/**
 * Narrows a candidate set to type-admitted nodes that keep at least one
 * admitted edge to another type-admitted candidate.
 *
 * The node-type check runs before edges are collected, so every surviving
 * edge joins two surviving nodes and no surviving node is isolated.
 */
public class CandidateFilter {

    private final GraphSnapshot snapshot;

    public CandidateFilter(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public FilteredSubgraph apply(Set<String> candidateIds, NetworkQuery query) {
        Set<String> typeAdmitted = new HashSet<>();
        for (GraphNode node : snapshot.getAllNodes()) {
            if (candidateIds.contains(node.getId()) && query.admitsNodeType(node.getNodeType())) {
                typeAdmitted.add(node.getId());
            }
        }

        List<GraphEdge> edges = new ArrayList<>();
        Set<String> nodesWithEdges = new HashSet<>();
        for (GraphEdge edge : snapshot.getAllEdges()) {
            if (query.admitsEdgeType(edge.getEdgeType())
                    && typeAdmitted.contains(edge.getSourceId())
                    && typeAdmitted.contains(edge.getTargetId())) {
                edges.add(edge);
                nodesWithEdges.add(edge.getSourceId());
                nodesWithEdges.add(edge.getTargetId());
            }
        }

        Set<String> connected = new LinkedHashSet<>();
        for (GraphNode node : snapshot.getAllNodes()) {
            if (nodesWithEdges.contains(node.getId())) {
                connected.add(node.getId());
            }
        }
        return new FilteredSubgraph(Collections.unmodifiableSet(connected), Collections.unmodifiableList(edges));
    }
}
