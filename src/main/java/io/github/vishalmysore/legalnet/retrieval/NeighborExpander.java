package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.graph.Adjacency;
import io.github.vishalmysore.legalnet.graph.AdjacencyIndex;

import java.util.*;
import java.util.logging.Logger;

/**
 * Bounded breadth-first expansion over the adjacency index.
 *
 * The expanded set only grows: a node, once reached, is never dropped and
 * never revisited. Neighbour order is adjacency order, so the result is
 * deterministic for a given snapshot.
 */
public class NeighborExpander {
    private static final Logger log = Logger.getLogger(NeighborExpander.class.getName());

    private final AdjacencyIndex adjacencyIndex;

    public NeighborExpander(AdjacencyIndex adjacencyIndex) {
        this.adjacencyIndex = adjacencyIndex;
    }

    /**
     * @param seeds               starting node ids, always part of the result
     * @param depth               number of hops
     * @param maxNeighborsPerNode cap on followed edges per node and hop, 0 for none
     * @param allowedEdgeTypes    edge types that may be followed; empty follows nothing
     * @return seeds plus every node reached, in discovery order
     */
    public Set<String> expand(Set<String> seeds, int depth, int maxNeighborsPerNode,
            Set<EdgeType> allowedEdgeTypes) {
        Set<String> expanded = new LinkedHashSet<>(seeds);
        Set<String> currentLayer = new LinkedHashSet<>(seeds);

        for (int hop = 0; hop < depth; hop++) {
            Set<String> nextLayer = new LinkedHashSet<>();

            for (String nodeId : currentLayer) {
                int followed = 0;
                for (Adjacency adjacency : adjacencyIndex.neighbors(nodeId)) {
                    if (!allowedEdgeTypes.contains(adjacency.getEdgeType())) {
                        continue;
                    }
                    if (maxNeighborsPerNode > 0 && followed >= maxNeighborsPerNode) {
                        break;
                    }
                    followed++;
                    if (expanded.add(adjacency.getNeighborId())) {
                        nextLayer.add(adjacency.getNeighborId());
                    }
                }
            }

            log.fine("Hop " + (hop + 1) + ": " + nextLayer.size() + " new nodes");
            currentLayer = nextLayer;
            if (currentLayer.isEmpty()) {
                break;
            }
        }

        return expanded;
    }
}
