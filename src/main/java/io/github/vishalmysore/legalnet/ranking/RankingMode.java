package io.github.vishalmysore.legalnet.ranking;

import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.graph.AdjacencyIndex;

import java.util.Collection;
import java.util.List;

/**
 * Policy for choosing which nodes survive when a result exceeds its node cap.
 */
public enum RankingMode {
    /** Snapshot-wide degree from the adjacency index. Cheap: nothing to recount. */
    GLOBAL {
        @Override
        public List<String> select(Collection<String> candidates, AdjacencyIndex index,
                List<GraphEdge> filteredEdges, int maxNodes) {
            return DegreeRanking.byGlobalDegree(candidates, index, maxNodes);
        }
    },
    /** Degree within the filtered subgraph: local importance for the current query. */
    SUBGRAPH {
        @Override
        public List<String> select(Collection<String> candidates, AdjacencyIndex index,
                List<GraphEdge> filteredEdges, int maxNodes) {
            return DegreeRanking.bySubgraphDegree(candidates, filteredEdges, maxNodes);
        }
    };

    /**
     * Picks at most {@code maxNodes} candidate ids, highest degree first.
     */
    public abstract List<String> select(Collection<String> candidates, AdjacencyIndex index,
            List<GraphEdge> filteredEdges, int maxNodes);
}
