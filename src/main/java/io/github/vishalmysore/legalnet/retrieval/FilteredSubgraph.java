package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.GraphEdge;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Output of {@link CandidateFilter}: connected, type-admitted node ids and the
 * edges joining them, both in snapshot order.
 */
@Value
public class FilteredSubgraph {
    Set<String> nodeIds;
    List<GraphEdge> edges;
}
