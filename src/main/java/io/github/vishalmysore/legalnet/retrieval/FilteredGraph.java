package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.domain.NodeKey;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of one network-builder query. {@code matchedCount} is the number of
 * connected, type-filtered nodes before the node cap was applied.
 */
@Value
public class FilteredGraph {
    List<ResultNode> nodes;
    List<GraphEdge> edges;
    boolean truncated;
    int matchedCount;

    public static FilteredGraph empty() {
        return new FilteredGraph(Collections.emptyList(), Collections.emptyList(), false, 0);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Set<String> nodeIds() {
        return nodes.stream().map(ResultNode::getId).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<NodeKey> nodeKeys() {
        return nodes.stream().map(n -> n.getNode().key()).collect(Collectors.toList());
    }
}
