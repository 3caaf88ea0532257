package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.GraphNode;
import lombok.Value;

/**
 * A node of a query result annotated with its degree in the result's edge set.
 */
@Value
public class ResultNode {
    GraphNode node;
    int degree;

    public String getId() {
        return node.getId();
    }
}
