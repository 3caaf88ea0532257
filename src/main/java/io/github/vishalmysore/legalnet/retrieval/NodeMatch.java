package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.NodeKey;
import lombok.Value;

/**
 * One row of a quick node lookup: the label to show and the node's
 * snapshot-wide connection count.
 */
@Value
public class NodeMatch {
    String id;
    String name;
    int connectionCount;
    String timeScope;

    public NodeKey key() {
        return new NodeKey(timeScope, id);
    }
}
