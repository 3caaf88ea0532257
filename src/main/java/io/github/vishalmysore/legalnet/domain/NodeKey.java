package io.github.vishalmysore.legalnet.domain;

import lombok.Value;

/**
 * Join key used by presentation collaborators to fetch enrichment data
 * (display labels, full text, neighbour counts) for a node of a given
 * time scope.
 */
@Value
public class NodeKey {
    String timeScope;
    String nodeId;

    @Override
    public String toString() {
        return timeScope + ":" + nodeId;
    }
}
