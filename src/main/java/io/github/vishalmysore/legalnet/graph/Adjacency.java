package io.github.vishalmysore.legalnet.graph;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import lombok.Value;

/**
 * One entry of an adjacency list: the node on the other end of an edge and
 * the type of that edge.
 */
@Value
public class Adjacency {
    String neighborId;
    EdgeType edgeType;
}
