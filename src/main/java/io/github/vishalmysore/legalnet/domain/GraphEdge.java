package io.github.vishalmysore.legalnet.domain;

import lombok.Builder;
import lombok.Value;

/**
 * An edge of the legal-code graph. Endpoints are bare node identifiers;
 * the edge is undirected for traversal purposes.
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {
    String sourceId;
    String targetId;
    EdgeType edgeType;

    // Human-readable relation label, e.g. "defines" or "references"
    String action;

    String timeScope;
    String uscTitle;
    String definition;
    String location;
    String timestamp;
    Double weight;
}
