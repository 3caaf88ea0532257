package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.NodeType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Immutable network-builder request. Validated on construction, so an
 * instance that exists is always safe to hand to {@link NetworkBuilder}.
 *
 * Allow-lists are deliberately asymmetric: an empty node-type list admits
 * every node type, while an empty edge-type list admits no edges.
 */
@Value
public class NetworkQuery {
    List<String> searchTerms;
    Set<String> searchFields;
    Set<NodeType> allowedNodeTypes;
    Set<EdgeType> allowedEdgeTypes;
    int expansionDepth;

    // 0 means no per-node cap
    int maxNodesPerExpansion;

    int maxTotalNodes;

    @Builder(toBuilder = true)
    private NetworkQuery(@Singular List<String> searchTerms,
            @Singular Set<String> searchFields,
            @Singular Set<NodeType> allowedNodeTypes,
            @Singular Set<EdgeType> allowedEdgeTypes,
            int expansionDepth,
            int maxNodesPerExpansion,
            int maxTotalNodes) {
        if (expansionDepth < 0) {
            throw new InvalidQueryException("expansionDepth must be >= 0, was " + expansionDepth);
        }
        if (maxNodesPerExpansion < 0) {
            throw new InvalidQueryException("maxNodesPerExpansion must be >= 0, was " + maxNodesPerExpansion);
        }
        if (maxTotalNodes <= 0) {
            throw new InvalidQueryException("maxTotalNodes must be > 0, was " + maxTotalNodes);
        }
        if (searchTerms.contains(null)) {
            throw new InvalidQueryException("searchTerms must not contain null");
        }
        if (searchFields.contains(null)) {
            throw new InvalidQueryException("searchFields must not contain null");
        }
        this.searchTerms = searchTerms;
        this.searchFields = searchFields;
        this.allowedNodeTypes = allowedNodeTypes;
        this.allowedEdgeTypes = allowedEdgeTypes;
        this.expansionDepth = expansionDepth;
        this.maxNodesPerExpansion = maxNodesPerExpansion;
        this.maxTotalNodes = maxTotalNodes;
    }

    /**
     * Search runs only when both terms and fields are given; otherwise every
     * node of the snapshot is a candidate.
     */
    public boolean hasSearch() {
        return !searchTerms.isEmpty() && !searchFields.isEmpty();
    }

    public boolean admitsNodeType(NodeType type) {
        return allowedNodeTypes.isEmpty() || allowedNodeTypes.contains(type);
    }

    public boolean admitsEdgeType(EdgeType type) {
        return allowedEdgeTypes.contains(type);
    }
}
