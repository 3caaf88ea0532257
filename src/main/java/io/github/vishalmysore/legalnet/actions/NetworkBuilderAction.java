package io.github.vishalmysore.legalnet.actions;

import com.t4a.annotations.Action;
import com.t4a.annotations.Agent;
import io.github.vishalmysore.legalnet.config.ExplorerSettings;
import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.domain.NodeType;
import io.github.vishalmysore.legalnet.graph.Adjacency;
import io.github.vishalmysore.legalnet.graph.GraphSnapshot;
import io.github.vishalmysore.legalnet.retrieval.EdgeLimiter;
import io.github.vishalmysore.legalnet.retrieval.FilteredGraph;
import io.github.vishalmysore.legalnet.retrieval.NetworkBuilder;
import io.github.vishalmysore.legalnet.retrieval.NetworkQuery;
import io.github.vishalmysore.legalnet.retrieval.NodeMatch;
import io.github.vishalmysore.legalnet.retrieval.ResultNode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Tools4AI action class that exposes the network builder as AI-callable
 * tools, so an LLM can search the legal-code graph and walk its relations.
 */
@Agent(groupName = "LegalNetworkAgent", groupDescription = "Agent for exploring a legal-code knowledge graph of statutory sections, defined terms and their references")
public class NetworkBuilderAction {
    private static final Logger log = Logger.getLogger(NetworkBuilderAction.class.getName());

    private static final int LISTED_NODES = 25;

    // Shared builder instance (set when a snapshot is loaded)
    private static NetworkBuilder sharedBuilder;
    private static ExplorerSettings sharedSettings = ExplorerSettings.defaults();

    public static void initialize(NetworkBuilder builder, ExplorerSettings settings) {
        sharedBuilder = builder;
        sharedSettings = settings;
    }

    @Action(description = "Build a network of legal-code sections and terms matching comma-separated keywords. "
            + "Returns the matched nodes, most connected first, with the size of the network.")
    public String buildNetwork(String keywords) {
        log.info("buildNetwork invoked with keywords: " + keywords);
        if (sharedBuilder == null) {
            return "Error: Legal graph not initialized.";
        }

        NetworkQuery query = sharedSettings.toQuery(keywords);
        FilteredGraph graph = sharedBuilder.buildNetwork(query, sharedSettings.getSearchLogic(),
                sharedSettings.getRankingMode());
        graph = EdgeLimiter.limit(graph, sharedSettings.getEdgeLimit());

        StringBuilder sb = new StringBuilder();
        sb.append("Network: ").append(graph.getNodes().size()).append(" nodes, ")
                .append(graph.getEdges().size()).append(" edges (matched ").append(graph.getMatchedCount())
                .append(graph.isTruncated() ? ", truncated" : "").append(")\n");

        List<ResultNode> byDegree = new ArrayList<>(graph.getNodes());
        byDegree.sort((a, b) -> Integer.compare(b.getDegree(), a.getDegree()));
        for (int i = 0; i < Math.min(LISTED_NODES, byDegree.size()); i++) {
            ResultNode node = byDegree.get(i);
            sb.append(String.format("  [%d] %s (%s) - Degree: %d%n",
                    i + 1, label(node.getNode()), typeName(node.getNode()), node.getDegree()));
        }
        if (byDegree.size() > LISTED_NODES) {
            sb.append("  ... ").append(byDegree.size() - LISTED_NODES).append(" more\n");
        }
        return sb.toString();
    }

    @Action(description = "List the direct relations of one node of the legal-code graph, "
            + "such as the terms a section defines or the sections it references.")
    public String expandNode(String nodeId) {
        log.info("expandNode invoked for: " + nodeId);
        if (sharedBuilder == null) {
            return "Error: Legal graph not initialized.";
        }

        GraphSnapshot snapshot = sharedBuilder.getSnapshot();
        GraphNode node = snapshot.getNode(nodeId);
        if (node == null) {
            return "Node not found: " + nodeId;
        }

        List<Adjacency> neighbors = snapshot.getAdjacencyIndex().neighbors(nodeId);
        StringBuilder sb = new StringBuilder();
        sb.append("Node: ").append(label(node)).append("\n");
        sb.append("Relations (").append(neighbors.size()).append("):\n");
        for (Adjacency adjacency : neighbors) {
            GraphNode neighbor = snapshot.getNode(adjacency.getNeighborId());
            sb.append("  -> ").append(label(neighbor))
                    .append(" [").append(adjacency.getEdgeType().wireName()).append("]\n");
        }
        return sb.toString();
    }

    @Action(description = "Look up nodes of the legal-code graph whose name, label or text contains a phrase. "
            + "Returns at most 20 node ids with their labels and connection counts.")
    public String findNodes(String phrase) {
        log.info("findNodes invoked with: " + phrase);
        if (sharedBuilder == null) {
            return "Error: Legal graph not initialized.";
        }

        List<NodeMatch> matches = sharedBuilder.findNodes(phrase);
        if (matches.isEmpty()) {
            return "No nodes match: " + phrase;
        }
        StringBuilder sb = new StringBuilder();
        for (NodeMatch match : matches) {
            sb.append(String.format("  %s - %s (%d connections)%n",
                    match.getId(), match.getName(), match.getConnectionCount()));
        }
        return sb.toString();
    }

    @Action(description = "Get statistics about the loaded legal-code graph including node and edge counts "
            + "by type.")
    public String getGraphStatistics() {
        log.info("getGraphStatistics invoked");
        if (sharedBuilder == null) {
            return "Error: Legal graph not initialized.";
        }

        GraphSnapshot.Statistics stats = sharedBuilder.getSnapshot().statistics();
        return String.format(
                "Graph Statistics:%n  Nodes: %d (Sections: %d, Entities: %d, Concepts: %d, Index: %d)%n"
                        + "  Edges: %d (Definition: %d, Reference: %d, Hierarchy: %d)",
                stats.getNodeCount(),
                stats.getNodesByType().get(NodeType.SECTION),
                stats.getNodesByType().get(NodeType.ENTITY),
                stats.getNodesByType().get(NodeType.CONCEPT),
                stats.getNodesByType().get(NodeType.INDEX),
                stats.getEdgeCount(),
                stats.getEdgesByType().get(EdgeType.DEFINITION),
                stats.getEdgesByType().get(EdgeType.REFERENCE),
                stats.getEdgesByType().get(EdgeType.HIERARCHY));
    }

    private String label(GraphNode node) {
        if (node.getDisplayLabel() != null && !node.getDisplayLabel().isEmpty()) {
            return node.getDisplayLabel();
        }
        return node.getName() != null ? node.getName() : node.getId();
    }

    private String typeName(GraphNode node) {
        return node.getNodeType() == null ? "unknown" : node.getNodeType().wireName();
    }
}
