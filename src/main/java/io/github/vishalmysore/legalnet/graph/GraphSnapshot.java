package io.github.vishalmysore.legalnet.graph;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.domain.NodeType;
import lombok.Value;

import java.util.*;
import java.util.logging.Logger;

/**
 * All nodes and edges of one (title, time scope) pair, together with the
 * adjacency index built from them. Snapshots are never mutated: switching
 * title or time scope means building a new snapshot.
 */
public class GraphSnapshot {
    private static final Logger log = Logger.getLogger(GraphSnapshot.class.getName());

    private final String title;
    private final String timeScope;
    private final Map<String, GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final AdjacencyIndex adjacencyIndex;

    public GraphSnapshot(List<GraphNode> nodes, List<GraphEdge> edges) {
        this(null, null, nodes, edges);
    }

    public GraphSnapshot(String title, String timeScope, List<GraphNode> nodes, List<GraphEdge> edges) {
        this.title = title;
        this.timeScope = timeScope;

        Map<String, GraphNode> byId = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id in snapshot: " + node.getId());
            }
        }
        this.nodes = Collections.unmodifiableMap(byId);

        List<GraphEdge> kept = new ArrayList<>(edges.size());
        int dangling = 0;
        for (GraphEdge edge : edges) {
            if (byId.containsKey(edge.getSourceId()) && byId.containsKey(edge.getTargetId())) {
                kept.add(edge);
            } else {
                dangling++;
            }
        }
        if (dangling > 0) {
            log.warning("Skipped " + dangling + " edges with endpoints outside the snapshot");
        }
        this.edges = Collections.unmodifiableList(kept);
        this.adjacencyIndex = AdjacencyIndex.build(this.edges);

        log.info("Snapshot " + describe() + " loaded: " + this.nodes.size() + " nodes, "
                + this.edges.size() + " edges");
    }

    public String getTitle() {
        return title;
    }

    public String getTimeScope() {
        return timeScope;
    }

    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Collection<GraphNode> getAllNodes() {
        return nodes.values();
    }

    public List<GraphEdge> getAllEdges() {
        return edges;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public AdjacencyIndex getAdjacencyIndex() {
        return adjacencyIndex;
    }

    public Statistics statistics() {
        Map<NodeType, Integer> nodeCounts = new EnumMap<>(NodeType.class);
        for (NodeType type : NodeType.values()) {
            nodeCounts.put(type, 0);
        }
        for (GraphNode node : nodes.values()) {
            if (node.getNodeType() != null) {
                nodeCounts.merge(node.getNodeType(), 1, Integer::sum);
            }
        }
        Map<EdgeType, Integer> edgeCounts = new EnumMap<>(EdgeType.class);
        for (EdgeType type : EdgeType.values()) {
            edgeCounts.put(type, 0);
        }
        for (GraphEdge edge : edges) {
            if (edge.getEdgeType() != null) {
                edgeCounts.merge(edge.getEdgeType(), 1, Integer::sum);
            }
        }
        return new Statistics(nodes.size(), edges.size(),
                Collections.unmodifiableMap(nodeCounts), Collections.unmodifiableMap(edgeCounts));
    }

    private String describe() {
        if (title == null && timeScope == null) {
            return "(unscoped)";
        }
        return "title=" + title + " scope=" + timeScope;
    }

    /**
     * Node and edge counts of a snapshot, broken down by type.
     */
    @Value
    public static class Statistics {
        int nodeCount;
        int edgeCount;
        Map<NodeType, Integer> nodesByType;
        Map<EdgeType, Integer> edgesByType;
    }
}
