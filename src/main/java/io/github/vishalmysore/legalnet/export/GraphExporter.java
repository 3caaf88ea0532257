package io.github.vishalmysore.legalnet.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.retrieval.FilteredGraph;
import io.github.vishalmysore.legalnet.retrieval.ResultNode;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.logging.Logger;

/**
 * Exports a built network as JSON, as node and edge CSV tables, or as a
 * single edge list carrying endpoint attributes for network-analysis tools.
 */
public class GraphExporter {
    private static final Logger log = Logger.getLogger(GraphExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final List<String> NODE_COLUMNS = List.of(
            "id", "name", "node_type", "display_label", "time", "degree");
    private static final List<String> EDGE_COLUMNS = List.of(
            "source", "target", "edge_type", "action", "time", "weight");
    private static final List<String> EDGE_LIST_COLUMNS = List.of(
            "source_id", "source_type", "source_label", "target_id", "target_type", "target_label");

    private final Clock clock;

    public GraphExporter() {
        this(Clock.systemUTC());
    }

    public GraphExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Full result as a JSON document with metadata, nodes and edges.
     */
    public String toJson(FilteredGraph graph, ExportMetadata metadata) {
        try {
            return mapper.writeValueAsString(buildDocument(graph, metadata));
        } catch (Exception e) {
            log.severe("Failed to export network as JSON: " + e.getMessage());
            return "{}";
        }
    }

    public String nodesToCsv(FilteredGraph graph, ExportMetadata metadata) {
        if (graph.getNodes().isEmpty()) {
            return "No nodes to export";
        }

        StringBuilder csv = new StringBuilder();
        appendHeader(csv, metadata, true);
        csv.append("# Total Nodes: ").append(graph.getNodes().size()).append('\n');
        csv.append('\n');

        Set<String> propertyKeys = new TreeSet<>();
        for (ResultNode node : graph.getNodes()) {
            propertyKeys.addAll(node.getNode().getProperties().keySet());
        }
        // fixed columns win over same-named property keys
        propertyKeys.removeAll(NODE_COLUMNS);
        List<String> headers = new ArrayList<>(NODE_COLUMNS);
        headers.addAll(propertyKeys);
        appendRow(csv, headers);

        for (ResultNode resultNode : graph.getNodes()) {
            GraphNode node = resultNode.getNode();
            List<Object> row = new ArrayList<>(headers.size());
            row.add(node.getId());
            row.add(node.getName());
            row.add(node.getNodeType() == null ? null : node.getNodeType().wireName());
            row.add(node.getDisplayLabel());
            row.add(node.getTimeScope());
            row.add(resultNode.getDegree());
            for (String key : propertyKeys) {
                row.add(node.property(key));
            }
            appendRow(csv, row);
        }
        return csv.toString();
    }

    public String edgesToCsv(FilteredGraph graph, ExportMetadata metadata) {
        if (graph.getEdges().isEmpty()) {
            return "No links to export";
        }

        StringBuilder csv = new StringBuilder();
        appendHeader(csv, metadata, false);
        csv.append("# Total Links: ").append(graph.getEdges().size()).append('\n');
        csv.append('\n');
        appendRow(csv, EDGE_COLUMNS);

        for (GraphEdge edge : graph.getEdges()) {
            appendRow(csv, Arrays.asList(
                    edge.getSourceId(),
                    edge.getTargetId(),
                    edge.getEdgeType() == null ? null : edge.getEdgeType().wireName(),
                    edge.getAction(),
                    edge.getTimeScope(),
                    edge.getWeight()));
        }
        return csv.toString();
    }

    public String edgeListToCsv(FilteredGraph graph, ExportMetadata metadata) {
        if (graph.getEdges().isEmpty()) {
            return "No links to export";
        }

        Map<String, GraphNode> nodesById = new HashMap<>();
        for (ResultNode node : graph.getNodes()) {
            nodesById.put(node.getId(), node.getNode());
        }

        StringBuilder csv = new StringBuilder();
        appendHeader(csv, metadata, false);
        csv.append("# Format: Edge List with Node Attributes\n");
        csv.append('\n');
        appendRow(csv, EDGE_LIST_COLUMNS);

        for (GraphEdge edge : graph.getEdges()) {
            GraphNode source = nodesById.get(edge.getSourceId());
            GraphNode target = nodesById.get(edge.getTargetId());
            appendRow(csv, Arrays.asList(
                    edge.getSourceId(), typeOf(source), nameOf(source),
                    edge.getTargetId(), typeOf(target), nameOf(target)));
        }
        return csv.toString();
    }

    /**
     * Quotes a CSV field when it contains a comma, a quote or a newline.
     */
    public static String escapeCsvField(Object field) {
        if (field == null) {
            return "";
        }
        String value = String.valueOf(field);
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private Map<String, Object> buildDocument(FilteredGraph graph, ExportMetadata metadata) {
        Map<String, Object> doc = new LinkedHashMap<>();

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("timeScope", metadata.getTimeScope());
        meta.put("title", metadata.getTitle());
        meta.put("filterTypes", metadata.getFilterTypes());
        meta.put("searchTerm", metadata.getSearchTerm());
        meta.put("exportDate", Instant.now(clock).toString());
        doc.put("metadata", meta);

        doc.put("truncated", graph.isTruncated());
        doc.put("matchedCount", graph.getMatchedCount());

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (ResultNode resultNode : graph.getNodes()) {
            GraphNode node = resultNode.getNode();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", node.getId());
            item.put("name", node.getName());
            item.put("node_type", node.getNodeType() == null ? null : node.getNodeType().wireName());
            item.put("display_label", node.getDisplayLabel());
            item.put("time", node.getTimeScope());
            item.put("degree", resultNode.getDegree());
            if (!node.getProperties().isEmpty()) {
                item.put("properties", node.getProperties());
            }
            nodes.add(item);
        }
        doc.put("nodes", nodes);

        List<Map<String, Object>> edges = new ArrayList<>();
        for (GraphEdge edge : graph.getEdges()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("source", edge.getSourceId());
            item.put("target", edge.getTargetId());
            item.put("edge_type", edge.getEdgeType() == null ? null : edge.getEdgeType().wireName());
            item.put("action", edge.getAction());
            item.put("time", edge.getTimeScope());
            if (edge.getWeight() != null) {
                item.put("weight", edge.getWeight());
            }
            edges.add(item);
        }
        doc.put("links", edges);

        return doc;
    }

    private void appendHeader(StringBuilder csv, ExportMetadata metadata, boolean includeFilters) {
        if (metadata.getTimeScope() != null) {
            csv.append("# Year: ").append(metadata.getTimeScope()).append('\n');
        }
        if (metadata.getTitle() != null) {
            csv.append("# Title: ").append(metadata.getTitle()).append('\n');
        }
        if (includeFilters && !metadata.getFilterTypes().isEmpty()) {
            csv.append("# Filtered Types: ").append(String.join(", ", metadata.getFilterTypes())).append('\n');
        }
        if (includeFilters && metadata.getSearchTerm() != null) {
            csv.append("# Search Term: ").append(metadata.getSearchTerm()).append('\n');
        }
        csv.append("# Export Date: ").append(Instant.now(clock)).append('\n');
    }

    private static String typeOf(GraphNode node) {
        return node == null || node.getNodeType() == null ? null : node.getNodeType().wireName();
    }

    private static String nameOf(GraphNode node) {
        return node == null ? null : node.getName();
    }

    private void appendRow(StringBuilder csv, List<?> fields) {
        StringJoiner joiner = new StringJoiner(",");
        for (Object field : fields) {
            joiner.add(escapeCsvField(field));
        }
        csv.append(joiner).append('\n');
    }
}
