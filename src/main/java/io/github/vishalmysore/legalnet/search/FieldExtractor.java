package io.github.vishalmysore.legalnet.search;

import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.domain.NodeType;

import java.util.*;
import java.util.function.Function;

/**
 * Reads searchable values out of a node.
 *
 * Each recognized field has an ordered fallback chain of sources; the first
 * source that yields a non-empty value wins. The chains below are the only
 * place that priority is defined. {@link #PROPERTIES} is the one multi-valued
 * field: it yields every string entry of the property bag. Unrecognized field
 * names fall back to {@link GraphNode#attribute(String)}.
 */
public final class FieldExtractor {

    public static final String TEXT = "text";
    public static final String FULL_NAME = "full_name";
    public static final String DISPLAY_LABEL = "display_label";
    public static final String DEFINITION = "definition";
    public static final String ENTITY = "entity";
    public static final String CONCEPT = "concept";
    public static final String PROPERTIES = "properties";

    private static final Map<String, List<Function<GraphNode, Object>>> FALLBACK_CHAINS;

    static {
        Map<String, List<Function<GraphNode, Object>>> chains = new LinkedHashMap<>();
        chains.put(TEXT, List.of(
                node -> node.property("text"),
                GraphNode::getText,
                GraphNode::getSectionText,
                GraphNode::getIndexHeading));
        chains.put(FULL_NAME, List.of(
                node -> node.property("full_name"),
                GraphNode::getFullName));
        chains.put(DISPLAY_LABEL, List.of(GraphNode::getDisplayLabel));
        chains.put(DEFINITION, List.of(node -> node.property("definition")));
        chains.put(ENTITY, List.of(node -> node.getNodeType() == NodeType.ENTITY ? node.getName() : null));
        chains.put(CONCEPT, List.of(node -> node.getNodeType() == NodeType.CONCEPT ? node.getName() : null));
        FALLBACK_CHAINS = Collections.unmodifiableMap(chains);
    }

    private FieldExtractor() {
    }

    /**
     * Field names with a dedicated extraction rule.
     */
    public static Set<String> recognizedFields() {
        Set<String> fields = new LinkedHashSet<>(FALLBACK_CHAINS.keySet());
        fields.add(PROPERTIES);
        return Collections.unmodifiableSet(fields);
    }

    /**
     * Single value of a field, following its fallback chain.
     * For {@link #PROPERTIES} this is the first string entry of the property bag.
     */
    public static Optional<String> extractField(GraphNode node, String fieldName) {
        if (PROPERTIES.equals(fieldName)) {
            return propertyStrings(node).stream().findFirst();
        }
        List<Function<GraphNode, Object>> chain = FALLBACK_CHAINS.get(fieldName);
        if (chain == null) {
            return nonEmpty(node.attribute(fieldName));
        }
        for (Function<GraphNode, Object> source : chain) {
            Optional<String> value = nonEmpty(source.apply(node));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * All values a field contributes to search.
     */
    public static List<String> extractValues(GraphNode node, String fieldName) {
        if (PROPERTIES.equals(fieldName)) {
            return propertyStrings(node);
        }
        return extractField(node, fieldName).map(List::of).orElse(Collections.emptyList());
    }

    private static List<String> propertyStrings(GraphNode node) {
        if (node.getProperties() == null || node.getProperties().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        for (Object value : node.getProperties().values()) {
            if (value instanceof String) {
                values.add((String) value);
            }
        }
        return values;
    }

    private static Optional<String> nonEmpty(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        String text = String.valueOf(value);
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
