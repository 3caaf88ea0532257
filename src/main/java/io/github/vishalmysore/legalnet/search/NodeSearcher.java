package io.github.vishalmysore.legalnet.search;

import io.github.vishalmysore.legalnet.domain.GraphNode;

import java.util.*;
import java.util.logging.Logger;

/**
 * Free-text seed search: case-insensitive substring matching of terms
 * against selected fields of every node.
 */
public class NodeSearcher {
    private static final Logger log = Logger.getLogger(NodeSearcher.class.getName());

    private final Collection<GraphNode> nodes;

    public NodeSearcher(Collection<GraphNode> nodes) {
        this.nodes = nodes;
    }

    /**
     * Returns the ids of matching nodes in node iteration order.
     * With no terms, OR matches nothing and AND matches every node; callers
     * decide what an empty search means before getting here.
     */
    public Set<String> search(List<String> terms, Collection<String> fields, SearchLogic logic) {
        List<String> normalizedTerms = SearchTerms.normalize(terms);
        Set<String> matchedIds = new LinkedHashSet<>();

        for (GraphNode node : nodes) {
            List<String> searchableValues = collectValues(node, fields);
            if (logic.matches(normalizedTerms, searchableValues)) {
                matchedIds.add(node.getId());
            }
        }

        log.fine("Search " + normalizedTerms + " over " + fields + " (" + logic + ") matched "
                + matchedIds.size() + " nodes");
        return matchedIds;
    }

    private List<String> collectValues(GraphNode node, Collection<String> fields) {
        List<String> values = new ArrayList<>();
        for (String field : fields) {
            for (String value : FieldExtractor.extractValues(node, field)) {
                values.add(value.toLowerCase(Locale.ROOT));
            }
        }
        return values;
    }
}
