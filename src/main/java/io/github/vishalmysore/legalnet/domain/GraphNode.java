package io.github.vishalmysore.legalnet.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A node of the legal-code graph: a statutory section, an index heading, or
 * a term (entity or concept) extracted from section text.
 *
 * Nodes carry a free-form property bag as produced by the dataset export,
 * plus the legacy top-level fields older exports used before everything
 * moved into the bag. Both are kept so search can fall back between them.
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {
    String id;
    String name;
    NodeType nodeType;

    // Dataset scope: year or scenario label, plus the USC title the node came from
    String timeScope;
    String uscTitle;
    String sourceTitle;

    String displayLabel;

    @Singular
    Map<String, Object> properties;

    // Hierarchy fields parsed from the node name
    String title;
    String subtitle;
    String part;
    String chapter;
    String subchapter;
    String section;
    String subsection;

    // Legacy fields mapped from the property bag or the hierarchy
    String fullName;
    String text;
    String sectionText;
    String termType;
    String indexHeading;

    public NodeKey key() {
        return new NodeKey(timeScope, id);
    }

    public Object property(String key) {
        return properties.get(key);
    }

    /**
     * Looks up a top-level attribute by its dataset (snake_case) name.
     * Returns null for unknown names and unset attributes.
     */
    public Object attribute(String attributeName) {
        if (attributeName == null) {
            return null;
        }
        switch (attributeName) {
            case "id":
                return id;
            case "name":
                return name;
            case "node_type":
                return nodeType == null ? null : nodeType.wireName();
            case "time":
                return timeScope;
            case "usc_title":
                return uscTitle;
            case "source_title":
                return sourceTitle;
            case "display_label":
                return displayLabel;
            case "title":
                return title;
            case "subtitle":
                return subtitle;
            case "part":
                return part;
            case "chapter":
                return chapter;
            case "subchapter":
                return subchapter;
            case "section":
                return section;
            case "subsection":
                return subsection;
            case "full_name":
                return fullName;
            case "text":
                return text;
            case "section_text":
                return sectionText;
            case "term_type":
                return termType;
            case "index_heading":
                return indexHeading;
            default:
                return null;
        }
    }
}
