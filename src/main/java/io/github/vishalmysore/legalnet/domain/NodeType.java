package io.github.vishalmysore.legalnet.domain;

import java.util.Locale;

/**
 * Represents the type of a node in the legal-code graph.
 * SECTION and INDEX are hierarchy nodes, ENTITY and CONCEPT are terms
 * extracted from statutory text.
 */
public enum NodeType {
    SECTION, // Statutory section (or any hierarchy level parsed from the code)
    ENTITY, // Extracted entity term
    CONCEPT, // Extracted concept term
    INDEX; // Index heading node

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isHierarchy() {
        return this == SECTION || this == INDEX;
    }

    public static NodeType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node type must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
