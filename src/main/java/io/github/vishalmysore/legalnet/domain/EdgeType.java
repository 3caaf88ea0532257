package io.github.vishalmysore.legalnet.domain;

import java.util.Locale;

/**
 * Represents the type of relation connecting two nodes of the legal-code graph.
 */
public enum EdgeType {
    DEFINITION, // A section defines a term
    REFERENCE, // A section or term refers to another node
    HIERARCHY; // Structural containment (title > chapter > section)

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EdgeType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Edge type must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
