package io.github.vishalmysore.legalnet.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Helpers for turning user keyword input into search terms.
 */
public final class SearchTerms {

    private SearchTerms() {
    }

    /**
     * Splits a comma-separated keyword string into trimmed, non-empty terms,
     * keeping their order. Returns an empty list for null or blank input.
     */
    public static List<String> parse(String keywords) {
        if (keywords == null || keywords.isBlank()) {
            return Collections.emptyList();
        }
        List<String> terms = new ArrayList<>();
        for (String part : keywords.split(",")) {
            String term = part.trim();
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    /**
     * Lower-cases and trims each term for substring comparison.
     */
    public static List<String> normalize(List<String> terms) {
        List<String> normalized = new ArrayList<>(terms.size());
        for (String term : terms) {
            normalized.add(term.toLowerCase(Locale.ROOT).trim());
        }
        return normalized;
    }
}
