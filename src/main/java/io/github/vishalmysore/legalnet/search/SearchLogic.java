package io.github.vishalmysore.legalnet.search;

import java.util.List;

/**
 * How multiple search terms combine when matching a node.
 */
public enum SearchLogic {
    /** Every term must appear in at least one field value (not necessarily the same one). */
    AND {
        @Override
        public boolean matches(List<String> terms, List<String> values) {
            return terms.stream().allMatch(term -> containsTerm(values, term));
        }
    },
    /** Any term appearing in any field value is enough. */
    OR {
        @Override
        public boolean matches(List<String> terms, List<String> values) {
            return terms.stream().anyMatch(term -> containsTerm(values, term));
        }
    };

    /**
     * @param terms  normalized (lower-cased, trimmed) search terms
     * @param values lower-cased field values collected for one node
     */
    public abstract boolean matches(List<String> terms, List<String> values);

    private static boolean containsTerm(List<String> values, String term) {
        for (String value : values) {
            if (value.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
