package io.github.vishalmysore.legalnet.config;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.NodeType;
import io.github.vishalmysore.legalnet.ranking.RankingMode;
import io.github.vishalmysore.legalnet.retrieval.NetworkQuery;
import io.github.vishalmysore.legalnet.search.FieldExtractor;
import io.github.vishalmysore.legalnet.search.SearchLogic;
import io.github.vishalmysore.legalnet.search.SearchTerms;
import lombok.Builder;
import lombok.Value;

import java.io.InputStream;
import java.util.*;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Defaults for network-builder queries, read from {@code legalnet.properties}
 * on the classpath. Every key is optional; missing or unreadable values fall
 * back to the coded defaults.
 */
@Value
@Builder(toBuilder = true)
public class ExplorerSettings {
    private static final Logger log = Logger.getLogger(ExplorerSettings.class.getName());

    public static final String RESOURCE = "legalnet.properties";

    @Builder.Default
    int expansionDepth = 1;
    @Builder.Default
    int maxNodesPerExpansion = 100;
    @Builder.Default
    int maxTotalNodes = 500;
    @Builder.Default
    int edgeLimit = 4000;
    @Builder.Default
    SearchLogic searchLogic = SearchLogic.OR;
    @Builder.Default
    RankingMode rankingMode = RankingMode.GLOBAL;
    @Builder.Default
    List<String> searchFields = List.of(
            FieldExtractor.TEXT,
            FieldExtractor.FULL_NAME,
            FieldExtractor.DISPLAY_LABEL,
            FieldExtractor.DEFINITION,
            FieldExtractor.ENTITY,
            FieldExtractor.CONCEPT);
    @Builder.Default
    Set<NodeType> nodeTypes = EnumSet.allOf(NodeType.class);
    @Builder.Default
    Set<EdgeType> edgeTypes = EnumSet.allOf(EdgeType.class);

    public static ExplorerSettings defaults() {
        return ExplorerSettings.builder().build();
    }

    public static ExplorerSettings load() {
        Properties props = new Properties();
        try (InputStream is = ExplorerSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (Exception e) {
            log.warning("Could not load " + RESOURCE + ": " + e.getMessage());
        }
        return fromProperties(props);
    }

    public static ExplorerSettings fromProperties(Properties props) {
        ExplorerSettings defaults = defaults();
        return ExplorerSettings.builder()
                .expansionDepth(readInt(props, "network.expansionDepth", defaults.expansionDepth, 0))
                .maxNodesPerExpansion(readInt(props, "network.maxNodesPerExpansion", defaults.maxNodesPerExpansion, 0))
                .maxTotalNodes(readInt(props, "network.maxTotalNodes", defaults.maxTotalNodes, 1))
                .edgeLimit(readInt(props, "network.edgeLimit", defaults.edgeLimit, 1))
                .searchLogic(readEnum(props, "network.searchLogic", defaults.searchLogic,
                        v -> SearchLogic.valueOf(v.toUpperCase(Locale.ROOT))))
                .rankingMode(readEnum(props, "network.rankingMode", defaults.rankingMode,
                        v -> RankingMode.valueOf(v.toUpperCase(Locale.ROOT))))
                .searchFields(readList(props, "network.searchFields", defaults.searchFields))
                .nodeTypes(readTypes(props, "network.nodeTypes", defaults.nodeTypes, NodeType::fromWireName,
                        NodeType.class))
                .edgeTypes(readTypes(props, "network.edgeTypes", defaults.edgeTypes, EdgeType::fromWireName,
                        EdgeType.class))
                .build();
    }

    /**
     * A query for the given comma-separated keywords using these defaults.
     */
    public NetworkQuery toQuery(String keywords) {
        return NetworkQuery.builder()
                .searchTerms(SearchTerms.parse(keywords))
                .searchFields(searchFields)
                .allowedNodeTypes(nodeTypes)
                .allowedEdgeTypes(edgeTypes)
                .expansionDepth(expansionDepth)
                .maxNodesPerExpansion(maxNodesPerExpansion)
                .maxTotalNodes(maxTotalNodes)
                .build();
    }

    private static int readInt(Properties props, String key, int fallback, int min) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warning("Invalid integer for " + key + ": '" + value + "', using " + fallback);
            return fallback;
        }
        if (parsed < min) {
            log.warning(key + " must be >= " + min + ", was " + parsed + ", using " + fallback);
            return fallback;
        }
        return parsed;
    }

    private static <T> T readEnum(Properties props, String key, T fallback, Function<String, T> parser) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException e) {
            log.warning("Invalid value for " + key + ": '" + value + "', using " + fallback);
            return fallback;
        }
    }

    private static List<String> readList(Properties props, String key, List<String> fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        return List.copyOf(SearchTerms.parse(value));
    }

    private static <E extends Enum<E>> Set<E> readTypes(Properties props, String key, Set<E> fallback,
            Function<String, E> parser, Class<E> type) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        Set<E> types = EnumSet.noneOf(type);
        for (String name : SearchTerms.parse(value)) {
            try {
                types.add(parser.apply(name));
            } catch (IllegalArgumentException e) {
                log.warning("Ignoring unknown type '" + name + "' in " + key);
            }
        }
        return types;
    }
}
