package io.github.vishalmysore.legalnet.config;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.NodeType;
import io.github.vishalmysore.legalnet.ranking.RankingMode;
import io.github.vishalmysore.legalnet.retrieval.NetworkQuery;
import io.github.vishalmysore.legalnet.search.SearchLogic;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExplorerSettingsTest {

    @Test
    void emptyPropertiesGiveDefaults() {
        ExplorerSettings settings = ExplorerSettings.fromProperties(new Properties());

        assertEquals(ExplorerSettings.defaults(), settings);
        assertEquals(1, settings.getExpansionDepth());
        assertEquals(100, settings.getMaxNodesPerExpansion());
        assertEquals(500, settings.getMaxTotalNodes());
        assertEquals(4000, settings.getEdgeLimit());
        assertEquals(SearchLogic.OR, settings.getSearchLogic());
        assertEquals(RankingMode.GLOBAL, settings.getRankingMode());
        assertEquals(EnumSet.allOf(NodeType.class), settings.getNodeTypes());
    }

    @Test
    void readsEveryKey() {
        Properties props = new Properties();
        props.setProperty("network.expansionDepth", "3");
        props.setProperty("network.maxNodesPerExpansion", "0");
        props.setProperty("network.maxTotalNodes", "50");
        props.setProperty("network.edgeLimit", "200");
        props.setProperty("network.searchLogic", "and");
        props.setProperty("network.rankingMode", "subgraph");
        props.setProperty("network.searchFields", "text, definition");
        props.setProperty("network.nodeTypes", "section,concept");
        props.setProperty("network.edgeTypes", "definition");

        ExplorerSettings settings = ExplorerSettings.fromProperties(props);

        assertEquals(3, settings.getExpansionDepth());
        assertEquals(0, settings.getMaxNodesPerExpansion());
        assertEquals(50, settings.getMaxTotalNodes());
        assertEquals(200, settings.getEdgeLimit());
        assertEquals(SearchLogic.AND, settings.getSearchLogic());
        assertEquals(RankingMode.SUBGRAPH, settings.getRankingMode());
        assertEquals(List.of("text", "definition"), settings.getSearchFields());
        assertEquals(EnumSet.of(NodeType.SECTION, NodeType.CONCEPT), settings.getNodeTypes());
        assertEquals(EnumSet.of(EdgeType.DEFINITION), settings.getEdgeTypes());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty("network.maxTotalNodes", "lots");
        props.setProperty("network.rankingMode", "pagerank");
        props.setProperty("network.edgeTypes", "definition,cites");

        ExplorerSettings settings = ExplorerSettings.fromProperties(props);

        assertEquals(500, settings.getMaxTotalNodes());
        assertEquals(RankingMode.GLOBAL, settings.getRankingMode());
        assertEquals(EnumSet.of(EdgeType.DEFINITION), settings.getEdgeTypes());
    }

    @Test
    void outOfRangeNumbersFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty("network.expansionDepth", "-1");
        props.setProperty("network.maxNodesPerExpansion", "-5");
        props.setProperty("network.maxTotalNodes", "0");
        props.setProperty("network.edgeLimit", "-10");

        ExplorerSettings settings = ExplorerSettings.fromProperties(props);

        assertEquals(ExplorerSettings.defaults(), settings);
        NetworkQuery query = assertDoesNotThrow(() -> settings.toQuery("income"));
        assertEquals(500, query.getMaxTotalNodes());
    }

    @Test
    void classpathResourceLoads() {
        ExplorerSettings settings = ExplorerSettings.load();
        assertEquals(100, settings.getMaxNodesPerExpansion());
        assertEquals(EnumSet.allOf(EdgeType.class), settings.getEdgeTypes());
    }

    @Test
    void toQueryParsesKeywords() {
        NetworkQuery query = ExplorerSettings.defaults().toQuery("gross income, Secretary");

        assertEquals(List.of("gross income", "Secretary"), query.getSearchTerms());
        assertEquals(Set.copyOf(ExplorerSettings.defaults().getSearchFields()), query.getSearchFields());
        assertEquals(1, query.getExpansionDepth());
        assertEquals(500, query.getMaxTotalNodes());
        assertTrue(query.hasSearch());
    }
}
