package io.github.vishalmysore.legalnet.retrieval;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.graph.AdjacencyIndex;
import io.github.vishalmysore.legalnet.graph.GraphSnapshot;
import io.github.vishalmysore.legalnet.ranking.DegreeRanking;
import io.github.vishalmysore.legalnet.ranking.RankingMode;
import io.github.vishalmysore.legalnet.search.NodeSearcher;
import io.github.vishalmysore.legalnet.search.SearchLogic;

import java.util.*;
import java.util.logging.Logger;

/**
 * Network-builder query engine. Turns a {@link NetworkQuery} into a
 * connected, size-capped subgraph of one snapshot:
 * search, then expansion, then filtering, then truncation, then assembly.
 *
 * The engine keeps no per-query state, so one instance can serve concurrent
 * queries against its snapshot.
 */
public class NetworkBuilder {
    private static final Logger log = Logger.getLogger(NetworkBuilder.class.getName());

    public static final int MAX_NODE_MATCHES = 20;

    private final GraphSnapshot snapshot;
    private final NodeSearcher searcher;
    private final NeighborExpander expander;
    private final CandidateFilter filter;

    public NetworkBuilder(List<GraphNode> nodes, List<GraphEdge> edges) {
        this(new GraphSnapshot(nodes, edges));
    }

    public NetworkBuilder(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
        this.searcher = new NodeSearcher(snapshot.getAllNodes());
        this.expander = new NeighborExpander(snapshot.getAdjacencyIndex());
        this.filter = new CandidateFilter(snapshot);
    }

    public GraphSnapshot getSnapshot() {
        return snapshot;
    }

    public Set<String> search(List<String> searchTerms, Collection<String> searchFields, SearchLogic logic) {
        return searcher.search(searchTerms, searchFields, logic);
    }

    public Set<String> expandFromSeeds(Set<String> seedIds, int depth, int maxNeighborsPerNode,
            Set<EdgeType> allowedEdgeTypes) {
        return expander.expand(seedIds, depth, maxNeighborsPerNode, allowedEdgeTypes);
    }

    /**
     * Builds a network with OR search logic and global ranking.
     */
    public FilteredGraph buildNetwork(NetworkQuery query) {
        return buildNetwork(query, SearchLogic.OR, RankingMode.GLOBAL);
    }

    public FilteredGraph buildNetwork(NetworkQuery query, SearchLogic searchLogic, RankingMode rankingMode) {
        Objects.requireNonNull(query, "query");
        if (searchLogic == null || rankingMode == null) {
            throw new InvalidQueryException("searchLogic and rankingMode are required");
        }

        Set<String> candidates = collectCandidates(query, searchLogic);
        if (candidates.isEmpty()) {
            return FilteredGraph.empty();
        }

        FilteredSubgraph filtered = filter.apply(candidates, query);
        int matchedCount = filtered.getNodeIds().size();
        boolean truncated = matchedCount > query.getMaxTotalNodes();

        Set<String> finalIds = filtered.getNodeIds();
        if (truncated) {
            List<String> selected = rankingMode.select(filtered.getNodeIds(), snapshot.getAdjacencyIndex(),
                    filtered.getEdges(), query.getMaxTotalNodes());
            finalIds = new HashSet<>(selected);
            log.info("Truncated " + matchedCount + " nodes to " + finalIds.size() + " by " + rankingMode
                    + " degree");
        }

        FilteredGraph result = assemble(finalIds, filtered.getEdges(), truncated, matchedCount);
        log.info("Network built: " + result.getNodes().size() + " nodes, " + result.getEdges().size()
                + " edges (matched " + matchedCount + ")");
        return result;
    }

    /**
     * Snapshot-wide degree per node id. All nodes when {@code nodeIds} is
     * empty; ids not in the snapshot are left out.
     */
    public Map<String, Integer> nodeCounts(Collection<String> nodeIds) {
        AdjacencyIndex index = snapshot.getAdjacencyIndex();
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (nodeIds.isEmpty()) {
            for (GraphNode node : snapshot.getAllNodes()) {
                counts.put(node.getId(), index.degree(node.getId()));
            }
        } else {
            for (String id : nodeIds) {
                if (snapshot.containsNode(id)) {
                    counts.put(id, index.degree(id));
                }
            }
        }
        return counts;
    }

    /**
     * Quick lookup for pickers: nodes of the snapshot's time scope whose name,
     * display label or {@code text} property contains the query, ignoring
     * case. Rows are sorted by label and capped at {@link #MAX_NODE_MATCHES}.
     */
    public List<NodeMatch> findNodes(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        AdjacencyIndex index = snapshot.getAdjacencyIndex();

        List<NodeMatch> matches = new ArrayList<>();
        for (GraphNode node : snapshot.getAllNodes()) {
            if (snapshot.getTimeScope() != null && !snapshot.getTimeScope().equals(node.getTimeScope())) {
                continue;
            }
            if (contains(node.getName(), needle) || contains(node.getDisplayLabel(), needle)
                    || contains(node.property("text"), needle)) {
                matches.add(new NodeMatch(node.getId(), matchLabel(node), index.degree(node.getId()),
                        node.getTimeScope()));
            }
        }
        matches.sort(Comparator.comparing(NodeMatch::getName, String.CASE_INSENSITIVE_ORDER));
        log.fine("Node lookup '" + query + "' matched " + matches.size() + " nodes");
        return matches.size() > MAX_NODE_MATCHES ? List.copyOf(matches.subList(0, MAX_NODE_MATCHES)) : matches;
    }

    private static boolean contains(Object value, String needle) {
        return value != null && String.valueOf(value).toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String matchLabel(GraphNode node) {
        if (node.getDisplayLabel() != null && !node.getDisplayLabel().isEmpty()) {
            return node.getDisplayLabel();
        }
        return node.getName() != null ? node.getName() : node.getId();
    }

    /**
     * Search, expansion and seed re-filtering. An empty return means the
     * query short-circuits to an empty result.
     */
    private Set<String> collectCandidates(NetworkQuery query, SearchLogic searchLogic) {
        if (!query.hasSearch()) {
            Set<String> all = new LinkedHashSet<>();
            for (GraphNode node : snapshot.getAllNodes()) {
                all.add(node.getId());
            }
            return all;
        }

        Set<String> seeds = searcher.search(query.getSearchTerms(), query.getSearchFields(), searchLogic);
        log.info("Search matched " + seeds.size() + " seed nodes");
        if (seeds.isEmpty()) {
            return Collections.emptySet();
        }

        Set<String> expanded = new LinkedHashSet<>(seeds);
        if (query.getExpansionDepth() > 0) {
            Set<String> reached = expander.expand(seeds, query.getExpansionDepth(),
                    query.getMaxNodesPerExpansion(), query.getAllowedEdgeTypes());
            for (String id : reached) {
                if (!seeds.contains(id) && query.admitsNodeType(snapshot.getNode(id).getNodeType())) {
                    expanded.add(id);
                }
            }
            log.fine("Expansion reached " + (expanded.size() - seeds.size()) + " admitted nodes beyond seeds");
        }

        Set<String> admittedSeeds = new LinkedHashSet<>();
        for (String id : seeds) {
            if (query.admitsNodeType(snapshot.getNode(id).getNodeType())) {
                admittedSeeds.add(id);
            }
        }
        if (admittedSeeds.isEmpty()) {
            log.info("No seed node has an admitted type, returning empty network");
            return Collections.emptySet();
        }

        Set<String> candidates = new LinkedHashSet<>();
        for (String id : expanded) {
            if (admittedSeeds.contains(id) || !seeds.contains(id)) {
                candidates.add(id);
            }
        }
        return candidates;
    }

    private FilteredGraph assemble(Set<String> finalIds, List<GraphEdge> filteredEdges, boolean truncated,
            int matchedCount) {
        List<GraphEdge> edges = new ArrayList<>();
        for (GraphEdge edge : filteredEdges) {
            if (finalIds.contains(edge.getSourceId()) && finalIds.contains(edge.getTargetId())) {
                edges.add(edge);
            }
        }

        Map<String, Integer> degrees = DegreeRanking.localDegrees(edges);
        List<ResultNode> nodes = new ArrayList<>(finalIds.size());
        for (GraphNode node : snapshot.getAllNodes()) {
            if (finalIds.contains(node.getId())) {
                nodes.add(new ResultNode(node, degrees.getOrDefault(node.getId(), 0)));
            }
        }

        return new FilteredGraph(Collections.unmodifiableList(nodes), Collections.unmodifiableList(edges),
                truncated, matchedCount);
    }
}
