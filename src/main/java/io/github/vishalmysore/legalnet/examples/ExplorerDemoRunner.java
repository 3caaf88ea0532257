package io.github.vishalmysore.legalnet.examples;

import io.github.vishalmysore.legalnet.actions.NetworkBuilderAction;
import io.github.vishalmysore.legalnet.config.ExplorerSettings;
import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.NodeType;
import io.github.vishalmysore.legalnet.export.ExportMetadata;
import io.github.vishalmysore.legalnet.export.GraphExporter;
import io.github.vishalmysore.legalnet.graph.GraphSnapshot;
import io.github.vishalmysore.legalnet.ranking.RankingMode;
import io.github.vishalmysore.legalnet.retrieval.FilteredGraph;
import io.github.vishalmysore.legalnet.retrieval.NetworkBuilder;
import io.github.vishalmysore.legalnet.retrieval.NetworkQuery;
import io.github.vishalmysore.legalnet.retrieval.ResultNode;
import io.github.vishalmysore.legalnet.search.FieldExtractor;
import io.github.vishalmysore.legalnet.search.SearchLogic;

/**
 * End-to-end demonstration of the network builder:
 * 1. Loading a snapshot and building its adjacency index
 * 2. Keyword search with expansion
 * 3. Node-cap truncation under both ranking modes
 * 4. CSV and JSON export
 * 5. Tools4AI action integration
 */
public class ExplorerDemoRunner {

        public static void main(String[] args) {
                ExplorerSettings settings = ExplorerSettings.load();

                System.out.println("=== PHASE 1: SNAPSHOT ===\n");
                GraphSnapshot snapshot = SampleLegalGraph.snapshot();
                NetworkBuilder builder = new NetworkBuilder(snapshot);
                System.out.println("Snapshot loaded: " + snapshot.getNodeCount() + " nodes, "
                                + snapshot.getEdgeCount() + " edges\n");

                System.out.println("=== PHASE 2: SEARCH AND EXPANSION ===\n");
                NetworkQuery incomeQuery = settings.toQuery("gross income");
                printResult("gross income (OR, depth 1)",
                                builder.buildNetwork(incomeQuery, SearchLogic.OR, settings.getRankingMode()));

                NetworkQuery definitionsOnly = NetworkQuery.builder()
                                .searchTerm("income")
                                .searchTerm("deductions")
                                .searchField(FieldExtractor.TEXT)
                                .searchField(FieldExtractor.DEFINITION)
                                .allowedNodeType(NodeType.SECTION)
                                .allowedNodeType(NodeType.CONCEPT)
                                .allowedEdgeType(EdgeType.DEFINITION)
                                .expansionDepth(1)
                                .maxTotalNodes(settings.getMaxTotalNodes())
                                .build();
                printResult("income AND deductions, definitions only",
                                builder.buildNetwork(definitionsOnly, SearchLogic.AND, RankingMode.GLOBAL));

                System.out.println("\n=== PHASE 3: TRUNCATION ===\n");
                NetworkQuery capped = NetworkQuery.builder()
                                .allowedEdgeTypes(settings.getEdgeTypes())
                                .maxTotalNodes(4)
                                .build();
                printResult("whole snapshot, global ranking",
                                builder.buildNetwork(capped, SearchLogic.OR, RankingMode.GLOBAL));
                printResult("whole snapshot, subgraph ranking",
                                builder.buildNetwork(capped, SearchLogic.OR, RankingMode.SUBGRAPH));

                System.out.println("\n=== PHASE 4: EXPORT ===\n");
                FilteredGraph exported = builder.buildNetwork(incomeQuery);
                ExportMetadata metadata = ExportMetadata.builder()
                                .timeScope(snapshot.getTimeScope())
                                .title(snapshot.getTitle())
                                .searchTerm("gross income")
                                .build();
                GraphExporter exporter = new GraphExporter();
                System.out.println(exporter.nodesToCsv(exported, metadata));
                System.out.println(exporter.edgesToCsv(exported, metadata));
                System.out.println(exporter.edgeListToCsv(exported, metadata));
                String json = exporter.toJson(exported, metadata);
                System.out.println(json.substring(0, Math.min(json.length(), 600)) + "\n...\n");

                System.out.println("=== PHASE 5: TOOLS4AI ACTION INTEGRATION ===\n");
                NetworkBuilderAction.initialize(builder, settings);
                NetworkBuilderAction action = new NetworkBuilderAction();

                System.out.println("--- Action: getGraphStatistics ---");
                System.out.println(action.getGraphStatistics());

                System.out.println("\n--- Action: buildNetwork ---");
                System.out.println(action.buildNetwork("taxable income, individual"));

                System.out.println("\n--- Action: expandNode ---");
                System.out.println(action.expandNode("26-s63"));

                System.out.println("\n--- Action: findNodes ---");
                System.out.println(action.findNodes("income"));
        }

        private static void printResult(String label, FilteredGraph graph) {
                System.out.println(label + ": " + graph.getNodes().size() + " nodes, " + graph.getEdges().size()
                                + " edges, matched=" + graph.getMatchedCount() + ", truncated=" + graph.isTruncated());
                for (ResultNode node : graph.getNodes()) {
                        System.out.printf("    %s (%s) degree=%d%n", node.getId(),
                                        node.getNode().getNodeType().wireName(), node.getDegree());
                }
        }
}
