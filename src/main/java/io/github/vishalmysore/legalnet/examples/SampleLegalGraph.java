package io.github.vishalmysore.legalnet.examples;

import io.github.vishalmysore.legalnet.domain.EdgeType;
import io.github.vishalmysore.legalnet.domain.GraphEdge;
import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.domain.NodeType;
import io.github.vishalmysore.legalnet.graph.GraphSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * A small excerpt of the Internal Revenue Code (Title 26) shaped like the
 * explorer's dataset export: hierarchy nodes, extracted terms, and the
 * definition, reference and hierarchy edges between them.
 */
public final class SampleLegalGraph {

    public static final String TITLE = "26";
    public static final String TIME_SCOPE = "2024";

    private SampleLegalGraph() {
    }

    public static GraphSnapshot snapshot() {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        // --- Hierarchy ---
        nodes.add(section("26-ch1", "TITLE 26 CHAPTER 1", "Chapter 1 - Normal Taxes and Surtaxes", null));
        nodes.add(section("26-s1", "TITLE 26 SECTION 1", "§ 1 - Tax imposed",
                "There is hereby imposed on the taxable income of every individual a tax determined in accordance with the following table."));
        nodes.add(section("26-s61", "TITLE 26 SECTION 61", "§ 61 - Gross income defined",
                "Except as otherwise provided in this subtitle, gross income means all income from whatever source derived."));
        nodes.add(section("26-s62", "TITLE 26 SECTION 62", "§ 62 - Adjusted gross income defined",
                "For purposes of this subtitle, the term adjusted gross income means gross income minus the following deductions."));
        nodes.add(section("26-s63", "TITLE 26 SECTION 63", "§ 63 - Taxable income defined",
                "Except as provided in subsection (b), the term taxable income means gross income minus the deductions allowed by this chapter."));
        nodes.add(section("26-s151", "TITLE 26 SECTION 151", "§ 151 - Allowance of deductions for personal exemptions",
                "In the case of an individual, the exemptions provided by this section shall be allowed as deductions."));
        nodes.add(GraphNode.builder()
                .id("26-idx-income")
                .name("Income")
                .nodeType(NodeType.INDEX)
                .timeScope(TIME_SCOPE)
                .uscTitle(TITLE)
                .indexHeading("Income, gross, adjusted and taxable")
                .build());

        // --- Extracted terms ---
        nodes.add(term("26-c-gross-income", "gross income", NodeType.CONCEPT,
                "All income from whatever source derived, including compensation for services."));
        nodes.add(term("26-c-agi", "adjusted gross income", NodeType.CONCEPT,
                "Gross income minus the deductions listed in section 62."));
        nodes.add(term("26-c-taxable-income", "taxable income", NodeType.CONCEPT,
                "Gross income minus the deductions allowed by chapter 1."));
        nodes.add(term("26-e-individual", "individual", NodeType.ENTITY, null));
        nodes.add(term("26-e-secretary", "Secretary", NodeType.ENTITY,
                "The Secretary of the Treasury or his delegate."));

        edges.add(edge("26-ch1", "26-s1", EdgeType.HIERARCHY, "contains"));
        edges.add(edge("26-ch1", "26-s61", EdgeType.HIERARCHY, "contains"));
        edges.add(edge("26-ch1", "26-s62", EdgeType.HIERARCHY, "contains"));
        edges.add(edge("26-ch1", "26-s63", EdgeType.HIERARCHY, "contains"));
        edges.add(edge("26-ch1", "26-s151", EdgeType.HIERARCHY, "contains"));
        edges.add(edge("26-s61", "26-c-gross-income", EdgeType.DEFINITION, "defines"));
        edges.add(edge("26-s62", "26-c-agi", EdgeType.DEFINITION, "defines"));
        edges.add(edge("26-s63", "26-c-taxable-income", EdgeType.DEFINITION, "defines"));
        edges.add(edge("26-s62", "26-c-gross-income", EdgeType.REFERENCE, "references"));
        edges.add(edge("26-s63", "26-c-gross-income", EdgeType.REFERENCE, "references"));
        edges.add(edge("26-s1", "26-c-taxable-income", EdgeType.REFERENCE, "references"));
        edges.add(edge("26-s1", "26-e-individual", EdgeType.REFERENCE, "references"));
        edges.add(edge("26-s151", "26-e-individual", EdgeType.REFERENCE, "references"));
        edges.add(edge("26-s151", "26-e-secretary", EdgeType.REFERENCE, "references"));
        edges.add(edge("26-idx-income", "26-s61", EdgeType.REFERENCE, "see"));

        return new GraphSnapshot(TITLE, TIME_SCOPE, nodes, edges);
    }

    private static GraphNode section(String id, String name, String displayLabel, String text) {
        GraphNode.GraphNodeBuilder builder = GraphNode.builder()
                .id(id)
                .name(name)
                .nodeType(NodeType.SECTION)
                .timeScope(TIME_SCOPE)
                .uscTitle(TITLE)
                .displayLabel(displayLabel)
                .title("TITLE 26");
        if (text != null) {
            builder.property("text", text).property("full_name", displayLabel);
        }
        return builder.build();
    }

    private static GraphNode term(String id, String name, NodeType type, String definition) {
        GraphNode.GraphNodeBuilder builder = GraphNode.builder()
                .id(id)
                .name(name)
                .nodeType(type)
                .timeScope(TIME_SCOPE)
                .uscTitle(TITLE)
                .termType(type.wireName());
        if (definition != null) {
            builder.property("definition", definition);
        }
        return builder.build();
    }

    private static GraphEdge edge(String source, String target, EdgeType type, String action) {
        return GraphEdge.builder()
                .sourceId(source)
                .targetId(target)
                .edgeType(type)
                .action(action)
                .timeScope(TIME_SCOPE)
                .uscTitle(TITLE)
                .build();
    }
}
