package io.github.vishalmysore.legalnet.search;

import io.github.vishalmysore.legalnet.domain.GraphNode;
import io.github.vishalmysore.legalnet.domain.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldExtractorTest {

    @Test
    @DisplayName("text prefers the property bag, then text, section_text, index_heading")
    void textFallbackChain() {
        GraphNode all = GraphNode.builder().id("n").property("text", "bag text")
                .text("node text").sectionText("section text").indexHeading("heading").build();
        GraphNode noBag = all.toBuilder().clearProperties().build();
        GraphNode sectionOnly = GraphNode.builder().id("n").sectionText("section text").indexHeading("heading").build();
        GraphNode headingOnly = GraphNode.builder().id("n").indexHeading("heading").build();

        assertEquals(Optional.of("bag text"), FieldExtractor.extractField(all, FieldExtractor.TEXT));
        assertEquals(Optional.of("node text"), FieldExtractor.extractField(noBag, FieldExtractor.TEXT));
        assertEquals(Optional.of("section text"), FieldExtractor.extractField(sectionOnly, FieldExtractor.TEXT));
        assertEquals(Optional.of("heading"), FieldExtractor.extractField(headingOnly, FieldExtractor.TEXT));
    }

    @Test
    void emptyValuesFallThroughTheChain() {
        GraphNode node = GraphNode.builder().id("n").property("text", "").text("").sectionText("kept").build();
        assertEquals(Optional.of("kept"), FieldExtractor.extractField(node, FieldExtractor.TEXT));
    }

    @Test
    void fullNameFallsBackToLegacyField() {
        GraphNode bag = GraphNode.builder().id("n").property("full_name", "Bag Name").fullName("Legacy").build();
        GraphNode legacy = GraphNode.builder().id("n").fullName("Legacy").build();

        assertEquals(Optional.of("Bag Name"), FieldExtractor.extractField(bag, FieldExtractor.FULL_NAME));
        assertEquals(Optional.of("Legacy"), FieldExtractor.extractField(legacy, FieldExtractor.FULL_NAME));
    }

    @Test
    void definitionReadsOnlyThePropertyBag() {
        GraphNode node = GraphNode.builder().id("n").property("definition", "means income").build();
        assertEquals(Optional.of("means income"), FieldExtractor.extractField(node, FieldExtractor.DEFINITION));
        assertTrue(FieldExtractor.extractField(GraphNode.builder().id("n").build(), FieldExtractor.DEFINITION)
                .isEmpty());
    }

    @Test
    void entityAndConceptFieldsDependOnNodeType() {
        GraphNode entity = GraphNode.builder().id("e").name("Secretary").nodeType(NodeType.ENTITY).build();
        GraphNode concept = GraphNode.builder().id("c").name("gross income").nodeType(NodeType.CONCEPT).build();

        assertEquals(Optional.of("Secretary"), FieldExtractor.extractField(entity, FieldExtractor.ENTITY));
        assertTrue(FieldExtractor.extractField(entity, FieldExtractor.CONCEPT).isEmpty());
        assertEquals(Optional.of("gross income"), FieldExtractor.extractField(concept, FieldExtractor.CONCEPT));
        assertTrue(FieldExtractor.extractField(concept, FieldExtractor.ENTITY).isEmpty());
    }

    @Test
    void propertiesYieldEveryStringEntry() {
        GraphNode node = GraphNode.builder().id("n")
                .property("text", "alpha")
                .property("page", 12)
                .property("note", "beta")
                .build();

        assertEquals(List.of("alpha", "beta"), FieldExtractor.extractValues(node, FieldExtractor.PROPERTIES));
    }

    @Test
    void unknownFieldFallsBackToAttributeLookup() {
        GraphNode node = GraphNode.builder().id("n").chapter("CHAPTER 1").build();

        assertEquals(Optional.of("CHAPTER 1"), FieldExtractor.extractField(node, "chapter"));
        assertTrue(FieldExtractor.extractField(node, "not_an_attribute").isEmpty());
    }

    @Test
    void displayLabelIsReadDirectly() {
        GraphNode node = GraphNode.builder().id("n").displayLabel("§ 61").build();
        assertEquals(List.of("§ 61"), FieldExtractor.extractValues(node, FieldExtractor.DISPLAY_LABEL));
    }

    @Test
    void recognizedFieldsListsEveryRule() {
        assertEquals(7, FieldExtractor.recognizedFields().size());
        assertTrue(FieldExtractor.recognizedFields().contains(FieldExtractor.PROPERTIES));
    }
}
