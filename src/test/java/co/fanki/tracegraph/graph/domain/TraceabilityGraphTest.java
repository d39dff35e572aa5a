package co.fanki.tracegraph.graph.domain;

import co.fanki.tracegraph.item.domain.Item;
import co.fanki.tracegraph.item.domain.ItemType;
import co.fanki.tracegraph.item.domain.Link;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for TraceabilityGraph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TraceabilityGraphTest {

    private TraceabilityGraph graph;

    @BeforeEach
    void setUp() {
        graph = new TraceabilityGraph();
        graph.setDocumentParents("SYS", List.of());
        graph.setDocumentParents("SRS", List.of("SYS"));
        graph.setDocumentParents("TST", List.of("SRS"));

        graph.addItem(Item.requirement("SYS001", "SYS", "Stop the pump"));
        graph.addItem(Item.requirement("SYS002", "SYS", "Raise an alarm"));
        graph.addItem(Item.builder("SRS001", "SRS").text("Stop within 2s")
                .link("SYS001").link("SYS002").build());
        graph.addItem(Item.builder("TST001", "TST").text("Occlusion test")
                .link("SRS001").build());
    }

    @Test
    void whenAddItem_givenLinks_shouldIndexBothDirections() {
        assertEquals(Set.of("SYS001", "SYS002"), graph.parentsOf("SRS001"));
        assertEquals(Set.of("SRS001"), graph.childrenOf("SYS001"));
        assertEquals(4, graph.itemCount());
    }

    @Test
    void whenAddItem_givenSameUidAgain_shouldReplaceEdges() {
        graph.addItem(Item.builder("SRS001", "SRS").text("Stop within 2s")
                .link("SYS002").build());

        assertEquals(Set.of("SYS002"), graph.parentsOf("SRS001"));
        assertTrue(graph.childrenOf("SYS001").isEmpty());
    }

    @Test
    void whenRemoveItem_givenParent_shouldLeaveDanglingChildLink() {
        assertEquals("SYS001", graph.removeItem("SYS001").uid());

        assertNull(graph.item("SYS001"));
        assertTrue(graph.parentsOf("SRS001").contains("SYS001"));
        assertEquals(1, graph.parentItems("SRS001").size());
    }

    @Test
    void whenTraversing_givenChain_shouldExcludeStart() {
        assertEquals(Set.of("SRS001", "SYS001", "SYS002"),
                graph.ancestors("TST001"));
        assertEquals(Set.of("SRS001", "TST001"), graph.descendants("SYS001"));
        assertEquals(Set.of("SYS001", "SYS002", "TST001"),
                graph.neighbors("SRS001"));
    }

    @Test
    void whenQueryingDocuments_givenHierarchy_shouldAnswer() {
        assertEquals(List.of("SYS"), graph.rootDocuments());
        assertEquals(List.of("TST"), graph.leafDocuments());
        assertEquals(2, graph.itemsInDocument("SYS").size());
        assertEquals(1, graph.childrenInDocument("SYS001", "SRS").size());
        assertTrue(graph.childrenInDocument("SYS001", "TST").isEmpty());
        assertEquals(2, graph.parentsInDocument("SRS001", "SYS").size());
    }

    @Test
    void whenToJson_givenGraph_shouldWriteSnapshotFields() throws Exception {
        final JsonNode root = new ObjectMapper().readTree(graph.toJson());

        assertEquals("SRS", root.path("items").path("SRS001")
                .path("document_prefix").asText());
        assertEquals(2, root.path("item_parents").path("SRS001").size());
        assertEquals("TST001", root.path("item_children").path("SRS001")
                .get(0).asText());
        assertEquals("SYS", root.path("document_parents").path("SRS")
                .get(0).asText());
    }

    @Test
    void whenFromJson_givenSnapshot_shouldRestoreItemsAndEdges() {
        graph.addItem(Item.builder("SRS002", "SRS")
                .header("Alarm")
                .type(ItemType.HEADING)
                .active(false)
                .link(Link.verified("SYS002", "abcdefghijklmnopqrstuvwxyz"))
                .customAttribute("risk", IntNode.valueOf(3))
                .build()
                .markReviewed());

        final TraceabilityGraph restored =
                TraceabilityGraph.fromJson(graph.toJson());

        assertEquals(graph.uids(), restored.uids());
        assertEquals(graph.item("SRS002"), restored.item("SRS002"));
        assertEquals(Set.of("SRS001", "SRS002"), restored.childrenOf("SYS002"));
        assertEquals(List.of("SYS"),
                restored.documentHierarchy().parents("SRS"));
        assertFalse(restored.item("SRS002").isActive());
    }

}
