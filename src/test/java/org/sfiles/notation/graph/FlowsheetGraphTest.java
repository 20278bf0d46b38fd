package org.sfiles.notation.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sfiles.notation.testutil.FlowsheetFixtures;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowsheetGraphTest {

    @Test
    @DisplayName("Adjacency queries follow insertion order")
    void testAdjacency() {
        FlowsheetGraph graph = FlowsheetFixtures.splitter();

        assertEquals(List.of("tank-1", "pump-1", "valve-1"), graph.unitIds());
        assertEquals(List.of("pump-1", "valve-1"), graph.successors("tank-1"));
        assertEquals(List.of("tank-1"), graph.predecessors("valve-1"));
        assertEquals(2, graph.outDegree("tank-1"));
        assertEquals(0, graph.inDegree("tank-1"));
        assertEquals(2, graph.streamCount());
        assertTrue(graph.hasStream("tank-1", "pump-1"));
        assertFalse(graph.hasStream("pump-1", "tank-1"));
        assertNull(graph.stream("pump-1", "tank-1"));
    }

    @Test
    @DisplayName("Duplicate units, duplicate streams and unknown endpoints are rejected")
    void testConstructionErrors() {
        FlowsheetGraph graph = FlowsheetFixtures.chain();

        assertThrows(IllegalArgumentException.class, () -> graph.addUnit("raw-1"));
        assertThrows(IllegalArgumentException.class, () -> graph.addStream("raw-1", "pump-1"));
        assertThrows(IllegalArgumentException.class, () -> graph.addStream("raw-1", "ghost-1"));
        assertThrows(IllegalArgumentException.class, () -> graph.successors("ghost-1"));
        assertThrows(IllegalArgumentException.class, () -> graph.addUnit("bad(id"));
    }

    @Test
    @DisplayName("Self-loops are allowed and removed with their unit")
    void testSelfLoop() {
        FlowsheetGraph graph = new FlowsheetGraph()
                .addUnit("tank-1")
                .addUnit("pump-1")
                .addStream("tank-1", "tank-1")
                .addStream("tank-1", "pump-1");

        assertTrue(graph.stream("tank-1", "tank-1").isSelfLoop());
        assertEquals(1, graph.inDegree("tank-1"));

        assertTrue(graph.removeUnit("tank-1"));
        assertEquals(0, graph.streamCount());
        assertEquals(0, graph.inDegree("pump-1"));
        assertFalse(graph.removeUnit("tank-1"));
    }

    @Test
    @DisplayName("retagStream and removeStream keep both directions in sync")
    void testRetagAndRemove() {
        FlowsheetGraph graph = FlowsheetFixtures.chain();

        graph.retagStream("raw-1", "pump-1", StreamTags.of("steam"));
        assertEquals(List.of("steam"), graph.inStreams("pump-1").get(0).getTags().additional());

        assertTrue(graph.removeStream("raw-1", "pump-1"));
        assertFalse(graph.removeStream("raw-1", "pump-1"));
        assertEquals(0, graph.inDegree("pump-1"));
        assertThrows(IllegalArgumentException.class,
                () -> graph.retagStream("raw-1", "pump-1", StreamTags.EMPTY));
    }

    @Test
    @DisplayName("Equality ignores insertion order but not tags or attributes")
    void testStructuralEquality() {
        FlowsheetGraph reversed = new FlowsheetGraph()
                .addUnit("product-1")
                .addUnit("pump-1")
                .addUnit("raw-1")
                .addStream("pump-1", "product-1")
                .addStream("raw-1", "pump-1");
        assertEquals(FlowsheetFixtures.chain(), reversed);
        assertEquals(FlowsheetFixtures.chain().hashCode(), reversed.hashCode());

        FlowsheetGraph tagged = FlowsheetFixtures.chain().retagStream("raw-1", "pump-1", StreamTags.of("tout"));
        assertNotEquals(FlowsheetFixtures.chain(), tagged);

        FlowsheetGraph attributed = new FlowsheetGraph()
                .addUnit("raw-1", Map.of("phase", "liquid"))
                .addUnit("pump-1")
                .addUnit("product-1")
                .addStream("raw-1", "pump-1")
                .addStream("pump-1", "product-1");
        assertNotEquals(FlowsheetFixtures.chain(), attributed);
    }

    @Test
    @DisplayName("copy is independent of the original")
    void testCopy() {
        FlowsheetGraph original = FlowsheetFixtures.chain();
        FlowsheetGraph copy = original.copy();
        assertEquals(original, copy);

        copy.removeUnit("pump-1");
        assertEquals(3, original.unitCount());
        assertEquals(2, original.streamCount());
    }
}
