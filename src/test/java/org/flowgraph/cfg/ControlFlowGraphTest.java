package org.flowgraph.cfg;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowGraphTest {

    private ControlFlowGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ControlFlowGraph();
    }

    @Test
    void newGraphHoldsOnlyUnlinkedStart() {
        assertEquals(1, graph.size());
        assertEquals(NodeKind.START, graph.start().kind());
        assertTrue(graph.start().outgoing().isEmpty());
        assertThrows(IllegalStateException.class, graph::exit);
    }

    @Test
    void newNodeAppendsInCreationOrder() {
        int a = graph.newNode("a = 1", NodeKind.STATEMENT, 3, 3);
        int b = graph.newNode("a > 0", NodeKind.CONDITION, 4, 6);

        assertEquals(1, a);
        assertEquals(2, b);
        assertEquals("a > 0", graph.node(b).label());
        assertEquals(NodeKind.CONDITION, graph.node(b).kind());
        assertEquals(4, graph.node(b).lineStart());
        assertEquals(6, graph.node(b).lineEnd());
        assertEquals(List.of(graph.start(), graph.node(a), graph.node(b)), graph.nodes());
    }

    @Test
    void connectKeepsBothDirectionsInSync() {
        int a = graph.newNode("a", NodeKind.STATEMENT, -1, -1);
        int b = graph.newNode("b", NodeKind.STATEMENT, -1, -1);

        graph.connect(a, b);

        assertEquals(List.of(b), graph.node(a).outgoing());
        assertEquals(List.of(a), graph.node(b).ingoing());
        assertTrue(graph.hasEdge(a, b));
        assertFalse(graph.hasEdge(b, a));
    }

    @Test
    void connectTwiceIsSameAsOnce() {
        int a = graph.newNode("a", NodeKind.STATEMENT, -1, -1);
        int b = graph.newNode("b", NodeKind.STATEMENT, -1, -1);

        graph.connect(a, b);
        graph.connect(a, b);

        assertEquals(List.of(b), graph.node(a).outgoing());
        assertEquals(List.of(a), graph.node(b).ingoing());
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void outgoingPreservesInsertionOrder() {
        int a = graph.newNode("a", NodeKind.CONDITION, -1, -1);
        int b = graph.newNode("b", NodeKind.STATEMENT, -1, -1);
        int c = graph.newNode("c", NodeKind.STATEMENT, -1, -1);

        graph.connect(a, c);
        graph.connect(a, b);

        assertEquals(List.of(c, b), graph.node(a).outgoing());
    }

    @Test
    void connectRejectsForeignIds() {
        int a = graph.newNode("a", NodeKind.STATEMENT, -1, -1);

        InvalidEdgeException e = assertThrows(InvalidEdgeException.class, () -> graph.connect(a, 7));
        assertEquals(a, e.from());
        assertEquals(7, e.to());
        assertThrows(InvalidEdgeException.class, () -> graph.connect(-1, a));
        assertTrue(graph.node(a).outgoing().isEmpty());
    }

    @Test
    void closeAppendsExitAndFreezesGraph() {
        int a = graph.newNode("a", NodeKind.STATEMENT, -1, -1);
        graph.connect(graph.start().id(), a);

        graph.close(List.of(a));

        assertEquals(2, graph.exit().id());
        assertEquals(List.of(2), graph.node(a).outgoing());
        assertThrows(IllegalStateException.class, () -> graph.newNode("b", NodeKind.STATEMENT, -1, -1));
        assertThrows(IllegalStateException.class, () -> graph.connect(0, a));
    }

    @Test
    void adjacencyViewsAreReadOnly() {
        int a = graph.newNode("a", NodeKind.STATEMENT, -1, -1);
        graph.connect(0, a);

        assertThrows(UnsupportedOperationException.class, () -> graph.start().outgoing().add(5));
        assertThrows(UnsupportedOperationException.class, () -> graph.node(a).ingoing().clear());
        assertThrows(UnsupportedOperationException.class, () -> graph.nodes().remove(0));
    }

    @Test
    void lookupByLabelReturnsFirstMatch() {
        int first = graph.newNode("x += 1", NodeKind.STATEMENT, -1, -1);
        graph.newNode("x += 1", NodeKind.STATEMENT, -1, -1);

        assertEquals(first, graph.lookupByLabel("x += 1").orElseThrow());
        assertTrue(graph.lookupByLabel("missing").isEmpty());
    }

    @Test
    void nodeRejectsUnknownId() {
        assertThrows(IndexOutOfBoundsException.class, () -> graph.node(3));
    }
}
