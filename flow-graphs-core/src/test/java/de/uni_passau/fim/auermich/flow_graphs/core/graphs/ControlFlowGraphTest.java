package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowGraphTest {

    private ControlFlowGraph graph;
    private FlowVertex start;
    private FlowVertex predicate;
    private FlowVertex body;

    @BeforeEach
    void setUp() {
        graph = new ControlFlowGraph();
        start = graph.addVertex("START", VertexRole.START);
        predicate = graph.addVertex("while x > 0:", VertexRole.LOOP);
        body = graph.addVertex("x = x - 1", VertexRole.STATEMENT);
    }

    @Test
    void idsAreAssignedMonotonically() {
        assertEquals(1, start.getId());
        assertEquals(2, predicate.getId());
        assertEquals(3, body.getId());
        assertEquals("node_3", body.getName());
        assertEquals(List.of(start, predicate, body), new ArrayList<>(graph.getVertices()));
    }

    @Test
    void stylesFollowRole() {
        assertEquals("ellipse", start.getShape());
        assertEquals("#DAF7A6", start.getFillColor());
        assertEquals("diamond", predicate.getShape());
        assertEquals("#F9E79F", predicate.getFillColor());
        assertEquals("rect", body.getShape());
        assertEquals("#ffffff", body.getFillColor());
    }

    @Test
    void parallelEdgesAreDistinct() {
        graph.addEdge(predicate, body);
        graph.addEdge(predicate, body, FlowEdge.LOOP_LABEL);

        assertEquals(2, graph.edgeCount());
        assertEquals(2, graph.outDegree(predicate));
        assertEquals(2, graph.inDegree(body));
        assertEquals(1, graph.getSuccessors(predicate).size());
    }

    @Test
    void edgesAreIteratedInInsertionOrder() {
        FlowEdge first = graph.addEdge(start, predicate);
        FlowEdge second = graph.addEdge(predicate, body);
        FlowEdge third = graph.addEdge(body, predicate, FlowEdge.LOOP_LABEL);

        assertEquals(List.of(first, second, third), new ArrayList<>(graph.getEdges()));
        assertTrue(third.isLoopEdge());
        assertFalse(first.hasLabel());
        assertEquals(body, third.getSource());
        assertEquals(predicate, third.getTarget());
    }

    @Test
    void rejectsUnknownVertices() {
        ControlFlowGraph other = new ControlFlowGraph();
        other.addVertex("START", VertexRole.START);
        other.addVertex("a = 1", VertexRole.STATEMENT);
        other.addVertex("b = 2", VertexRole.STATEMENT);
        FlowVertex foreign = other.addVertex("c = 3", VertexRole.STATEMENT);

        assertThrows(InvalidReferenceException.class, () -> graph.addEdge(start, foreign));
        assertThrows(InvalidReferenceException.class, () -> graph.addEdge(foreign, body));
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void onlyOneStartVertex() {
        assertThrows(IllegalStateException.class, () -> graph.addVertex("START", VertexRole.START));
    }

    @Test
    void branchesAreVerticesWithSeveralSuccessors() {
        FlowVertex stop = graph.addVertex("STOP", VertexRole.STOP);
        graph.addEdge(start, predicate);
        graph.addEdge(predicate, body);
        graph.addEdge(body, predicate, FlowEdge.LOOP_LABEL);
        graph.addEdge(predicate, stop);

        assertEquals(List.of(predicate), graph.getBranches());
        assertEquals(stop, graph.getExit());
        assertTrue(graph.getTransitiveSuccessors(start).contains(stop));
        assertTrue(graph.isReachable(body));
        assertEquals(predicate, graph.lookUpVertex("node_2").orElseThrow());
        assertTrue(graph.lookUpVertex("node_42").isEmpty());
    }
}
