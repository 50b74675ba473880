package de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowEdge;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowVertex;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.VertexRole;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.MetricsCalculator;
import de.uni_passau.fim.auermich.flow_graphs.core.parser.SyntaxErrorDetail;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.AssignmentStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.LoopStatement;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowGraphBuilderTest {

    private static final List<String> PROGRAMS = List.of(
            "",
            "x = 10;",
            "if (x > 5) { print(\"a\"); } else { x = 0; }",
            "while (x > 0) { x = x - 1; }",
            "if (a) { x = 1; } else if (b) { x = 2; } else { x = 3; }",
            "while (i < 10) { if (i % 2 == 0) { even(i); } else { odd(i); } }",
            "x = 10;\nif (x > 5) {\n    print(\"Greater\");\n} else {\n    x = 0;\n}\nprint(\"Final x:\", x);",
            "while (running) { }",
            "if (a) { } else { x = 1; }",
            "for (int i = 0; i < 3; i++) { f(i); }\nreturn;"
    );

    private static ControlFlowGraph build(String source) {
        BuildResult result = new ControlFlowGraphBuilder().build(source);
        assertTrue(result.isSuccessful(), () -> "Unexpected failure: " + result);
        return result.getGraph().orElseThrow();
    }

    private static List<String> labels(ControlFlowGraph graph) {
        return graph.getVertices().stream().map(FlowVertex::getLabel).collect(Collectors.toList());
    }

    private static List<String> labels(Collection<FlowVertex> vertices) {
        return vertices.stream().map(FlowVertex::getLabel).collect(Collectors.toList());
    }

    private static List<String> edges(ControlFlowGraph graph) {
        return graph.getEdges().stream()
                .map(edge -> edge.getSource().getName() + "->" + edge.getTarget().getName() + ":" + edge.getLabel())
                .collect(Collectors.toList());
    }

    @Test
    void emptyProgram() {
        ControlFlowGraph graph = build("");
        assertEquals(List.of("START", "STOP"), labels(graph));
        assertEquals(1, graph.edgeCount());
        assertEquals(new GraphMetrics(2, 1, 0, 1), MetricsCalculator.compute(graph));
    }

    @Test
    void whitespaceOnlyProgram() {
        ControlFlowGraph graph = build("   \n\t\n");
        assertEquals(2, graph.size());
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void singleAssignment() {
        ControlFlowGraph graph = build("x = 10;");
        assertEquals(List.of("START", "x = 10", "STOP"), labels(graph));
        assertEquals(new GraphMetrics(3, 2, 0, 1), MetricsCalculator.compute(graph));
        assertEquals(List.of("node_1->node_2:", "node_2->node_3:"), edges(graph));
    }

    @Test
    void conditionalBranchesMergeIntoStop() {
        ControlFlowGraph graph = build("if (x > 5) { print(\"a\"); } else { x = 0; }");

        assertEquals(List.of("START", "if x > 5:", "print(\"a\")", "x = 0", "STOP"), labels(graph));
        assertEquals(VertexRole.BRANCH, graph.lookUpVertex("node_2").orElseThrow().getRole());
        assertEquals(2, graph.getIncomingEdges(graph.getExit()).size());

        GraphMetrics metrics = MetricsCalculator.compute(graph);
        assertEquals(1, metrics.getPredicates());
        assertEquals(2, metrics.getCyclomaticComplexity());
    }

    @Test
    void conditionalWithoutElseFallsThroughPredicate() {
        ControlFlowGraph graph = build("if (x > 5) { y = 1; }\nz = 2;");

        FlowVertex z = graph.lookUpVertex("node_4").orElseThrow();
        assertEquals("z = 2", z.getLabel());
        // true exits come first
        assertEquals(List.of("y = 1", "if x > 5:"), labels(graph.getPredecessors(z)));
        assertEquals(2, MetricsCalculator.compute(graph).getCyclomaticComplexity());
    }

    @Test
    void elseIfChainMergesInSourceOrder() {
        ControlFlowGraph graph = build("if (a) { x = 1; } else if (b) { x = 2; } else { x = 3; }");

        assertEquals(List.of("START", "if a:", "x = 1", "if b:", "x = 2", "x = 3", "STOP"), labels(graph));
        assertEquals(List.of("x = 1", "x = 2", "x = 3"), labels(graph.getPredecessors(graph.getExit())));

        GraphMetrics metrics = MetricsCalculator.compute(graph);
        assertEquals(2, metrics.getPredicates());
        assertEquals(3, metrics.getCyclomaticComplexity());
    }

    @Test
    void whileLoopHasSingleBackEdge() {
        ControlFlowGraph graph = build("while (x > 0) { x = x - 1; }");

        FlowVertex predicate = graph.lookUpVertex("node_2").orElseThrow();
        FlowVertex body = graph.lookUpVertex("node_3").orElseThrow();
        assertEquals("while x > 0:", predicate.getLabel());
        assertEquals(VertexRole.LOOP, predicate.getRole());

        List<FlowEdge> loopEdges = graph.getEdges().stream().filter(FlowEdge::isLoopEdge).collect(Collectors.toList());
        assertEquals(1, loopEdges.size());
        assertEquals(body, loopEdges.get(0).getSource());
        assertEquals(predicate, loopEdges.get(0).getTarget());

        // the loop is only left through the predicate
        assertEquals(List.of("while x > 0:"), labels(graph.getPredecessors(graph.getExit())));

        GraphMetrics metrics = MetricsCalculator.compute(graph);
        assertEquals(1, metrics.getPredicates());
        assertEquals(2, metrics.getCyclomaticComplexity());
    }

    @Test
    void labeledLoopHasBackEdge() {
        ControlFlowGraph graph = build("outer: while (x > 0) { x = x - 1; }");

        assertEquals(List.of("START", "while x > 0:", "x = x - 1", "STOP"), labels(graph));
        assertEquals(VertexRole.LOOP, graph.lookUpVertex("node_2").orElseThrow().getRole());
        assertEquals(1, graph.getEdges().stream().filter(FlowEdge::isLoopEdge).count());
        assertEquals(new GraphMetrics(4, 4, 1, 2), MetricsCalculator.compute(graph));
    }

    @Test
    void emptyLoopBodyClosesOnPredicate() {
        ControlFlowGraph graph = build("while (running) { }");

        FlowVertex predicate = graph.lookUpVertex("node_2").orElseThrow();
        List<FlowEdge> loopEdges = graph.getEdges().stream().filter(FlowEdge::isLoopEdge).collect(Collectors.toList());
        assertEquals(1, loopEdges.size());
        assertEquals(predicate, loopEdges.get(0).getSource());
        assertEquals(predicate, loopEdges.get(0).getTarget());
        assertEquals(2, MetricsCalculator.compute(graph).getCyclomaticComplexity());
    }

    @Test
    void backEdgesOriginateFromAllBranchExits() {
        ControlFlowGraph graph = build("while (i < 10) { if (i % 2 == 0) { even(i); } else { odd(i); } }");

        FlowVertex loop = graph.lookUpVertex("node_2").orElseThrow();
        List<String> backEdgeSources = graph.getIncomingEdges(loop).stream()
                .filter(FlowEdge::isLoopEdge)
                .map(edge -> edge.getSource().getLabel())
                .collect(Collectors.toList());
        assertEquals(List.of("even(i)", "odd(i)"), backEdgeSources);

        GraphMetrics metrics = MetricsCalculator.compute(graph);
        assertEquals(new GraphMetrics(6, 7, 2, 3), metrics);
    }

    @Test
    void backEdgeFromConditionalWithoutElse() {
        ControlFlowGraph graph = build("while (c) { if (d) { x = 1; } }");

        FlowVertex loop = graph.lookUpVertex("node_2").orElseThrow();
        List<String> backEdgeSources = graph.getIncomingEdges(loop).stream()
                .filter(FlowEdge::isLoopEdge)
                .map(edge -> edge.getSource().getLabel())
                .collect(Collectors.toList());
        assertEquals(List.of("x = 1", "if d:"), backEdgeSources);
    }

    @Test
    void unsupportedStatementsAreOpaque() {
        ControlFlowGraph graph = build("for (int i = 0; i < 3; i++) { f(i); }\nthrow error;\nreturn;");

        List<FlowVertex> statements = graph.getVertices().stream()
                .filter(vertex -> vertex.getRole() == VertexRole.STATEMENT)
                .collect(Collectors.toList());
        assertEquals(3, statements.size());
        assertTrue(statements.get(0).getLabel().startsWith("for (int i = 0; i < 3; i++)"));
        assertEquals("throw error;", statements.get(1).getLabel());
        assertEquals("return;", statements.get(2).getLabel());
        assertEquals(1, MetricsCalculator.compute(graph).getCyclomaticComplexity());
    }

    @Test
    void malformedSourceYieldsNoGraph() {
        BuildResult result = new ControlFlowGraphBuilder().build("if (x > 5 { y = 1; }");

        assertFalse(result.isSuccessful());
        assertTrue(result.getGraph().isEmpty());
        SyntaxErrorDetail error = result.getError().orElseThrow();
        assertFalse(error.getMessage().isEmpty());
        assertTrue(error.getLine().isPresent());
    }

    @Test
    void sentinelsAreUnique() {
        for (String program : PROGRAMS) {
            ControlFlowGraph graph = build(program);

            List<FlowVertex> starts = graph.getVertices().stream()
                    .filter(FlowVertex::isEntryVertex).collect(Collectors.toList());
            List<FlowVertex> stops = graph.getVertices().stream()
                    .filter(FlowVertex::isExitVertex).collect(Collectors.toList());

            assertEquals(List.of(graph.getEntry()), starts, program);
            assertEquals(List.of(graph.getExit()), stops, program);
            assertEquals(0, graph.inDegree(graph.getEntry()), program);
            assertEquals(0, graph.outDegree(graph.getExit()), program);
        }
    }

    @Test
    void everyVertexIsReachable() {
        for (String program : PROGRAMS) {
            ControlFlowGraph graph = build(program);
            for (FlowVertex vertex : graph.getVertices()) {
                assertTrue(graph.isReachable(vertex), program + ": " + vertex);
            }
        }
    }

    @Test
    void complexityMatchesPredicateCount() {
        for (String program : PROGRAMS) {
            GraphMetrics metrics = MetricsCalculator.compute(build(program));
            assertEquals(metrics.getPredicates() + 1, metrics.getCyclomaticComplexity(), program);
        }
    }

    @Test
    void buildsAreIdempotent() {
        for (String program : PROGRAMS) {
            ControlFlowGraph first = build(program);
            ControlFlowGraph second = build(program);

            assertEquals(labels(first), labels(second));
            assertEquals(edges(first), edges(second));
            assertEquals(MetricsCalculator.compute(first), MetricsCalculator.compute(second));
        }
    }

    @Test
    void buildsFromStatementModel() {
        ControlFlowGraph graph = new ControlFlowGraphBuilder().build(List.of(
                new AssignmentStatement("x = 3"),
                new LoopStatement("x > 0", List.of(new AssignmentStatement("x = x - 1")))));

        assertEquals(List.of("START", "x = 3", "while x > 0:", "x = x - 1", "STOP"), labels(graph));
        assertEquals(2, MetricsCalculator.compute(graph).getCyclomaticComplexity());
    }

    @Test
    void builderIsSingleUse() {
        ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder();
        builder.build(List.of());
        assertThrows(IllegalStateException.class, () -> builder.build(List.of()));
    }
}
