package de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.parser.SyntaxErrorDetail;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of building a graph from source text: either a graph or a syntax error, never both.
 */
public final class BuildResult {

    private final ControlFlowGraph graph;
    private final SyntaxErrorDetail error;

    private BuildResult(ControlFlowGraph graph, SyntaxErrorDetail error) {
        this.graph = graph;
        this.error = error;
    }

    public static BuildResult success(ControlFlowGraph graph) {
        return new BuildResult(Objects.requireNonNull(graph), null);
    }

    public static BuildResult failure(SyntaxErrorDetail error) {
        return new BuildResult(null, Objects.requireNonNull(error));
    }

    public boolean isSuccessful() {
        return graph != null;
    }

    public Optional<ControlFlowGraph> getGraph() {
        return Optional.ofNullable(graph);
    }

    public Optional<SyntaxErrorDetail> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccessful() ? "BuildResult{graph of size " + graph.size() + "}" : "BuildResult{" + error + "}";
    }
}
