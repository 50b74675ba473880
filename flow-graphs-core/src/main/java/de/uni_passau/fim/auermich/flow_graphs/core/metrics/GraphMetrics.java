package de.uni_passau.fim.auermich.flow_graphs.core.metrics;

import java.util.Objects;

/**
 * The complexity metrics of a control flow graph.
 */
public final class GraphMetrics {

    private final int nodes;
    private final int edges;
    private final int predicates;
    private final int cyclomaticComplexity;

    public GraphMetrics(int nodes, int edges, int predicates, int cyclomaticComplexity) {
        this.nodes = nodes;
        this.edges = edges;
        this.predicates = predicates;
        this.cyclomaticComplexity = cyclomaticComplexity;
    }

    public int getNodes() {
        return nodes;
    }

    public int getEdges() {
        return edges;
    }

    public int getPredicates() {
        return predicates;
    }

    public int getCyclomaticComplexity() {
        return cyclomaticComplexity;
    }

    @Override
    public String toString() {
        return "Nodes: " + nodes + ", Edges: " + edges + ", Predicates: " + predicates
                + ", Cyclomatic Complexity: " + cyclomaticComplexity;
    }

    @Override
    public boolean equals(Object o) {

        if (o == this)
            return true;

        if (!(o instanceof GraphMetrics)) {
            return false;
        }

        GraphMetrics other = (GraphMetrics) o;
        return nodes == other.nodes
                && edges == other.edges
                && predicates == other.predicates
                && cyclomaticComplexity == other.cyclomaticComplexity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges, predicates, cyclomaticComplexity);
    }
}
