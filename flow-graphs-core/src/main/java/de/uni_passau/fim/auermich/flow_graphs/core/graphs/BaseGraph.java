package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

import java.util.Optional;

public interface BaseGraph {

    String toString();

    // number of vertices
    int size();

    // number of edges
    int edgeCount();

    /**
     * Queries the vertex with the given export identifier, e.g. {@code node_3}.
     *
     * @param name Identifies the vertex in the graph.
     * @return Returns the vertex with the given identifier if present.
     */
    Optional<FlowVertex> lookUpVertex(String name);
}
