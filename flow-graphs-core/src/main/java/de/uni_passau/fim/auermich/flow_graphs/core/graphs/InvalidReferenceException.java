package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

/**
 * Signals that an edge was requested between vertices that are not part of the graph.
 * This always denotes a programming error in the caller.
 */
public class InvalidReferenceException extends IllegalArgumentException {

    public InvalidReferenceException(FlowVertex vertex) {
        super("Vertex not contained in graph: " + vertex);
    }
}
