package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.builder.GraphTypeBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A control flow graph of a statement sequence. The graph is only ever extended, vertices and
 * edges are never removed. Both vertices and edges are iterated in insertion order, which makes
 * the export of two builds over the same input identical.
 */
public class ControlFlowGraph implements BaseGraph {

    private static final Logger LOGGER = LogManager.getLogger(ControlFlowGraph.class);

    private final Graph<FlowVertex, FlowEdge> graph = GraphTypeBuilder
            .<FlowVertex, DefaultEdge>directed().allowingMultipleEdges(true).allowingSelfLoops(true)
            .edgeClass(FlowEdge.class).buildGraph();

    // the last assigned vertex id, ids start at 1
    private int counter = 0;

    private FlowVertex entry;
    private FlowVertex exit;

    /**
     * Creates a new vertex with a fresh id and adds it to the graph.
     *
     * @param label The label of the vertex.
     * @param role The role of the vertex.
     * @return Returns the newly created vertex.
     */
    public FlowVertex addVertex(String label, VertexRole role) {

        if (role == VertexRole.START && entry != null) {
            throw new IllegalStateException("Graph already contains a START vertex!");
        }

        if (role == VertexRole.STOP && exit != null) {
            throw new IllegalStateException("Graph already contains a STOP vertex!");
        }

        FlowVertex vertex = new FlowVertex(++counter, label, role);
        graph.addVertex(vertex);
        LOGGER.debug("Vertex: " + vertex);

        if (role == VertexRole.START) {
            entry = vertex;
        } else if (role == VertexRole.STOP) {
            exit = vertex;
        }

        return vertex;
    }

    /**
     * Adds an unlabeled edge between the given vertices.
     *
     * @param src The source vertex.
     * @param dest The target vertex.
     * @return Returns the newly created edge.
     */
    public FlowEdge addEdge(FlowVertex src, FlowVertex dest) {
        return addEdge(src, dest, "");
    }

    /**
     * Adds a labeled edge between the given vertices. Parallel edges are permitted.
     *
     * @param src The source vertex.
     * @param dest The target vertex.
     * @param label The edge label, may be empty.
     * @return Returns the newly created edge.
     * @throws InvalidReferenceException If one of the vertices is not part of this graph.
     */
    public FlowEdge addEdge(FlowVertex src, FlowVertex dest, String label) {

        if (!containsVertex(src)) {
            throw new InvalidReferenceException(src);
        }

        if (!containsVertex(dest)) {
            throw new InvalidReferenceException(dest);
        }

        FlowEdge edge = new FlowEdge(label);
        graph.addEdge(src, dest, edge);
        LOGGER.debug("Edge: " + edge);
        return edge;
    }

    /**
     * Provides a read-only view of the underlying JGraphT graph, e.g. for exporters.
     *
     * @return Returns an unmodifiable view of the graph.
     */
    public Graph<FlowVertex, FlowEdge> getGraph() {
        return new AsUnmodifiableGraph<>(graph);
    }

    public boolean containsVertex(FlowVertex vertex) {
        return vertex != null && graph.containsVertex(vertex);
    }

    public FlowVertex getEntry() {
        return entry;
    }

    /**
     * Returns the STOP vertex. This is {@code null} as long as the construction has not been completed.
     *
     * @return Returns the exit vertex.
     */
    public FlowVertex getExit() {
        return exit;
    }

    public Set<FlowVertex> getVertices() {
        return graph.vertexSet();
    }

    public Set<FlowEdge> getEdges() {
        return graph.edgeSet();
    }

    public Set<FlowEdge> getOutgoingEdges(FlowVertex vertex) {
        return graph.outgoingEdgesOf(vertex);
    }

    public Set<FlowEdge> getIncomingEdges(FlowVertex vertex) {
        return graph.incomingEdgesOf(vertex);
    }

    public int outDegree(FlowVertex vertex) {
        return graph.outDegreeOf(vertex);
    }

    public int inDegree(FlowVertex vertex) {
        return graph.inDegreeOf(vertex);
    }

    /**
     * Retrieves the direct successor vertices of a given source vertex.
     *
     * @param source The source vertex whose successors should be retrieved.
     * @return Returns all direct successors of given source vertex in insertion order.
     */
    public Set<FlowVertex> getSuccessors(final FlowVertex source) {
        return getOutgoingEdges(source).stream().map(FlowEdge::getTarget)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Retrieves the direct predecessor vertices of a given target vertex.
     *
     * @param target The target vertex whose predecessors should be retrieved.
     * @return Returns all direct predecessors of given target vertex in insertion order.
     */
    public Set<FlowVertex> getPredecessors(final FlowVertex target) {
        return getIncomingEdges(target).stream().map(FlowEdge::getSource)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Retrieves all transitive successors of the supplied vertex, i.e. any vertex that could be eventually reached
     * from the supplied vertex.
     *
     * @param vertex The vertex whose transitive successors should be retrieved.
     * @return Returns a collection of vertices that represent transitive successors of the supplied vertex.
     */
    public Collection<FlowVertex> getTransitiveSuccessors(final FlowVertex vertex) {
        final Set<FlowVertex> visitedVertices = new HashSet<>();
        final List<FlowVertex> workList = new ArrayList<>(getSuccessors(vertex));
        final Collection<FlowVertex> successors = new LinkedHashSet<>();

        while (!workList.isEmpty()) {
            FlowVertex current = workList.remove(workList.size() - 1);
            if (visitedVertices.add(current)) {
                successors.add(current);
                workList.addAll(getSuccessors(current));
            }
        }
        return successors;
    }

    /**
     * Checks whether the given vertex can be reached from the START vertex.
     *
     * @param vertex The vertex to be checked.
     * @return Returns {@code true} if the vertex is the entry or a transitive successor of it.
     */
    public boolean isReachable(final FlowVertex vertex) {
        return vertex.equals(entry) || getTransitiveSuccessors(entry).contains(vertex);
    }

    /**
     * Returns the predicate vertices, i.e. all vertices with more than one outgoing edge.
     *
     * @return Returns the list of branching vertices.
     */
    public List<FlowVertex> getBranches() {
        return getVertices().stream()
                .filter(vertex -> outDegree(vertex) > 1).collect(Collectors.toList());
    }

    @Override
    public Optional<FlowVertex> lookUpVertex(String name) {
        return getVertices().stream().filter(vertex -> vertex.getName().equals(name)).findFirst();
    }

    @Override
    public int size() {
        return graph.vertexSet().size();
    }

    @Override
    public int edgeCount() {
        return graph.edgeSet().size();
    }

    @Override
    public String toString() {
        return graph.toString();
    }
}
