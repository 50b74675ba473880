package de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowVertex;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The vertices whose control currently falls through to whatever vertex is created next.
 * A frontier is an immutable, insertion-ordered set. A frontier with more than one vertex
 * represents a control flow join without an explicit merge vertex.
 */
public final class Frontier implements Iterable<FlowVertex> {

    private final Set<FlowVertex> vertices;

    private Frontier(Set<FlowVertex> vertices) {
        this.vertices = Collections.unmodifiableSet(vertices);
    }

    /**
     * Creates a frontier consisting of a single vertex.
     *
     * @param vertex The only vertex of the frontier.
     * @return Returns the frontier {vertex}.
     */
    public static Frontier of(FlowVertex vertex) {
        Set<FlowVertex> vertices = new LinkedHashSet<>();
        vertices.add(vertex);
        return new Frontier(vertices);
    }

    /**
     * Merges two frontiers. The vertices of this frontier come first, followed by the
     * vertices of the other frontier that are not already contained.
     *
     * @param other The frontier to be merged.
     * @return Returns the ordered union of both frontiers.
     */
    public Frontier union(Frontier other) {
        Set<FlowVertex> merged = new LinkedHashSet<>(vertices);
        merged.addAll(other.vertices);
        return new Frontier(merged);
    }

    public Set<FlowVertex> getVertices() {
        return vertices;
    }

    public boolean contains(FlowVertex vertex) {
        return vertices.contains(vertex);
    }

    public int size() {
        return vertices.size();
    }

    @Override
    public Iterator<FlowVertex> iterator() {
        return vertices.iterator();
    }

    @Override
    public boolean equals(Object o) {

        if (o == this)
            return true;

        if (!(o instanceof Frontier)) {
            return false;
        }

        // order is irrelevant for equality
        return this.vertices.equals(((Frontier) o).vertices);
    }

    @Override
    public int hashCode() {
        return vertices.hashCode();
    }

    @Override
    public String toString() {
        return vertices.toString();
    }
}
