package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

import java.util.Objects;

/**
 * A vertex in the control flow graph. Vertices are immutable and are solely created
 * through {@link ControlFlowGraph#addVertex(String, VertexRole)}.
 */
public class FlowVertex {

    private final int id;

    private final String label;

    private final VertexRole role;

    private final VertexStyle style;

    FlowVertex(int id, String label, VertexRole role) {
        this.id = id;
        this.label = Objects.requireNonNull(label);
        this.role = Objects.requireNonNull(role);
        this.style = VertexStyle.of(role);
    }

    public int getId() {
        return id;
    }

    /**
     * Returns the identifier used when exporting the vertex, e.g. {@code node_3}.
     *
     * @return Returns the export identifier of the vertex.
     */
    public String getName() {
        return "node_" + id;
    }

    public String getLabel() {
        return label;
    }

    public VertexRole getRole() {
        return role;
    }

    public String getShape() {
        return style.getShape();
    }

    public String getFillColor() {
        return style.getFillColor();
    }

    public boolean isEntryVertex() {
        return role == VertexRole.START;
    }

    public boolean isExitVertex() {
        return role == VertexRole.STOP;
    }

    @Override
    public String toString() {
        return getName() + " [" + role + "] " + label;
    }

    @Override
    public boolean equals(Object o) {

        if (o == this)
            return true;

        if (!(o instanceof FlowVertex)) {
            return false;
        }

        FlowVertex other = (FlowVertex) o;

        // ids are unique within a single build
        return this.id == other.id
                && this.role == other.role
                && this.label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
