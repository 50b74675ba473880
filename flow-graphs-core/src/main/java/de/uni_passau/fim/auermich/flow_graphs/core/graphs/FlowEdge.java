package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

import org.jgrapht.graph.DefaultEdge;

/**
 * An edge in the control flow graph. In contrast to vertices, edges are compared by identity
 * such that parallel edges between the same pair of vertices remain distinct.
 */
public class FlowEdge extends DefaultEdge {

    /**
     * The label of a loop-closing edge.
     */
    public static final String LOOP_LABEL = "Loop";

    private final String label;

    public FlowEdge() {
        this("");
    }

    public FlowEdge(String label) {
        this.label = label == null ? "" : label;
    }

    @Override
    public FlowVertex getSource() {
        return (FlowVertex) super.getSource();
    }

    @Override
    public FlowVertex getTarget() {
        return (FlowVertex) super.getTarget();
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }

    public boolean isLoopEdge() {
        return LOOP_LABEL.equals(label);
    }

    @Override
    public String toString() {
        String edge = "(" + getSource().getName() + "->" + getTarget().getName() + ")";
        return hasLabel() ? edge + " " + label : edge;
    }
}
