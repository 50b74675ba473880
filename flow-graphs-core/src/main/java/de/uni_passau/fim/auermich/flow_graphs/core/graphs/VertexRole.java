package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

/**
 * The role a vertex plays in the control flow graph. The role determines the rendering
 * style of the vertex, see {@link VertexStyle}.
 */
public enum VertexRole {

    START,
    STOP,
    STATEMENT,
    BRANCH,
    LOOP;

    @Override
    public String toString() {
        switch (this) {
            case START:
                return "start";
            case STOP:
                return "stop";
            case STATEMENT:
                return "statement";
            case BRANCH:
                return "branch";
            case LOOP:
                return "loop";
        }
        throw new UnsupportedOperationException("Vertex role not supported yet!");
    }
}
