package de.uni_passau.fim.auermich.flow_graphs.core.graphs;

/**
 * The closed set of style presets. The builder never interprets them, they are solely
 * carried to the renderer.
 */
public enum VertexStyle {

    STATEMENT("rect", "#ffffff"),
    BRANCH_PREDICATE("diamond", "#AED6F1"),
    LOOP_PREDICATE("diamond", "#F9E79F"),
    START_SENTINEL("ellipse", "#DAF7A6"),
    STOP_SENTINEL("ellipse", "#FFC300");

    private final String shape;
    private final String fillColor;

    VertexStyle(String shape, String fillColor) {
        this.shape = shape;
        this.fillColor = fillColor;
    }

    public String getShape() {
        return shape;
    }

    public String getFillColor() {
        return fillColor;
    }

    /**
     * Maps a vertex role to its style preset.
     *
     * @param role The role of the vertex.
     * @return Returns the style preset of the given role.
     */
    public static VertexStyle of(VertexRole role) {
        switch (role) {
            case START:
                return START_SENTINEL;
            case STOP:
                return STOP_SENTINEL;
            case STATEMENT:
                return STATEMENT;
            case BRANCH:
                return BRANCH_PREDICATE;
            case LOOP:
                return LOOP_PREDICATE;
            default:
                throw new UnsupportedOperationException("Vertex role not supported yet!");
        }
    }
}
