package de.uni_passau.fim.auermich.flow_graphs.core.rendering;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowEdge;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowVertex;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A converter from vertices, edges and metrics to the attributes understood by graphviz.
 * The JSON export shares the attribute names.
 */
public class DotConverter {

    private static final String EDGE_COLOR = "#2E4053";

    private DotConverter() {
        throw new UnsupportedOperationException("utility class");
    }

    /**
     * Converts a vertex into a DOT node identifier, e.g. {@code node_3}.
     *
     * @param vertex The vertex to be converted.
     * @return Returns the identifier of the vertex.
     */
    public static String convertVertexToDOTNode(final FlowVertex vertex) {
        return vertex.getName();
    }

    /**
     * Converts a vertex into its attributes. The label is what we see when we render the graph.
     *
     * @param vertex The vertex to be converted.
     * @return Returns the ordered attributes of the vertex.
     */
    public static Map<String, Attribute> convertVertexToAttributes(final FlowVertex vertex) {
        Map<String, Attribute> map = new LinkedHashMap<>();
        map.put("label", DefaultAttribute.createAttribute(vertex.getLabel()));
        map.put("shape", DefaultAttribute.createAttribute(vertex.getShape()));
        map.put("fillcolor", DefaultAttribute.createAttribute(vertex.getFillColor()));
        map.put("style", DefaultAttribute.createAttribute("filled"));
        map.put("fontname", DefaultAttribute.createAttribute("Arial"));
        map.put("fontsize", DefaultAttribute.createAttribute("10"));
        return map;
    }

    /**
     * Converts an edge into its attributes. Unlabeled edges only carry the edge color.
     *
     * @param edge The edge to be converted.
     * @return Returns the ordered attributes of the edge.
     */
    public static Map<String, Attribute> convertEdgeToAttributes(final FlowEdge edge) {
        Map<String, Attribute> map = new LinkedHashMap<>();
        if (edge.hasLabel()) {
            map.put("label", DefaultAttribute.createAttribute(edge.getLabel()));
        }
        map.put("color", DefaultAttribute.createAttribute(EDGE_COLOR));
        return map;
    }

    /**
     * Converts the metrics into a graph label shown below the rendered graph.
     *
     * @param metrics The metrics of the graph.
     * @return Returns the graph label.
     */
    public static String convertMetricsToLabel(final GraphMetrics metrics) {
        return metrics.toString();
    }
}
