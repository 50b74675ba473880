package de.uni_passau.fim.auermich.flow_graphs.core.rendering;

import com.mxgraph.layout.hierarchical.mxHierarchicalLayout;
import com.mxgraph.layout.mxIGraphLayout;
import com.mxgraph.model.mxICell;
import com.mxgraph.util.mxCellRenderer;
import com.mxgraph.util.mxConstants;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowEdge;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowVertex;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.ext.JGraphXAdapter;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders the graph into a PNG image using a hierarchical layout. The metrics are not part of
 * the image, they are logged instead.
 */
public class ImageRenderer implements GraphRenderer {

    private static final Logger LOGGER = LogManager.getLogger(ImageRenderer.class);

    @Override
    public File render(ControlFlowGraph graph, GraphMetrics metrics, File outputDir) {

        File output = new File(outputDir, ExportFormat.PNG.getFileName());
        LOGGER.info("Drawing graph: " + output);
        LOGGER.info(metrics);

        JGraphXAdapter<FlowVertex, FlowEdge> graphXAdapter = new JGraphXAdapter<>(graph.getGraph()) {
            @Override
            public String convertValueToString(Object cell) {
                Object value = getModel().getValue(cell);
                if (value instanceof FlowVertex) {
                    return ((FlowVertex) value).getLabel();
                } else if (value instanceof FlowEdge) {
                    return ((FlowEdge) value).getLabel();
                }
                return super.convertValueToString(cell);
            }
        };

        styleVertices(graphXAdapter);

        // this layout orders the vertices in a sequence from top to bottom (START -> v1...vn -> STOP)
        mxIGraphLayout layout = new mxHierarchicalLayout(graphXAdapter);
        layout.execute(graphXAdapter.getDefaultParent());

        BufferedImage image =
                mxCellRenderer.createBufferedImage(graphXAdapter, null, 1, Color.WHITE, true, null);

        try {
            ImageIO.write(image, "PNG", output);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output;
    }

    /**
     * Applies the shape and fill color of each vertex style to the corresponding cell.
     *
     * @param graphXAdapter The graph adapter.
     */
    private void styleVertices(JGraphXAdapter<FlowVertex, FlowEdge> graphXAdapter) {

        Map<FlowVertex, mxICell> vertexToCellMap = graphXAdapter.getVertexToCellMap();

        for (Map.Entry<FlowVertex, mxICell> entry : vertexToCellMap.entrySet()) {
            FlowVertex vertex = entry.getKey();
            Object[] cells = {entry.getValue()};
            graphXAdapter.setCellStyles(mxConstants.STYLE_SHAPE, toShape(vertex.getShape()), cells);
            graphXAdapter.setCellStyles(mxConstants.STYLE_FILLCOLOR, vertex.getFillColor(), cells);
        }

        graphXAdapter.refresh();
    }

    private static String toShape(String shape) {
        switch (shape) {
            case "ellipse":
                return mxConstants.SHAPE_ELLIPSE;
            case "diamond":
                return mxConstants.SHAPE_RHOMBUS;
            default:
                return mxConstants.SHAPE_RECTANGLE;
        }
    }
}
