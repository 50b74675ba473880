package de.uni_passau.fim.auermich.flow_graphs.core.rendering;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowEdge;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowVertex;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exports the graph to the DOT language, which can be rendered by graphviz.
 */
public class DotRenderer implements GraphRenderer {

    private static final Logger LOGGER = LogManager.getLogger(DotRenderer.class);

    @Override
    public File render(ControlFlowGraph graph, GraphMetrics metrics, File outputDir) {

        File output = new File(outputDir, ExportFormat.DOT.getFileName());
        LOGGER.info("Writing DOT file: " + output);

        try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            export(graph, metrics, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output;
    }

    /**
     * Converts the graph into a DOT string.
     *
     * @param graph The graph to be converted.
     * @param metrics The metrics shown as graph label.
     * @return Returns the DOT representation of the graph.
     */
    public String toDot(ControlFlowGraph graph, GraphMetrics metrics) {
        StringWriter writer = new StringWriter();
        export(graph, metrics, writer);
        return writer.toString();
    }

    private void export(ControlFlowGraph graph, GraphMetrics metrics, Writer writer) {

        DOTExporter<FlowVertex, FlowEdge> exporter = new DOTExporter<>(DotConverter::convertVertexToDOTNode);
        exporter.setVertexAttributeProvider(DotConverter::convertVertexToAttributes);
        exporter.setEdgeAttributeProvider(DotConverter::convertEdgeToAttributes);
        exporter.setGraphAttributeProvider(() -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("rankdir", DefaultAttribute.createAttribute("TB"));
            map.put("nodesep", DefaultAttribute.createAttribute("0.5"));
            map.put("ranksep", DefaultAttribute.createAttribute("0.5"));
            map.put("label", DefaultAttribute.createAttribute(DotConverter.convertMetricsToLabel(metrics)));
            return map;
        });

        exporter.exportGraph(graph.getGraph(), writer);
    }
}
