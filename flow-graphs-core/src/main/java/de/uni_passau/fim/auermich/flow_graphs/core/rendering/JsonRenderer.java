package de.uni_passau.fim.auermich.flow_graphs.core.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowEdge;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowVertex;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.nio.json.JSONExporter;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Exports the graph to JSON. The document contains the nodes and edges as written by JGraphT
 * and an additional {@code metrics} object.
 */
public class JsonRenderer implements GraphRenderer {

    private static final Logger LOGGER = LogManager.getLogger(JsonRenderer.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @Override
    public File render(ControlFlowGraph graph, GraphMetrics metrics, File outputDir) {

        File output = new File(outputDir, ExportFormat.JSON.getFileName());
        LOGGER.info("Writing JSON file: " + output);

        try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            writer.write(toJson(graph, metrics));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output;
    }

    /**
     * Converts the graph and its metrics into a JSON document.
     *
     * @param graph The graph to be converted.
     * @param metrics The metrics of the graph.
     * @return Returns the JSON document.
     */
    public String toJson(ControlFlowGraph graph, GraphMetrics metrics) {

        JSONExporter<FlowVertex, FlowEdge> exporter = new JSONExporter<>(DotConverter::convertVertexToDOTNode);
        exporter.setVertexAttributeProvider(DotConverter::convertVertexToAttributes);
        exporter.setEdgeAttributeProvider(DotConverter::convertEdgeToAttributes);

        StringWriter writer = new StringWriter();
        exporter.exportGraph(graph.getGraph(), writer);

        JsonObject document = JsonParser.parseString(writer.toString()).getAsJsonObject();
        document.add("metrics", gson.toJsonTree(metrics));
        return gson.toJson(document);
    }
}
