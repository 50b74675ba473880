package de.uni_passau.fim.auermich.flow_graphs.core.rendering;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;

import java.io.File;

/**
 * Consumes a finished graph together with its metrics and produces a rendering of it.
 * Rendering the same graph twice must yield identical output.
 */
public interface GraphRenderer {

    /**
     * Renders the graph into the given output directory.
     *
     * @param graph The finished control flow graph.
     * @param metrics The metrics of the graph.
     * @param outputDir The output directory.
     * @return Returns the file that has been written.
     */
    File render(ControlFlowGraph graph, GraphMetrics metrics, File outputDir);
}
