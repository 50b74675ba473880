package de.uni_passau.fim.auermich.flow_graphs.core.utility;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg.BuildResult;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg.ControlFlowGraphBuilder;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.MetricsCalculator;
import de.uni_passau.fim.auermich.flow_graphs.core.rendering.ExportFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Enables the construction of a CFG from source text or a source file. Each call uses a fresh
 * builder, thus calls may be issued concurrently.
 */
public class GraphUtils {

    private static final Logger LOGGER = LogManager.getLogger(GraphUtils.class);

    private GraphUtils() {
        throw new UnsupportedOperationException("utility class");
    }

    /**
     * Constructs the CFG of the given source text.
     *
     * @param source A sequence of Java statements.
     * @return Returns either the graph or the syntax error.
     */
    public static BuildResult constructCFG(final String source) {
        return new ControlFlowGraphBuilder().build(source);
    }

    /**
     * Constructs the CFG of the statements contained in the given file.
     *
     * @param sourceFile The UTF-8 encoded source file.
     * @return Returns either the graph or the syntax error.
     */
    public static BuildResult constructCFG(final File sourceFile) {

        LOGGER.info("Constructing CFG for file: " + sourceFile);

        long start = System.currentTimeMillis();
        BuildResult result = constructCFG(readSource(sourceFile));
        long end = System.currentTimeMillis();

        LOGGER.debug("Graph construction took: " + (end - start) + " ms");
        return result;
    }

    /**
     * Computes the metrics of the given graph and exports both in the given format.
     *
     * @param graph The finished graph.
     * @param format The export format.
     * @param outputDir The output directory, created if missing.
     * @return Returns the written file.
     */
    public static File exportCFG(final ControlFlowGraph graph, final ExportFormat format, final File outputDir) {

        if (!outputDir.exists() && !outputDir.mkdirs()) {
            throw new UncheckedIOException(new IOException("Couldn't create output directory " + outputDir));
        }

        GraphMetrics metrics = MetricsCalculator.compute(graph);
        return format.getRenderer().render(graph, metrics, outputDir);
    }

    private static String readSource(final File sourceFile) {
        try {
            return Files.readString(sourceFile.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
