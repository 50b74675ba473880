package de.uni_passau.fim.auermich.flow_graphs.core.metrics;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Derives the complexity metrics from a finished control flow graph.
 */
public final class MetricsCalculator {

    private static final Logger LOGGER = LogManager.getLogger(MetricsCalculator.class);

    private MetricsCalculator() {
        throw new UnsupportedOperationException("utility class");
    }

    /**
     * Computes the metrics of the given graph. A predicate is any vertex with more than one
     * outgoing edge. The cyclomatic complexity follows McCabe's E - N + 2P with a single
     * connected component.
     *
     * @param graph The finished control flow graph.
     * @return Returns the metrics of the graph.
     */
    public static GraphMetrics compute(final ControlFlowGraph graph) {

        int nodes = graph.size();
        int edges = graph.edgeCount();
        int predicates = graph.getBranches().size();
        int cyclomaticComplexity = edges - nodes + 2;

        GraphMetrics metrics = new GraphMetrics(nodes, edges, predicates, cyclomaticComplexity);
        LOGGER.debug(metrics);
        return metrics;
    }
}
