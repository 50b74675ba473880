package de.uni_passau.fim.auermich.flow_graphs.cli;

import com.beust.jcommander.JCommander;
import de.uni_passau.fim.auermich.flow_graphs.cli.jcommander.CFGCommand;
import de.uni_passau.fim.auermich.flow_graphs.cli.jcommander.MainCommand;
import de.uni_passau.fim.auermich.flow_graphs.cli.jcommander.MetricsCommand;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg.BuildResult;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.GraphMetrics;
import de.uni_passau.fim.auermich.flow_graphs.core.metrics.MetricsCalculator;
import de.uni_passau.fim.auermich.flow_graphs.core.utility.GraphUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.File;

/**
 * Defines the command line interface. A typical invocation could be:
 *      java -jar flow-graphs-cli.jar -f <path-to-source> cfg -format png -o out
 * This would construct the CFG of the statements in the source file and draw it
 * into the directory out.
 */
public final class Main {

    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    private static final String CFG_COMMAND = "cfg";
    private static final String METRICS_COMMAND = "metrics";

    // utility class implies private constructor
    private Main() {
        throw new UnsupportedOperationException("Utility class!");
    }

    /**
     * Processes the command line arguments and constructs the CFG.
     *
     * @param args The command line arguments.
     *             The switch -f specifies the path to the source file (must come first).
     *             The switch -d specifies whether debugging mode should be enabled (no argument required).
     *             The switch -l (-lookup) requests a vertex lookup by its identifier, e.g. node_3.
     *
     *             After those global options, a sub commando must follow. This can be either
     *             'cfg' or 'metrics'.
     *
     *             The 'cfg' sub commando can handle the following arguments:
     *             The switch -o specifies the output directory. (optional, defaults to the working directory)
     *             The switch -format specifies the export format, one of dot, json, png. (optional, defaults to dot)
     *
     *             The 'metrics' sub commando logs the node, edge and predicate count as well
     *             as the cyclomatic complexity.
     */
    public static void main(String[] args) {

        // the set of possible commands
        MainCommand mainCmd = new MainCommand();
        CFGCommand cfgCmd = new CFGCommand();
        MetricsCommand metricsCmd = new MetricsCommand();

        JCommander commander = JCommander.newBuilder()
                .addObject(mainCmd)
                .addCommand(CFG_COMMAND, cfgCmd)
                .addCommand(METRICS_COMMAND, metricsCmd)
                .build();

        // the program name displayed in the help/usage cmd.
        commander.setProgramName("Flow-Graphs");

        // parse command line arguments
        commander.parse(args);

        // determine which logging level should be used
        if (mainCmd.isDebug()) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.DEBUG);
        } else {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.INFO);
        }

        // check whether help command is executed
        if (mainCmd.isHelp()) {
            commander.usage();
        } else if (!run(commander.getParsedCommand(), mainCmd, cfgCmd)) {
            commander.usage();
        }
    }

    /**
     * Constructs the CFG and executes the selected sub command.
     *
     * @param selectedCommand The parsed sub command, may be {@code null}.
     * @param mainCmd The global options.
     * @param cfgCmd The options of the 'cfg' sub command.
     * @return Returns {@code false} if no valid sub command was given, otherwise {@code true}.
     */
    static boolean run(String selectedCommand, MainCommand mainCmd, CFGCommand cfgCmd) {

        if (!CFG_COMMAND.equals(selectedCommand) && !METRICS_COMMAND.equals(selectedCommand)) {
            LOGGER.warn("Enter a valid command please!");
            return false;
        }

        BuildResult result = GraphUtils.constructCFG(mainCmd.getSourceFile());

        if (!result.isSuccessful()) {
            result.getError().ifPresent(error -> LOGGER.error(error.toString()));
            return true;
        }

        ControlFlowGraph graph = result.getGraph().orElseThrow();
        GraphMetrics metrics = MetricsCalculator.compute(graph);

        LOGGER.info("Nodes: " + metrics.getNodes());
        LOGGER.info("Edges: " + metrics.getEdges());
        LOGGER.info("Predicates: " + metrics.getPredicates());
        LOGGER.info("Cyclomatic Complexity: " + metrics.getCyclomaticComplexity());

        if (mainCmd.lookup()) {
            LOGGER.info("Lookup vertex: " + graph.lookUpVertex(mainCmd.getVertex())
                    .map(Object::toString).orElse("not found"));
        }

        if (CFG_COMMAND.equals(selectedCommand)) {
            File output = GraphUtils.exportCFG(graph, cfgCmd.getFormat(), cfgCmd.getOutputDir());
            LOGGER.info("Graph written to: " + output.getAbsolutePath());
        }

        return true;
    }
}
