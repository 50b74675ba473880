package de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg;

import de.uni_passau.fim.auermich.flow_graphs.core.graphs.ControlFlowGraph;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowEdge;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.FlowVertex;
import de.uni_passau.fim.auermich.flow_graphs.core.graphs.VertexRole;
import de.uni_passau.fim.auermich.flow_graphs.core.parser.SourceParser;
import de.uni_passau.fim.auermich.flow_graphs.core.parser.SourceSyntaxException;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.AssignmentStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ConditionalStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ExpressionStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.LoopStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.OpaqueStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.SequentialStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.Statement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Constructs the control flow graph of a statement sequence. The graph is bracketed by a START and a
 * STOP vertex, every statement contributes a single vertex, branches and loops contribute a predicate
 * vertex each.
 *
 * A builder performs exactly one build, use a fresh instance for each input. Builders share no state,
 * thus independent builds may run concurrently.
 */
public class ControlFlowGraphBuilder implements StatementVisitor {

    private static final Logger LOGGER = LogManager.getLogger(ControlFlowGraphBuilder.class);

    private final SourceParser parser;

    private final ControlFlowGraph graph = new ControlFlowGraph();

    private boolean used = false;

    public ControlFlowGraphBuilder() {
        this(new SourceParser());
    }

    public ControlFlowGraphBuilder(SourceParser parser) {
        this.parser = parser;
    }

    /**
     * Parses the given source and constructs its control flow graph. If the source is malformed,
     * no vertex is created and the result carries the syntax error.
     *
     * @param source A sequence of Java statements.
     * @return Returns either the graph or the syntax error.
     */
    public BuildResult build(final String source) {

        final List<Statement> statements;

        try {
            statements = parser.parse(source);
        } catch (SourceSyntaxException e) {
            LOGGER.warn(e.getDetail());
            return BuildResult.failure(e.getDetail());
        }

        return BuildResult.success(build(statements));
    }

    /**
     * Constructs the control flow graph of an already parsed statement sequence.
     *
     * @param statements The top-level statements in source order.
     * @return Returns the finished graph.
     */
    public ControlFlowGraph build(final List<Statement> statements) {

        if (used) {
            throw new IllegalStateException("Builder already used, create a new builder for each build!");
        }
        used = true;

        LOGGER.debug("Constructing CFG for " + statements.size() + " top-level statements.");

        FlowVertex start = graph.addVertex("START", VertexRole.START);
        Frontier frontier = StatementDispatcher.dispatchAll(statements, Frontier.of(start), this);

        FlowVertex stop = graph.addVertex("STOP", VertexRole.STOP);
        connect(frontier, stop);

        LOGGER.debug("CFG has " + graph.size() + " vertices and " + graph.edgeCount() + " edges.");
        return graph;
    }

    @Override
    public Frontier visitAssignment(final AssignmentStatement statement, final Frontier frontier) {
        return visitSequential(statement, frontier);
    }

    @Override
    public Frontier visitExpression(final ExpressionStatement statement, final Frontier frontier) {
        return visitSequential(statement, frontier);
    }

    @Override
    public Frontier visitOpaque(final OpaqueStatement statement, final Frontier frontier) {
        return visitSequential(statement, frontier);
    }

    /**
     * A sequential statement is reached from every frontier vertex and is the only vertex
     * control falls through afterwards.
     */
    private Frontier visitSequential(final SequentialStatement statement, final Frontier frontier) {
        FlowVertex vertex = graph.addVertex(statement.getText(), VertexRole.STATEMENT);
        connect(frontier, vertex);
        return Frontier.of(vertex);
    }

    /**
     * Both branches start at the predicate. Without an else branch, control falls through the
     * predicate itself. The merged frontier lists the exits of the true branch first.
     */
    @Override
    public Frontier visitConditional(final ConditionalStatement statement, final Frontier frontier) {

        FlowVertex predicate = graph.addVertex(statement.toString(), VertexRole.BRANCH);
        connect(frontier, predicate);

        Frontier trueExits = StatementDispatcher.dispatchAll(statement.getBody(), Frontier.of(predicate), this);

        Frontier falseExits = statement.hasElseBranch()
                ? StatementDispatcher.dispatchAll(statement.getOrElse(), Frontier.of(predicate), this)
                : Frontier.of(predicate);

        return trueExits.union(falseExits);
    }

    /**
     * The body exits are connected back to the predicate. The loop is only left through the predicate.
     */
    @Override
    public Frontier visitLoop(final LoopStatement statement, final Frontier frontier) {

        FlowVertex predicate = graph.addVertex(statement.toString(), VertexRole.LOOP);
        connect(frontier, predicate);

        Frontier bodyExits = StatementDispatcher.dispatchAll(statement.getBody(), Frontier.of(predicate), this);

        for (FlowVertex exit : bodyExits) {
            graph.addEdge(exit, predicate, FlowEdge.LOOP_LABEL);
        }

        return Frontier.of(predicate);
    }

    private void connect(final Frontier frontier, final FlowVertex target) {
        for (FlowVertex source : frontier) {
            graph.addEdge(source, target);
        }
    }
}
