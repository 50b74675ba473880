package de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg;

import de.uni_passau.fim.auermich.flow_graphs.core.statements.AssignmentStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ConditionalStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ExpressionStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.LoopStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.OpaqueStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.Statement;

import java.util.List;

/**
 * Routes a statement to the visit routine matching its kind.
 */
public final class StatementDispatcher {

    private StatementDispatcher() {
        throw new UnsupportedOperationException("utility class");
    }

    /**
     * Invokes the visit routine matching the type of the given statement.
     *
     * @param statement The statement to be visited.
     * @param frontier The frontier in front of the statement.
     * @param visitor The visitor extending the graph.
     * @return Returns the frontier behind the statement.
     */
    public static Frontier dispatch(final Statement statement, final Frontier frontier,
                                    final StatementVisitor visitor) {
        switch (statement.getType()) {
            case ASSIGNMENT:
                return visitor.visitAssignment((AssignmentStatement) statement, frontier);
            case EXPRESSION:
                return visitor.visitExpression((ExpressionStatement) statement, frontier);
            case CONDITIONAL:
                return visitor.visitConditional((ConditionalStatement) statement, frontier);
            case LOOP:
                return visitor.visitLoop((LoopStatement) statement, frontier);
            case OPAQUE:
                return visitor.visitOpaque((OpaqueStatement) statement, frontier);
            default:
                throw new UnsupportedOperationException("Statement type not supported yet: " + statement.getType());
        }
    }

    /**
     * Visits the given statements in order, threading the frontier from one statement to the next.
     * An empty sequence returns the given frontier unchanged.
     *
     * @param statements The statement sequence.
     * @param frontier The frontier in front of the first statement.
     * @param visitor The visitor extending the graph.
     * @return Returns the frontier behind the last statement.
     */
    public static Frontier dispatchAll(final List<Statement> statements, final Frontier frontier,
                                       final StatementVisitor visitor) {
        Frontier current = frontier;
        for (Statement statement : statements) {
            current = dispatch(statement, current, visitor);
        }
        return current;
    }
}
