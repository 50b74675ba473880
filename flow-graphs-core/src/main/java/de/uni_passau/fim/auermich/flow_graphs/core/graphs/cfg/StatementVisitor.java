package de.uni_passau.fim.auermich.flow_graphs.core.graphs.cfg;

import de.uni_passau.fim.auermich.flow_graphs.core.statements.AssignmentStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ConditionalStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ExpressionStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.LoopStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.OpaqueStatement;

/**
 * Visit routines for each statement kind. Each routine receives the frontier in front of the
 * statement and returns the frontier behind it.
 */
public interface StatementVisitor {

    Frontier visitAssignment(AssignmentStatement statement, Frontier frontier);

    Frontier visitExpression(ExpressionStatement statement, Frontier frontier);

    Frontier visitConditional(ConditionalStatement statement, Frontier frontier);

    Frontier visitLoop(LoopStatement statement, Frontier frontier);

    /**
     * The fallback for any statement whose control flow is not modelled.
     */
    Frontier visitOpaque(OpaqueStatement statement, Frontier frontier);
}
