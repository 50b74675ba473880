package de.uni_passau.fim.auermich.flow_graphs.core.statements;

/**
 * A bare expression evaluated for its side effect, e.g. a method call.
 */
public class ExpressionStatement extends SequentialStatement {

    public ExpressionStatement(String text) {
        super(text, StatementType.EXPRESSION);
    }
}
