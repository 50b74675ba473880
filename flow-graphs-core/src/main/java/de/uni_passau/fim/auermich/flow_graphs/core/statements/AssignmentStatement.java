package de.uni_passau.fim.auermich.flow_graphs.core.statements;

/**
 * An assignment, e.g. {@code x = 10} or {@code int y = x + 1}.
 */
public class AssignmentStatement extends SequentialStatement {

    public AssignmentStatement(String text) {
        super(text, StatementType.ASSIGNMENT);
    }
}
