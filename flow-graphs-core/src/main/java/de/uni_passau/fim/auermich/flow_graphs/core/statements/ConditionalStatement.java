package de.uni_passau.fim.auermich.flow_graphs.core.statements;

import java.util.List;
import java.util.Objects;

/**
 * An if statement. An else-if chain is represented by a nested conditional being
 * the only statement of the else branch.
 */
public class ConditionalStatement extends Statement {

    private final String test;

    private final List<Statement> body;

    // empty if there is no else branch
    private final List<Statement> orElse;

    public ConditionalStatement(String test, List<Statement> body, List<Statement> orElse) {
        super(StatementType.CONDITIONAL);
        this.test = Objects.requireNonNull(test, "Condition is mandatory!");
        this.body = List.copyOf(body);
        this.orElse = List.copyOf(orElse);
    }

    public ConditionalStatement(String test, List<Statement> body) {
        this(test, body, List.of());
    }

    public String getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public boolean hasElseBranch() {
        return !orElse.isEmpty();
    }

    @Override
    public String toString() {
        return "if " + test + ":";
    }

    @Override
    public boolean equals(Object o) {

        if (o == this)
            return true;

        if (!(o instanceof ConditionalStatement)) {
            return false;
        }

        ConditionalStatement other = (ConditionalStatement) o;
        return this.test.equals(other.test)
                && this.body.equals(other.body)
                && this.orElse.equals(other.orElse);
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, body, orElse);
    }
}
