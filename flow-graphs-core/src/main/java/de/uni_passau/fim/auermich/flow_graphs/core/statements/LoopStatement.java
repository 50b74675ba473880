package de.uni_passau.fim.auermich.flow_graphs.core.statements;

import java.util.List;
import java.util.Objects;

/**
 * A pre-test loop, i.e. a while loop.
 */
public class LoopStatement extends Statement {

    private final String test;

    private final List<Statement> body;

    public LoopStatement(String test, List<Statement> body) {
        super(StatementType.LOOP);
        this.test = Objects.requireNonNull(test, "Condition is mandatory!");
        this.body = List.copyOf(body);
    }

    public String getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "while " + test + ":";
    }

    @Override
    public boolean equals(Object o) {

        if (o == this)
            return true;

        if (!(o instanceof LoopStatement)) {
            return false;
        }

        LoopStatement other = (LoopStatement) o;
        return this.test.equals(other.test) && this.body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, body);
    }
}
