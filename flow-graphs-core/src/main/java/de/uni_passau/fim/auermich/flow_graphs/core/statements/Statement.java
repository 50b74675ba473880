package de.uni_passau.fim.auermich.flow_graphs.core.statements;

import java.util.Objects;

/**
 * A statement of the analysed program. The set of statement kinds is closed, see {@link StatementType}.
 */
public abstract class Statement {

    // the statement type
    protected final StatementType type;

    protected Statement(StatementType type) {
        this.type = Objects.requireNonNull(type, "Statement type is mandatory!");
    }

    public StatementType getType() {
        return type;
    }

    /**
     * Whether the statement is represented by a single vertex without any branching, i.e. an assignment,
     * an expression statement or an opaque statement.
     *
     * @return Returns {@code true} if the statement is sequential, otherwise {@code false}.
     */
    public boolean isSequential() {
        return type == StatementType.ASSIGNMENT
                || type == StatementType.EXPRESSION
                || type == StatementType.OPAQUE;
    }

    public abstract String toString();

    public abstract boolean equals(Object o);

    public abstract int hashCode();

    public enum StatementType {
        ASSIGNMENT,
        EXPRESSION,
        CONDITIONAL,
        LOOP,
        // anything else the front end hands over, e.g. for, switch, return, break
        OPAQUE;
    }
}
