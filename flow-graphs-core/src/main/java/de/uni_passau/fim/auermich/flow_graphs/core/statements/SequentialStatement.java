package de.uni_passau.fim.auermich.flow_graphs.core.statements;

import java.util.Objects;

/**
 * Common base of the statements that occupy exactly one vertex. Those statements
 * solely carry their rendered source text.
 */
public abstract class SequentialStatement extends Statement {

    private final String text;

    protected SequentialStatement(String text, StatementType type) {
        super(type);
        this.text = Objects.requireNonNull(text, "Statement text is mandatory!");
    }

    /**
     * Returns the rendered source text, which is used as the vertex label.
     *
     * @return Returns the source text of the statement.
     */
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }

    @Override
    public boolean equals(Object o) {

        if (o == this)
            return true;

        if (o == null || o.getClass() != this.getClass()) {
            return false;
        }

        SequentialStatement other = (SequentialStatement) o;
        return this.type == other.type && this.text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }
}
