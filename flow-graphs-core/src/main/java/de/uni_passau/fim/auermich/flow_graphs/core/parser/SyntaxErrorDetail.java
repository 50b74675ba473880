package de.uni_passau.fim.auermich.flow_graphs.core.parser;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Describes why the source could not be parsed. Line and column are 1-based and refer to the
 * submitted source text, they are absent if the parser could not attribute the problem.
 */
public final class SyntaxErrorDetail {

    private final String message;
    private final int line;
    private final int column;

    public SyntaxErrorDetail(String message, int line, int column) {
        this.message = Objects.requireNonNull(message);
        this.line = line;
        this.column = column;
    }

    public SyntaxErrorDetail(String message) {
        this(message, -1, -1);
    }

    public String getMessage() {
        return message;
    }

    public OptionalInt getLine() {
        return line > 0 ? OptionalInt.of(line) : OptionalInt.empty();
    }

    public OptionalInt getColumn() {
        return column > 0 ? OptionalInt.of(column) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        if (line > 0) {
            return "Syntax Error (line " + line + ", column " + column + "): " + message;
        }
        return "Syntax Error: " + message;
    }

    @Override
    public boolean equals(Object o) {

        if (o == this)
            return true;

        if (!(o instanceof SyntaxErrorDetail)) {
            return false;
        }

        SyntaxErrorDetail other = (SyntaxErrorDetail) o;
        return this.message.equals(other.message)
                && this.line == other.line
                && this.column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, line, column);
    }
}
