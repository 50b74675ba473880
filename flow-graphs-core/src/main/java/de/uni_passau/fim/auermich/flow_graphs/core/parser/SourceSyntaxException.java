package de.uni_passau.fim.auermich.flow_graphs.core.parser;

/**
 * Thrown by the {@link SourceParser} if the source text is malformed.
 */
public class SourceSyntaxException extends Exception {

    private final SyntaxErrorDetail detail;

    public SourceSyntaxException(SyntaxErrorDetail detail) {
        super(detail.toString());
        this.detail = detail;
    }

    public SyntaxErrorDetail getDetail() {
        return detail;
    }
}
