package de.uni_passau.fim.auermich.flow_graphs.core.statements;

/**
 * A statement whose control flow is not modelled. It is threaded through the graph like
 * an assignment and labeled with its pretty printed source. This includes early exits like
 * {@code break} or {@code return}, which therefore don't alter the flow.
 */
public class OpaqueStatement extends SequentialStatement {

    public OpaqueStatement(String text) {
        super(text, StatementType.OPAQUE);
    }
}
