package de.uni_passau.fim.auermich.flow_graphs.core.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.AssignmentStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ConditionalStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.ExpressionStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.LoopStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.OpaqueStatement;
import de.uni_passau.fim.auermich.flow_graphs.core.statements.Statement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parses a sequence of Java statements, e.g. the body of a method without the surrounding braces,
 * and translates the JavaParser AST into the statement model consumed by the CFG builder.
 */
public class SourceParser {

    private static final Logger LOGGER = LogManager.getLogger(SourceParser.class);

    // the source is wrapped into a block, the opening brace occupies its own line
    private static final String BLOCK_PREFIX = "{\n";
    private static final String BLOCK_SUFFIX = "\n}";

    private final JavaParser parser;

    public SourceParser() {
        // comments must not end up in the vertex labels
        ParserConfiguration config = new ParserConfiguration()
                .setAttributeComments(false)
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        parser = new JavaParser(config);
    }

    /**
     * Parses the given source text.
     *
     * @param source A sequence of Java statements.
     * @return Returns the top-level statements in source order.
     * @throws SourceSyntaxException If the source is malformed.
     */
    public List<Statement> parse(final String source) throws SourceSyntaxException {

        ParseResult<BlockStmt> result = parser.parseBlock(BLOCK_PREFIX + source + BLOCK_SUFFIX);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            SyntaxErrorDetail detail = toErrorDetail(source, result.getProblems());
            LOGGER.debug("Parsing failed: " + detail);
            throw new SourceSyntaxException(detail);
        }

        List<Statement> statements = translate(result.getResult().get().getStatements());
        LOGGER.debug("Parsed " + statements.size() + " top-level statements.");
        return statements;
    }

    /**
     * Translates a sequence of JavaParser statements. Nested blocks are flattened into the enclosing sequence.
     *
     * @param statements The statements to be translated.
     * @return Returns the translated statements in source order.
     */
    private List<Statement> translate(final NodeList<com.github.javaparser.ast.stmt.Statement> statements) {
        List<Statement> translated = new ArrayList<>();
        for (com.github.javaparser.ast.stmt.Statement statement : statements) {
            translate(statement, translated);
        }
        return translated;
    }

    private void translate(final com.github.javaparser.ast.stmt.Statement statement, final List<Statement> out) {

        if (statement.isBlockStmt()) {
            out.addAll(translate(statement.asBlockStmt().getStatements()));
        } else if (statement.isLabeledStmt()) {
            // the label is only a jump target, the labeled statement keeps its own control flow
            translate(statement.asLabeledStmt().getStatement(), out);
        } else if (statement.isExpressionStmt()) {
            out.add(translateExpression(statement.asExpressionStmt().getExpression()));
        } else if (statement.isIfStmt()) {
            IfStmt ifStmt = statement.asIfStmt();
            List<Statement> body = toSequence(ifStmt.getThenStmt());
            List<Statement> orElse = ifStmt.getElseStmt().map(this::toSequence).orElse(List.of());
            out.add(new ConditionalStatement(ifStmt.getCondition().toString(), body, orElse));
        } else if (statement.isWhileStmt()) {
            WhileStmt whileStmt = statement.asWhileStmt();
            out.add(new LoopStatement(whileStmt.getCondition().toString(), toSequence(whileStmt.getBody())));
        } else {
            LOGGER.debug("Statement kind not modelled, using opaque statement: " + statement.getClass().getSimpleName());
            out.add(new OpaqueStatement(statement.toString()));
        }
    }

    private Statement translateExpression(final Expression expression) {

        if (expression.isAssignExpr()) {
            return new AssignmentStatement(expression.toString());
        }

        if (expression.isVariableDeclarationExpr()) {
            VariableDeclarationExpr declaration = expression.asVariableDeclarationExpr();
            boolean initialized = declaration.getVariables().stream()
                    .allMatch(variable -> variable.getInitializer().isPresent());
            // a declaration without initializer doesn't assign anything
            return initialized
                    ? new AssignmentStatement(expression.toString())
                    : new OpaqueStatement(expression.toString());
        }

        return new ExpressionStatement(expression.toString());
    }

    /**
     * Converts the body of a branch or loop into a statement sequence. A body without braces
     * is a sequence of one statement.
     */
    private List<Statement> toSequence(final com.github.javaparser.ast.stmt.Statement body) {
        List<Statement> sequence = new ArrayList<>();
        translate(body, sequence);
        return sequence;
    }

    /**
     * Converts the parse problems into a single error detail. The location is taken from
     * the first problem and mapped back onto the submitted source.
     *
     * @param source The submitted source text.
     * @param problems The reported parse problems.
     * @return Returns the error detail.
     */
    private static SyntaxErrorDetail toErrorDetail(final String source, final List<Problem> problems) {

        if (problems.isEmpty()) {
            return new SyntaxErrorDetail("Unknown parse error");
        }

        String message = problems.stream().map(Problem::getMessage).collect(Collectors.joining("; "));

        Optional<Position> position = problems.get(0).getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> range.begin);

        if (position.isEmpty()) {
            return new SyntaxErrorDetail(message);
        }

        String[] lines = source.split("\n", -1);
        int line = position.get().line - 1;
        int column = position.get().column;

        if (line < 1) {
            line = 1;
            column = 1;
        } else if (line > lines.length) {
            // the problem was detected at the closing brace of the wrapper, i.e. at the end of the source
            line = lines.length;
            column = lines[lines.length - 1].length() + 1;
        }

        return new SyntaxErrorDetail(message, line, column);
    }
}
