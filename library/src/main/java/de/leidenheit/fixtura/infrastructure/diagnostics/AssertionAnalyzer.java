package de.leidenheit.fixtura.infrastructure.diagnostics;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.Statement;
import de.leidenheit.fixtura.infrastructure.io.OutputSink;
import lombok.extern.slf4j.Slf4j;
import org.opentest4j.AssertionFailedError;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Best effort breakdown of a failed assertion into its compared operands.
 *
 * <p>Locates the failing source line below the configured source roots, parses the enclosing assert
 * statement and, when it compares the result of a method call with something else, prints both sides.
 * Values are only shown when the assertion error carries them; expressions are never re-evaluated.
 * Every problem along the way ends the analysis without output.
 */
@Slf4j
public class AssertionAnalyzer {

    private static final int MAX_STATEMENT_LINES = 20;
    private static final Set<String> EQUALITY_ASSERTIONS = Set.of(
            "assertEquals", "assertNotEquals", "assertSame", "assertNotSame", "assertArrayEquals");
    private static final Set<String> FLUENT_COMPARISONS = Set.of(
            "isEqualTo", "isNotEqualTo", "isSameAs", "isNotSameAs",
            "isGreaterThan", "isGreaterThanOrEqualTo", "isLessThan", "isLessThanOrEqualTo");

    private final JavaParser parser = new JavaParser();
    private final List<Path> sourceRoots;

    public AssertionAnalyzer(final List<String> sourceRoots) {
        this.sourceRoots = sourceRoots.stream().map(Path::of).toList();
    }

    public void analyze(final AssertionError error, final OutputSink sink) {
        try {
            findComponents(error).ifPresent(components -> print(components, error, sink));
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to analyze assert statement", e);
        }
    }

    Optional<Components> findComponents(final AssertionError error) throws IOException {
        for (StackTraceElement frame : error.getStackTrace()) {
            var source = locate(frame);
            if (source.isPresent()) {
                var statement = readStatement(Files.readAllLines(source.get()), frame.getLineNumber() - 1);
                return statement.flatMap(this::parse).flatMap(AssertionAnalyzer::components);
            }
        }
        log.debug("No source found for assertion frames of {}", error.toString());
        return Optional.empty();
    }

    private Optional<Path> locate(final StackTraceElement frame) {
        if (frame.getFileName() == null || frame.getLineNumber() <= 0) return Optional.empty();

        var className = frame.getClassName();
        var packageName = className.lastIndexOf('.') < 0 ? "" : className.substring(0, className.lastIndexOf('.'));
        var relative = packageName.isEmpty()
                ? Path.of(frame.getFileName())
                : Path.of(packageName.replace('.', '/'), frame.getFileName());
        return sourceRoots.stream()
                .map(root -> root.resolve(relative))
                .filter(Files::isRegularFile)
                .findFirst();
    }

    /**
     * Walks back from the failing line to the line the assert statement starts on, then forward to its end.
     */
    static Optional<String> readStatement(final List<String> lines, final int failingLine) {
        if (failingLine < 0 || failingLine >= lines.size()) return Optional.empty();

        int start = failingLine;
        while (!lines.get(start).strip().startsWith("assert")) {
            start--;
            if (start < 0 || failingLine - start > MAX_STATEMENT_LINES) return Optional.empty();
        }
        var statement = new StringBuilder();
        for (int i = start; i < lines.size() && i - start <= MAX_STATEMENT_LINES; i++) {
            statement.append(lines.get(i).strip()).append('\n');
            if (lines.get(i).strip().endsWith(";")) {
                return Optional.of(statement.toString());
            }
        }
        return Optional.empty();
    }

    private Optional<Statement> parse(final String statement) {
        ParseResult<Statement> result = parser.parseStatement(statement);
        if (!result.isSuccessful()) {
            log.debug("Failed to analyze assert statement: {}", result.getProblems());
            return Optional.empty();
        }
        return result.getResult();
    }

    static Optional<Components> components(final Statement statement) {
        if (statement.isAssertStmt()) {
            var check = statement.asAssertStmt().getCheck();
            if (check.isBinaryExpr()) {
                BinaryExpr comparison = check.asBinaryExpr();
                if (comparison.getLeft().isMethodCallExpr()) {
                    return Optional.of(new Components(comparison.getLeft(), comparison.getRight()));
                }
            }
            return Optional.empty();
        }
        if (!statement.isExpressionStmt() || !statement.asExpressionStmt().getExpression().isMethodCallExpr()) {
            return Optional.empty();
        }

        MethodCallExpr call = statement.asExpressionStmt().getExpression().asMethodCallExpr();
        if (EQUALITY_ASSERTIONS.contains(call.getNameAsString()) && call.getArguments().size() >= 2) {
            // expected comes first, the computed value second
            var actual = call.getArgument(1);
            return actual.isMethodCallExpr()
                    ? Optional.of(new Components(actual, call.getArgument(0)))
                    : Optional.empty();
        }
        if (FLUENT_COMPARISONS.contains(call.getNameAsString()) && call.getArguments().size() == 1) {
            return call.getScope()
                    .filter(Expression::isMethodCallExpr)
                    .map(Expression::asMethodCallExpr)
                    .filter(scope -> scope.getNameAsString().equals("assertThat") && scope.getArguments().size() == 1)
                    .map(scope -> scope.getArgument(0))
                    .filter(Expression::isMethodCallExpr)
                    .map(left -> new Components(left, call.getArgument(0)));
        }
        return Optional.empty();
    }

    private static void print(final Components components, final AssertionError error, final OutputSink sink) {
        sink.println();
        sink.println("--- Assert components ---");
        sink.println("left:");
        sink.println("   " + components.left());
        sink.println("right:");
        sink.println("   " + components.right());
        if (error instanceof AssertionFailedError failed) {
            if (failed.isActualDefined()) {
                sink.println("actual value:");
                sink.println("   " + failed.getActual().getStringRepresentation());
            }
            if (failed.isExpectedDefined()) {
                sink.println("expected value:");
                sink.println("   " + failed.getExpected().getStringRepresentation());
            }
        }
    }

    record Components(Expression left, Expression right) {
    }
}
