package org.talkpp.compiler.generator;

import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.tree.Action;
import org.talkpp.compiler.tree.ActionStatement;
import org.talkpp.compiler.tree.AssignmentStatement;
import org.talkpp.compiler.tree.ComparisonOperator;
import org.talkpp.compiler.tree.Condition;
import org.talkpp.compiler.tree.ConditionalStatement;
import org.talkpp.compiler.tree.Expression;
import org.talkpp.compiler.tree.LogicalOperator;
import org.talkpp.compiler.tree.Program;
import org.talkpp.compiler.tree.Statement;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Shared traversal for all backends. The statement-to-snippet mapping lives here so every
 * target renders the same semantics; subclasses supply the surface syntax.
 *
 * <p>Output layout: header (preamble and type declarations), stub definitions for the
 * referenced services in registry order, the handler, footer.
 */
abstract class SourceRenderer implements TargetBackend {

    static final String GENERATED_BY = "Generated by the Talk++ compiler";
    static final String SUCCESS_MESSAGE = "Function executed successfully";

    @Override
    public final String render(Program program, CompilerConfig config) throws CompilationException {
        var out = new CodeWriter();

        writeHeader(out, config);
        for (var stub : referencedStubs(program)) {
            writeStubDefinition(out, stub);
        }

        openHandler(out);
        out.indent();
        writeHandlerProlog(out);
        for (var statement : program.statements()) {
            writeStatement(out, statement);
        }
        writeSuccessReturn(out);
        out.dedent();
        closeHandler(out);

        writeFooter(out, config);
        return out.toString();
    }

    // === Surface syntax supplied by each target ===

    protected abstract void writeHeader(CodeWriter out, CompilerConfig config);

    protected abstract void writeStubDefinition(CodeWriter out, ServiceStub stub);

    protected abstract void openHandler(CodeWriter out);

    protected abstract void writeHandlerProlog(CodeWriter out);

    protected abstract void writeSuccessReturn(CodeWriter out);

    protected abstract void closeHandler(CodeWriter out);

    protected abstract void writeFooter(CodeWriter out, CompilerConfig config);

    protected abstract String commentPrefix();

    protected abstract void openIf(CodeWriter out, String condition);

    protected abstract void elseClause(CodeWriter out);

    protected abstract void closeIf(CodeWriter out);

    protected abstract void emptyBranch(CodeWriter out);

    /**
     * Test of the incoming event's type field against a trigger tag.
     */
    protected abstract String eventMatch(String triggerTag);

    protected abstract String comparison(String left, ComparisonOperator operator, String right);

    protected abstract String logicalOperator(LogicalOperator operator);

    /**
     * Names the generated code cannot use as a local variable: target keywords, the handler
     * parameter and the helpers and stubs the header declares.
     */
    protected abstract Set<String> reservedNames();

    protected abstract String reference(String name);

    protected abstract String quote(String value);

    protected abstract String booleanLiteral(boolean value);

    /**
     * Stub invocation followed by an early return of a failure response when it fails.
     */
    protected abstract void writeServiceCall(CodeWriter out, ServiceStub stub);

    protected abstract void writeWarningLog(CodeWriter out, String serviceName);

    protected abstract void bindLiteral(CodeWriter out, String variable, String literal);

    /**
     * Uninitialized binding for a value that refers to another name; nothing is evaluated.
     */
    protected abstract void bindPlaceholder(CodeWriter out, String variable, String referencedName);

    // === Overridable defaults ===

    protected String logical(String left, LogicalOperator operator, String right) {
        return "(" + left + ") " + logicalOperator(operator) + " (" + right + ")";
    }

    protected String integerLiteral(long value) {
        return Long.toString(value);
    }

    protected String floatLiteral(double value) {
        return Double.toString(value);
    }

    /**
     * Local variable name for a source identifier; reserved names get a trailing underscore.
     */
    protected String variableName(String name) {
        return reservedNames().contains(name)
               ? name + "_"
               : name;
    }

    protected String comment(String text) {
        return commentPrefix() + text.replaceAll("\\R", " ");
    }

    // === Statement mapping ===

    private void writeStatement(CodeWriter out, Statement statement) throws CompilationException {
        if (statement instanceof Statement.Conditional conditional) {
            writeConditional(out, conditional.statement());
        } else if (statement instanceof Statement.Action action) {
            writeAction(out, action.statement());
        } else if (statement instanceof Statement.Assignment assignment) {
            writeAssignment(out, assignment.statement());
        } else if (statement instanceof Statement.Comment comment) {
            for (var line : comment.text().split("\\R")) {
                out.line(comment(line));
            }
        } else {
            throw CompilationException.internal("Unknown statement kind: " + statement.getClass().getSimpleName());
        }
    }

    private void writeConditional(CodeWriter out, ConditionalStatement conditional) throws CompilationException {
        openIf(out, condition(conditional.condition()));
        writeBranch(out, conditional.thenActions());
        if (conditional.elseActions().isPresent()) {
            elseClause(out);
            writeBranch(out, conditional.elseActions().get());
        }
        closeIf(out);
    }

    private void writeBranch(CodeWriter out, List<ActionStatement> actions) throws CompilationException {
        out.indent();
        if (actions.isEmpty()) {
            emptyBranch(out);
        }
        for (var action : actions) {
            writeAction(out, action);
        }
        out.dedent();
    }

    private String condition(Condition condition) throws CompilationException {
        if (condition instanceof Condition.Event event) {
            return eventMatch(event.triggerTag());
        }
        if (condition instanceof Condition.Comparison comparison) {
            return comparison(operand(comparison.left()), comparison.operator(), operand(comparison.right()));
        }
        if (condition instanceof Condition.Logical logical) {
            return logical(condition(logical.left()), logical.operator(), condition(logical.right()));
        }
        throw CompilationException.internal("Unknown condition kind: " + condition.getClass().getSimpleName());
    }

    private void writeAction(CodeWriter out, ActionStatement action) throws CompilationException {
        if (action.service().isEmpty()) {
            out.line(comment(placeholderText(action)));
            return;
        }
        var serviceName = action.service().get().name();
        var stub = ServiceStub.forService(serviceName);
        if (stub.isPresent()) {
            writeServiceCall(out, stub.get());
        } else {
            out.line(comment("WARNING: Service '" + serviceName + "' is not implemented"));
            writeWarningLog(out, serviceName);
        }
    }

    private String placeholderText(ActionStatement action) throws CompilationException {
        var text = action.action() instanceof Action.Custom custom
                   ? "Custom action: " + custom.name()
                   : capitalize(action.action().word()) + " action";
        if (action.target().isPresent()) {
            text += " (target: " + describe(action.target().get()) + ")";
        }
        return text;
    }

    private void writeAssignment(CodeWriter out, AssignmentStatement assignment) throws CompilationException {
        var value = assignment.value();
        var variable = variableName(assignment.variable());
        if (value.isLiteral()) {
            bindLiteral(out, variable, literal(value));
        } else if (value instanceof Expression.Identifier identifier) {
            bindPlaceholder(out, variable, identifier.name());
        } else {
            throw unsupported(value);
        }
    }

    // === Expressions ===

    private String operand(Expression expression) throws CompilationException {
        if (expression instanceof Expression.Identifier identifier) {
            return reference(variableName(identifier.name()));
        }
        return literal(expression);
    }

    private String literal(Expression expression) throws CompilationException {
        if (expression instanceof Expression.StringLiteral string) {
            return quote(string.value());
        }
        if (expression instanceof Expression.IntegerLiteral integer) {
            return integerLiteral(integer.value());
        }
        if (expression instanceof Expression.FloatLiteral number) {
            return floatLiteral(number.value());
        }
        if (expression instanceof Expression.BooleanLiteral bool) {
            return booleanLiteral(bool.value());
        }
        throw unsupported(expression);
    }

    private String describe(Expression expression) throws CompilationException {
        if (expression instanceof Expression.Identifier identifier) {
            return identifier.name();
        }
        if (expression instanceof Expression.StringLiteral string) {
            return "\"" + string.value() + "\"";
        }
        return literal(expression);
    }

    private static CompilationException unsupported(Expression expression) {
        if (expression instanceof Expression.Property) {
            return CompilationException.unsupported("property access expression");
        }
        if (expression instanceof Expression.FunctionCall call) {
            return CompilationException.unsupported("function call expression '" + call.name() + "'");
        }
        return CompilationException.codegen("Unexpected expression kind: " + expression.getClass().getSimpleName());
    }

    // === Helpers ===

    private static Set<ServiceStub> referencedStubs(Program program) {
        var stubs = EnumSet.noneOf(ServiceStub.class);
        for (var statement : program.statements()) {
            if (statement instanceof Statement.Action action) {
                collectStub(action.statement(), stubs);
            } else if (statement instanceof Statement.Conditional conditional) {
                conditional.statement().thenActions().forEach(action -> collectStub(action, stubs));
                conditional.statement().elseActions()
                           .ifPresent(actions -> actions.forEach(action -> collectStub(action, stubs)));
            }
        }
        return stubs;
    }

    private static void collectStub(ActionStatement action, Set<ServiceStub> stubs) {
        action.service()
              .flatMap(service -> ServiceStub.forService(service.name()))
              .ifPresent(stubs::add);
    }

    /**
     * C-family string literal: double quotes with backslash escapes.
     */
    static String quoteCStyle(String value) {
        var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\0' -> sb.append("\\x00");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Stub function names in the given naming style, for {@link #reservedNames()}.
     */
    static Set<String> stubNames(Function<ServiceStub, String> naming) {
        return Arrays.stream(ServiceStub.values())
                     .map(naming)
                     .collect(Collectors.toUnmodifiableSet());
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1);
    }
}
