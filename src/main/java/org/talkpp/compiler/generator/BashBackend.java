package org.talkpp.compiler.generator;

import org.talkpp.compiler.tree.ComparisonOperator;
import org.talkpp.compiler.tree.LogicalOperator;

import java.util.Set;

/**
 * Bash backend. Events and responses are JSON documents handled with {@code jq}; the
 * handler reads the event from its first argument and prints the response to stdout.
 */
public final class BashBackend extends SourceRenderer {

    private static final Set<String> RESERVED = Set.of(
        "case", "coproc", "do", "done", "elif", "else", "esac", "fi", "for", "function", "if", "in", "select",
        "then", "time", "until", "while", "event");

    private static final String HEADER = """

        set -euo pipefail

        # Event:    JSON object {"data": {...}, "context": {...}} passed as the first argument
        # Response: JSON object {"success": bool, "data": {...}, "message": string} printed to stdout

        event_type() {
            jq -r '.data.type // empty' <<< "$1"
        }

        response() {
            local success="$1"
            local message="$2"
            jq -cn --argjson success "$success" --arg message "$message" \\
                '{success: $success, data: {}, message: $message}'
        }

        """;

    private static final String MAIN = """

        if [[ "${BASH_SOURCE[0]}" == "${0}" ]]; then
            handler "${1:-}"
        fi
        """;

    @Override
    public TargetLanguage language() {
        return TargetLanguage.BASH;
    }

    @Override
    public String entryPoint() {
        return "handler() {";
    }

    @Override
    protected void writeHeader(CodeWriter out, CompilerConfig config) {
        out.line("#!/usr/bin/env bash");
        out.line(comment(GENERATED_BY));
        out.block(HEADER);
    }

    @Override
    protected void writeStubDefinition(CodeWriter out, ServiceStub stub) {
        out.line(stub.functionName() + "() {")
           .indent()
           .line(comment(stub.provider() + " stub: replace with a real API call"))
           .line("return 0")
           .dedent()
           .line("}")
           .blank();
    }

    @Override
    protected void openHandler(CodeWriter out) {
        out.line(entryPoint());
    }

    @Override
    protected void writeHandlerProlog(CodeWriter out) {
        out.line("local event=\"$1\"");
        out.line("echo \"Processing event: $event\" >&2");
    }

    @Override
    protected void writeSuccessReturn(CodeWriter out) {
        out.line("response true " + quote(SUCCESS_MESSAGE));
    }

    @Override
    protected void closeHandler(CodeWriter out) {
        out.line("}");
    }

    @Override
    protected void writeFooter(CodeWriter out, CompilerConfig config) {
        out.block(MAIN);
    }

    @Override
    protected String commentPrefix() {
        return "# ";
    }

    @Override
    protected void openIf(CodeWriter out, String condition) {
        out.line("if " + condition + "; then");
    }

    @Override
    protected void elseClause(CodeWriter out) {
        out.line("else");
    }

    @Override
    protected void closeIf(CodeWriter out) {
        out.line("fi");
    }

    @Override
    protected void emptyBranch(CodeWriter out) {
        out.line(":");
    }

    @Override
    protected String eventMatch(String triggerTag) {
        return "[[ \"$(event_type \"$event\")\" == " + quote(triggerTag) + " ]]";
    }

    @Override
    protected String comparison(String left, ComparisonOperator operator, String right) {
        var symbol = switch (operator) {
            case EQUAL -> "==";
            case NOT_EQUAL -> "!=";
            case GREATER_THAN -> "-gt";
            case LESS_THAN -> "-lt";
            case GREATER_EQUAL -> "-ge";
            case LESS_EQUAL -> "-le";
        };
        return "[[ " + left + " " + symbol + " " + right + " ]]";
    }

    // Spaced parentheses: "((" would open an arithmetic expression.
    @Override
    protected String logical(String left, LogicalOperator operator, String right) {
        return "( " + left + " ) " + logicalOperator(operator) + " ( " + right + " )";
    }

    @Override
    protected String logicalOperator(LogicalOperator operator) {
        return operator == LogicalOperator.AND
               ? "&&"
               : "||";
    }

    @Override
    protected Set<String> reservedNames() {
        return RESERVED;
    }

    @Override
    protected String reference(String name) {
        return "\"${" + name + "}\"";
    }

    @Override
    protected String quote(String value) {
        var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '"' || c == '$' || c == '`') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    @Override
    protected String booleanLiteral(boolean value) {
        return Boolean.toString(value);
    }

    @Override
    protected void writeServiceCall(CodeWriter out, ServiceStub stub) {
        out.line(comment(stub.heading()))
           .line("echo " + quote(stub.progressMessage()) + " >&2")
           .line("if ! " + stub.functionName() + " \"$event\"; then")
           .indent()
           .line("echo " + quote(stub.failureMessage()) + " >&2")
           .line("response false " + quote(stub.failureMessage()))
           .line("return 1")
           .dedent()
           .line("fi");
    }

    @Override
    protected void writeWarningLog(CodeWriter out, String serviceName) {
        out.line("echo " + quote("Service " + serviceName + " not implemented") + " >&2");
    }

    @Override
    protected void bindLiteral(CodeWriter out, String variable, String literal) {
        out.line("local " + variable + "=" + literal);
    }

    @Override
    protected void bindPlaceholder(CodeWriter out, String variable, String referencedName) {
        out.line("local " + variable + "=\"\"  " + comment("bound to " + referencedName));
    }
}
