package org.talkpp.compiler.generator;

import org.talkpp.compiler.tree.ComparisonOperator;
import org.talkpp.compiler.tree.LogicalOperator;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JavaScript (Node.js) backend: an async function handler with JSDoc type declarations,
 * exported through CommonJS.
 */
public class JavaScriptBackend extends SourceRenderer {

    // Strict-mode reserved words plus the names the header and stubs declare
    private static final Set<String> RESERVED = Stream.of(
        Set.of("arguments", "await", "break", "case", "catch", "class", "const", "continue", "debugger",
               "default", "delete", "do", "else", "enum", "eval", "export", "extends", "false", "finally",
               "for", "function", "if", "implements", "import", "in", "instanceof", "interface", "let", "new",
               "null", "package", "private", "protected", "public", "return", "static", "super", "switch",
               "this", "throw", "true", "try", "typeof", "undefined", "var", "void", "while", "with", "yield"),
        Set.of("event", "successResponse", "errorResponse", "handler", "module", "console"),
        stubNames(ServiceStub::camelFunctionName))
                                                      .flatMap(Set::stream)
                                                      .collect(Collectors.toUnmodifiableSet());

    private static final String HEADER = """
        'use strict';

        /**
         * @typedef {Object} Event
         * @property {Object} data
         * @property {Object<string, string>} context
         */

        /**
         * @typedef {Object} Response
         * @property {boolean} success
         * @property {Object} data
         * @property {string} message
         */

        function successResponse(message) {
            return { success: true, data: {}, message };
        }

        function errorResponse(message) {
            return { success: false, data: {}, message };
        }

        """;

    private static final String EXPORTS = """

        if (typeof module !== 'undefined' && module.exports) {
            module.exports = { handler };
        }
        """;

    @Override
    public TargetLanguage language() {
        return TargetLanguage.JAVASCRIPT;
    }

    @Override
    public String entryPoint() {
        return "async function handler(event)";
    }

    @Override
    protected void writeHeader(CodeWriter out, CompilerConfig config) {
        out.line(comment(GENERATED_BY));
        out.block(HEADER);
    }

    @Override
    protected void writeStubDefinition(CodeWriter out, ServiceStub stub) {
        out.line("async function " + stub.camelFunctionName() + "(event) {")
           .indent()
           .line(comment(stub.provider() + " stub: replace with a real API call"))
           .dedent()
           .line("}")
           .blank();
    }

    @Override
    protected void openHandler(CodeWriter out) {
        out.line("/**")
           .line(" * @param {Event} event")
           .line(" * @returns {Promise<Response>}")
           .line(" */")
           .line(entryPoint() + " {");
    }

    @Override
    protected void writeHandlerProlog(CodeWriter out) {
        out.line("console.log(\"Processing event:\", event);");
    }

    @Override
    protected void writeSuccessReturn(CodeWriter out) {
        out.line("return successResponse(" + quote(SUCCESS_MESSAGE) + ");");
    }

    @Override
    protected void closeHandler(CodeWriter out) {
        out.line("}");
    }

    @Override
    protected void writeFooter(CodeWriter out, CompilerConfig config) {
        out.block(EXPORTS);
    }

    @Override
    protected String commentPrefix() {
        return "// ";
    }

    @Override
    protected void openIf(CodeWriter out, String condition) {
        out.line("if (" + condition + ") {");
    }

    @Override
    protected void elseClause(CodeWriter out) {
        out.line("} else {");
    }

    @Override
    protected void closeIf(CodeWriter out) {
        out.line("}");
    }

    @Override
    protected void emptyBranch(CodeWriter out) {
        out.line(comment("no actions"));
    }

    @Override
    protected String eventMatch(String triggerTag) {
        return "event.data?.type === " + quote(triggerTag);
    }

    @Override
    protected String comparison(String left, ComparisonOperator operator, String right) {
        var symbol = switch (operator) {
            case EQUAL -> "===";
            case NOT_EQUAL -> "!==";
            default -> RustBackend.cOperator(operator);
        };
        return left + " " + symbol + " " + right;
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
        return name;
    }

    @Override
    protected String quote(String value) {
        return quoteCStyle(value);
    }

    @Override
    protected String booleanLiteral(boolean value) {
        return Boolean.toString(value);
    }

    @Override
    protected void writeServiceCall(CodeWriter out, ServiceStub stub) {
        out.line(comment(stub.heading()))
           .line("console.info(" + quote(stub.progressMessage()) + ");")
           .line("try {")
           .indent()
           .line("await " + stub.camelFunctionName() + "(event);")
           .dedent()
           .line("} catch (e) {")
           .indent()
           .line("console.error(" + quote(stub.failureMessage() + ":") + ", e);")
           .line("return errorResponse(" + quote(stub.failureMessage()) + ");")
           .dedent()
           .line("}");
    }

    @Override
    protected void writeWarningLog(CodeWriter out, String serviceName) {
        out.line("console.warn(" + quote("Service " + serviceName + " not implemented") + ");");
    }

    @Override
    protected void bindLiteral(CodeWriter out, String variable, String literal) {
        out.line("let " + variable + " = " + literal + ";");
    }

    @Override
    protected void bindPlaceholder(CodeWriter out, String variable, String referencedName) {
        out.line("let " + variable + "; " + comment("bound to " + referencedName));
    }
}
