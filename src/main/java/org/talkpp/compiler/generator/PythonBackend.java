package org.talkpp.compiler.generator;

import org.talkpp.compiler.tree.ComparisonOperator;
import org.talkpp.compiler.tree.LogicalOperator;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Python 3 backend: an asyncio coroutine handler with dataclass event and response types.
 */
public final class PythonBackend extends SourceRenderer {

    private static final Set<String> RESERVED = Stream.of(
        Set.of("False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
               "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import",
               "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while",
               "with", "yield"),
        Set.of("event", "logger", "asyncio", "json", "logging", "asdict", "dataclass", "field", "Any", "Dict",
               "Event", "Response", "handler"),
        stubNames(ServiceStub::functionName))
                                                      .flatMap(Set::stream)
                                                      .collect(Collectors.toUnmodifiableSet());

    private static final String HEADER = """
        import asyncio
        import json
        import logging
        from dataclasses import asdict, dataclass, field
        from typing import Any, Dict

        logging.basicConfig(level=logging.INFO)
        logger = logging.getLogger(__name__)


        @dataclass
        class Event:
            data: Dict[str, Any] = field(default_factory=dict)
            context: Dict[str, str] = field(default_factory=dict)


        @dataclass
        class Response:
            success: bool
            data: Dict[str, Any]
            message: str

            @classmethod
            def ok(cls, message: str) -> "Response":
                return cls(success=True, data={}, message=message)

            @classmethod
            def error(cls, message: str) -> "Response":
                return cls(success=False, data={}, message=message)


        """;

    private static final String MAIN = """


        if __name__ == "__main__":
            result = asyncio.run(handler(Event()))
            print(json.dumps(asdict(result), indent=2))
        """;

    @Override
    public TargetLanguage language() {
        return TargetLanguage.PYTHON;
    }

    @Override
    public String entryPoint() {
        return "async def handler(event: Event)";
    }

    @Override
    protected void writeHeader(CodeWriter out, CompilerConfig config) {
        out.line("#!/usr/bin/env python3");
        out.line(comment(GENERATED_BY));
        out.block(HEADER);
    }

    @Override
    protected void writeStubDefinition(CodeWriter out, ServiceStub stub) {
        out.line("async def " + stub.functionName() + "(event: Event) -> None:")
           .indent()
           .line(comment(stub.provider() + " stub: replace with a real API call"))
           .line("pass")
           .dedent()
           .blank()
           .blank();
    }

    @Override
    protected void openHandler(CodeWriter out) {
        out.line(entryPoint() + " -> Response:");
    }

    @Override
    protected void writeHandlerProlog(CodeWriter out) {
        out.line("logger.info(\"Processing event: %s\", event)");
    }

    @Override
    protected void writeSuccessReturn(CodeWriter out) {
        out.line("return Response.ok(" + quote(SUCCESS_MESSAGE) + ")");
    }

    @Override
    protected void closeHandler(CodeWriter out) {
        // indentation closes the function
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
        out.line("if " + condition + ":");
    }

    @Override
    protected void elseClause(CodeWriter out) {
        out.line("else:");
    }

    @Override
    protected void closeIf(CodeWriter out) {
        // indentation closes the block
    }

    @Override
    protected void emptyBranch(CodeWriter out) {
        out.line("pass");
    }

    @Override
    protected String eventMatch(String triggerTag) {
        return "event.data.get(\"type\") == " + quote(triggerTag);
    }

    @Override
    protected String comparison(String left, ComparisonOperator operator, String right) {
        return left + " " + RustBackend.cOperator(operator) + " " + right;
    }

    @Override
    protected String logicalOperator(LogicalOperator operator) {
        return operator == LogicalOperator.AND
               ? "and"
               : "or";
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
        return value
               ? "True"
               : "False";
    }

    @Override
    protected void writeServiceCall(CodeWriter out, ServiceStub stub) {
        out.line(comment(stub.heading()))
           .line("logger.info(" + quote(stub.progressMessage()) + ")")
           .line("try:")
           .indent()
           .line("await " + stub.functionName() + "(event)")
           .dedent()
           .line("except Exception as e:")
           .indent()
           .line("logger.error(" + quote(stub.failureMessage() + ": %s") + ", e)")
           .line("return Response.error(" + quote(stub.failureMessage()) + ")")
           .dedent();
    }

    @Override
    protected void writeWarningLog(CodeWriter out, String serviceName) {
        out.line("logger.warning(\"Service %s not implemented\", " + quote(serviceName) + ")");
    }

    @Override
    protected void bindLiteral(CodeWriter out, String variable, String literal) {
        out.line(variable + " = " + literal);
    }

    @Override
    protected void bindPlaceholder(CodeWriter out, String variable, String referencedName) {
        out.line(variable + " = None  " + comment("bound to " + referencedName));
    }
}
