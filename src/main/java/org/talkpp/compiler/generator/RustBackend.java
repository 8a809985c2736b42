package org.talkpp.compiler.generator;

import org.talkpp.compiler.tree.ComparisonOperator;
import org.talkpp.compiler.tree.LogicalOperator;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Systems-style backend: an async Rust handler built on anyhow, serde, tokio and tracing.
 * In debug mode a {@code #[tokio::main]} bootstrap is appended.
 */
public final class RustBackend extends SourceRenderer {

    // Keywords usable as raw identifiers (r#type)
    private static final Set<String> KEYWORDS = Set.of(
        "as", "async", "await", "break", "const", "continue", "dyn", "else", "enum", "extern", "false",
        "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref",
        "return", "static", "struct", "trait", "true", "try", "type", "unsafe", "use", "where", "while",
        "abstract", "become", "box", "do", "final", "macro", "override", "priv", "typeof", "unsized",
        "virtual", "yield");

    private static final Set<String> RESERVED = Stream.of(Set.of("crate", "self", "Self", "super", "_", "event"),
                                                          stubNames(ServiceStub::functionName))
                                                      .flatMap(Set::stream)
                                                      .collect(Collectors.toUnmodifiableSet());

    private static final String HEADER = """
        use anyhow::Result;
        use serde::{Deserialize, Serialize};
        use std::collections::HashMap;

        #[derive(Debug, Deserialize)]
        pub struct Event {
            pub data: serde_json::Value,
            pub context: HashMap<String, String>,
        }

        #[derive(Debug, Serialize)]
        pub struct Response {
            pub success: bool,
            pub data: serde_json::Value,
            pub message: String,
        }

        impl Response {
            pub fn success(message: impl Into<String>) -> Self {
                Self {
                    success: true,
                    data: serde_json::json!({}),
                    message: message.into(),
                }
            }

            pub fn error(message: impl Into<String>) -> Self {
                Self {
                    success: false,
                    data: serde_json::json!({}),
                    message: message.into(),
                }
            }
        }

        """;

    private static final String BOOTSTRAP = """

        #[tokio::main]
        async fn main() -> Result<()> {
            tracing_subscriber::fmt::init();

            let event = Event {
                data: serde_json::json!({}),
                context: HashMap::new(),
            };

            let response = handler(event).await?;
            println!("{}", serde_json::to_string_pretty(&response)?);

            Ok(())
        }
        """;

    @Override
    public TargetLanguage language() {
        return TargetLanguage.RUST;
    }

    @Override
    public String entryPoint() {
        return "pub async fn handler(event: Event)";
    }

    @Override
    protected void writeHeader(CodeWriter out, CompilerConfig config) {
        out.line(comment(GENERATED_BY));
        out.block(HEADER);
    }

    @Override
    protected void writeStubDefinition(CodeWriter out, ServiceStub stub) {
        out.line("async fn " + stub.functionName() + "(_event: &Event) -> Result<()> {")
           .indent()
           .line(comment(stub.provider() + " stub: replace with a real API call"))
           .line("Ok(())")
           .dedent()
           .line("}")
           .blank();
    }

    @Override
    protected void openHandler(CodeWriter out) {
        out.line("#[allow(unused_variables)]");
        out.line(entryPoint() + " -> Result<Response> {");
    }

    @Override
    protected void writeHandlerProlog(CodeWriter out) {
        out.line("tracing::info!(\"Processing event: {:?}\", event);");
    }

    @Override
    protected void writeSuccessReturn(CodeWriter out) {
        out.line("Ok(Response::success(" + quote(SUCCESS_MESSAGE) + "))");
    }

    @Override
    protected void closeHandler(CodeWriter out) {
        out.line("}");
    }

    @Override
    protected void writeFooter(CodeWriter out, CompilerConfig config) {
        if (config.debugMode()) {
            out.block(BOOTSTRAP);
        }
    }

    @Override
    protected String commentPrefix() {
        return "// ";
    }

    @Override
    protected void openIf(CodeWriter out, String condition) {
        out.line("if " + condition + " {");
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
        return "event.data.get(\"type\").and_then(|v| v.as_str()) == Some(" + quote(triggerTag) + ")";
    }

    @Override
    protected String comparison(String left, ComparisonOperator operator, String right) {
        return left + " " + cOperator(operator) + " " + right;
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
    protected String variableName(String name) {
        return KEYWORDS.contains(name)
               ? "r#" + name
               : super.variableName(name);
    }

    @Override
    protected String integerLiteral(long value) {
        return value + "i64";
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
           .line("tracing::info!(" + quote(stub.progressMessage()) + ");")
           .line("let " + stub.resultName() + " = " + stub.functionName() + "(&event).await;")
           .line("if let Err(e) = " + stub.resultName() + " {")
           .indent()
           .line("tracing::error!(" + quote(stub.failureMessage() + ": {}") + ", e);")
           .line("return Ok(Response::error(" + quote(stub.failureMessage()) + "));")
           .dedent()
           .line("}");
    }

    @Override
    protected void writeWarningLog(CodeWriter out, String serviceName) {
        out.line("tracing::warn!(\"Service {} not implemented\", " + quote(serviceName) + ");");
    }

    @Override
    protected void bindLiteral(CodeWriter out, String variable, String literal) {
        out.line("let " + variable + " = " + literal + ";");
    }

    @Override
    protected void bindPlaceholder(CodeWriter out, String variable, String referencedName) {
        out.line("let " + variable + ": Option<serde_json::Value> = None; " + comment("bound to " + referencedName));
    }

    static String cOperator(ComparisonOperator operator) {
        return switch (operator) {
            case EQUAL -> "==";
            case NOT_EQUAL -> "!=";
            case GREATER_THAN -> ">";
            case LESS_THAN -> "<";
            case GREATER_EQUAL -> ">=";
            case LESS_EQUAL -> "<=";
        };
    }
}
