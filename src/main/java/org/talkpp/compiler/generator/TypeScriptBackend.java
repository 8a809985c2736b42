package org.talkpp.compiler.generator;

/**
 * TypeScript backend. Statement rendering is shared with {@link JavaScriptBackend}; the
 * declarations use interfaces and the handler is an exported, typed async function.
 */
public final class TypeScriptBackend extends JavaScriptBackend {

    private static final String HEADER = """
        export interface Event {
            data: Record<string, any>;
            context: Record<string, string>;
        }

        export interface Response {
            success: boolean;
            data: Record<string, any>;
            message: string;
        }

        function successResponse(message: string): Response {
            return { success: true, data: {}, message };
        }

        function errorResponse(message: string): Response {
            return { success: false, data: {}, message };
        }

        """;

    @Override
    public TargetLanguage language() {
        return TargetLanguage.TYPESCRIPT;
    }

    @Override
    public String entryPoint() {
        return "export async function handler(event: Event): Promise<Response>";
    }

    @Override
    protected void writeHeader(CodeWriter out, CompilerConfig config) {
        out.line(comment(GENERATED_BY));
        out.blank();
        out.block(HEADER);
    }

    @Override
    protected void writeStubDefinition(CodeWriter out, ServiceStub stub) {
        out.line("async function " + stub.camelFunctionName() + "(event: Event): Promise<void> {")
           .indent()
           .line(comment(stub.provider() + " stub: replace with a real API call"))
           .dedent()
           .line("}")
           .blank();
    }

    @Override
    protected void openHandler(CodeWriter out) {
        out.line(entryPoint() + " {");
    }

    @Override
    protected void writeFooter(CodeWriter out, CompilerConfig config) {
        // exported in the signature
    }

    @Override
    protected void bindPlaceholder(CodeWriter out, String variable, String referencedName) {
        out.line("let " + variable + ": unknown; " + comment("bound to " + referencedName));
    }
}
