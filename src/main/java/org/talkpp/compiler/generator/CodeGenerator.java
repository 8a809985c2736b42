package org.talkpp.compiler.generator;

import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.tree.Program;

import java.util.EnumMap;
import java.util.Map;

/**
 * Generates target-language source text from a syntax tree.
 *
 * <p>Generation only reads the tree and holds no state between calls: the same program and
 * configuration always produce identical text.
 */
public final class CodeGenerator {

    private static final Map<TargetLanguage, TargetBackend> BACKENDS = createBackends();

    private CodeGenerator() {}

    public static String generate(Program program, CompilerConfig config) throws CompilationException {
        return backend(config.targetLanguage()).render(program, config);
    }

    public static TargetBackend backend(TargetLanguage language) {
        return BACKENDS.get(language);
    }

    private static Map<TargetLanguage, TargetBackend> createBackends() {
        var backends = new EnumMap<TargetLanguage, TargetBackend>(TargetLanguage.class);
        for (var language : TargetLanguage.values()) {
            backends.put(language, switch (language) {
                case RUST -> new RustBackend();
                case PYTHON -> new PythonBackend();
                case JAVASCRIPT -> new JavaScriptBackend();
                case TYPESCRIPT -> new TypeScriptBackend();
                case BASH -> new BashBackend();
            });
        }
        return Map.copyOf(backends);
    }
}
