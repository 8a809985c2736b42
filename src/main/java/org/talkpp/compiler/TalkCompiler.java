package org.talkpp.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.error.CompilerError;
import org.talkpp.compiler.generator.CodeGenerator;
import org.talkpp.compiler.generator.CompilerConfig;
import org.talkpp.compiler.generator.OptimizationLevel;
import org.talkpp.compiler.generator.TargetLanguage;
import org.talkpp.compiler.lexer.Lexer;
import org.talkpp.compiler.parser.Parser;
import org.talkpp.compiler.tree.Program;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry point for compiling rule language source into target-language code.
 *
 * <p>Example usage:
 * <pre>{@code
 * var code = TalkCompiler.builder()
 *                        .target(TargetLanguage.PYTHON)
 *                        .build()
 *                        .compile("if new user registers then validate email using SendGrid");
 * }</pre>
 *
 * <p>Instances are immutable and every call is independent, so one compiler may be shared
 * between threads.
 */
public final class TalkCompiler {
    private static final Logger log = LoggerFactory.getLogger(TalkCompiler.class);

    private final CompilerConfig config;

    private TalkCompiler(CompilerConfig config) {
        this.config = config;
    }

    /**
     * Compiler with {@link CompilerConfig#DEFAULT}.
     */
    public static TalkCompiler create() {
        return new TalkCompiler(CompilerConfig.DEFAULT);
    }

    public static TalkCompiler create(CompilerConfig config) {
        return new TalkCompiler(config);
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compile source text with this compiler's configuration.
     */
    public String compile(String source) throws CompilationException {
        return compile(source, config);
    }

    /**
     * Tokenize, parse and generate. The first failure in any stage aborts compilation.
     */
    public static String compile(String source, CompilerConfig config) throws CompilationException {
        var program = parse(source);
        try {
            var code = CodeGenerator.generate(program, config);
            log.debug("Generated {} characters of {} code", code.length(), config.targetLanguage().displayName());
            return code;
        } catch (CompilationException e) {
            log.debug("Code generation failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Read a UTF-8 source file and compile it.
     */
    public static String compileFile(Path path, CompilerConfig config) throws CompilationException {
        String source;
        try {
            source = Files.readString(path);
        } catch (IOException e) {
            log.debug("Failed to read {}: {}", path, e.getMessage());
            throw CompilationException.io(path.toString(), e);
        }
        return compile(source, config);
    }

    /**
     * Tokenize and parse without generating code.
     */
    public static Program parse(String source) throws CompilationException {
        try {
            var tokens = Lexer.tokenize(source);
            log.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
            var program = Parser.parse(tokens);
            log.debug("Parsed {} statements", program.statements().size());
            return program;
        } catch (CompilationException e) {
            log.debug("Front end failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Validate source text without producing output.
     *
     * @return the first error, or empty when the source lexes and parses
     */
    public static Optional<CompilerError> check(String source) {
        try {
            parse(source);
            return Optional.empty();
        } catch (CompilationException e) {
            return Optional.of(e.error());
        }
    }

    /**
     * Compile and verify the output contains the target's handler entry point.
     */
    public static String compileAndValidate(String source, CompilerConfig config) throws CompilationException {
        var code = compile(source, config);
        var backend = CodeGenerator.backend(config.targetLanguage());
        if (!code.contains(backend.entryPoint())) {
            throw CompilationException.internal("Generated " + config.targetLanguage().displayName()
                                                + " code has no handler entry point");
        }
        return code;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TargetLanguage target = CompilerConfig.DEFAULT.targetLanguage();
        private OptimizationLevel optimization = CompilerConfig.DEFAULT.optimizationLevel();
        private boolean debug = CompilerConfig.DEFAULT.debugMode();

        private Builder() {}

        public Builder target(TargetLanguage target) {
            this.target = target;
            return this;
        }

        public Builder optimization(OptimizationLevel optimization) {
            this.optimization = optimization;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public TalkCompiler build() {
            return new TalkCompiler(new CompilerConfig(target, optimization, debug));
        }
    }
}
