package org.talkpp.compiler.generator;

import java.util.Objects;

/**
 * Code generation options.
 *
 * @param targetLanguage    backend that renders the program
 * @param optimizationLevel forwarded as-is; not interpreted by rendering
 * @param debugMode         for {@link TargetLanguage#RUST}, also emit a runnable {@code main} bootstrap
 */
public record CompilerConfig(
    TargetLanguage targetLanguage,
    OptimizationLevel optimizationLevel,
    boolean debugMode
) {
    public static final CompilerConfig DEFAULT = new CompilerConfig(
        TargetLanguage.RUST,
        OptimizationLevel.DEBUG,
        true
    );

    public CompilerConfig {
        Objects.requireNonNull(targetLanguage, "targetLanguage");
        Objects.requireNonNull(optimizationLevel, "optimizationLevel");
    }

    public static CompilerConfig forTarget(TargetLanguage targetLanguage) {
        return new CompilerConfig(targetLanguage, DEFAULT.optimizationLevel(), DEFAULT.debugMode());
    }

    public CompilerConfig withTarget(TargetLanguage targetLanguage) {
        return new CompilerConfig(targetLanguage, optimizationLevel, debugMode);
    }

    public CompilerConfig withDebugMode(boolean debugMode) {
        return new CompilerConfig(targetLanguage, optimizationLevel, debugMode);
    }
}
