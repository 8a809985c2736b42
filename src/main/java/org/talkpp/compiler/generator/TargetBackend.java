package org.talkpp.compiler.generator;

import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.tree.Program;

/**
 * Renders a program as source text for one target language.
 */
public interface TargetBackend {

    TargetLanguage language();

    /**
     * Text that identifies the asynchronous handler entry point in rendered output.
     */
    String entryPoint();

    String render(Program program, CompilerConfig config) throws CompilationException;
}
