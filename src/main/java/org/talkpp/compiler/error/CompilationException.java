package org.talkpp.compiler.error;

import java.util.Objects;

/**
 * Thrown by every compilation stage on the first failure. Carries exactly one
 * {@link CompilerError}; the exception message is the error's message.
 */
public class CompilationException extends Exception {

    private final CompilerError error;

    public CompilationException(CompilerError error) {
        super(Objects.requireNonNull(error, "error").message(), causeOf(error));
        this.error = error;
    }

    public CompilerError error() {
        return error;
    }

    public static CompilationException lexical(int position, String reason) {
        return new CompilationException(new CompilerError.LexicalError(position, reason));
    }

    public static CompilationException parse(int line, int column, String reason) {
        return new CompilationException(new CompilerError.ParseError(line, column, reason));
    }

    public static CompilationException codegen(String reason) {
        return new CompilationException(new CompilerError.CodeGenError(reason));
    }

    public static CompilationException unsupported(String feature) {
        return new CompilationException(new CompilerError.UnsupportedFeature(feature));
    }

    public static CompilationException io(String path, Throwable cause) {
        return new CompilationException(new CompilerError.IoError(path, cause));
    }

    public static CompilationException internal(String reason) {
        return new CompilationException(new CompilerError.InternalError(reason));
    }

    private static Throwable causeOf(CompilerError error) {
        return error instanceof CompilerError.IoError io
               ? io.cause()
               : null;
    }
}
