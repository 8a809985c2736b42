package org.talkpp.compiler.error;

/**
 * Failure taxonomy shared by every compilation stage.
 */
public sealed interface CompilerError {

    /**
     * Human-readable description including position information where available.
     */
    String message();

    /**
     * Source text that no lexical rule matches. Position is a UTF-8 byte offset.
     */
    record LexicalError(int position, String reason) implements CompilerError {
        @Override
        public String message() {
            return "Lexical error at position " + position + ": " + reason;
        }
    }

    /**
     * Token sequence that does not fit the grammar.
     */
    record ParseError(int line, int column, String reason) implements CompilerError {
        @Override
        public String message() {
            return "Parse error at line " + line + ", column " + column + ": " + reason;
        }
    }

    /**
     * Reserved for a semantic pass; nothing raises it yet.
     */
    record SemanticError(String reason) implements CompilerError {
        @Override
        public String message() {
            return "Semantic error: " + reason;
        }
    }

    /**
     * Tree shape the generator cannot render.
     */
    record CodeGenError(String reason) implements CompilerError {
        @Override
        public String message() {
            return "Code generation error: " + reason;
        }
    }

    record UnsupportedFeature(String feature) implements CompilerError {
        @Override
        public String message() {
            return "Unsupported feature: " + feature;
        }
    }

    /**
     * Broken compiler invariant.
     */
    record InternalError(String reason) implements CompilerError {
        @Override
        public String message() {
            return "Internal compiler error: " + reason;
        }
    }

    /**
     * Reading a source file failed. Raised only by front ends that load files.
     */
    record IoError(String path, Throwable cause) implements CompilerError {
        @Override
        public String message() {
            if (cause == null) {
                return "IO error reading " + path;
            }
            var detail = cause.getMessage() == null
                         ? cause.getClass().getSimpleName()
                         : cause.getMessage();
            return "IO error reading " + path + ": " + detail;
        }
    }
}
