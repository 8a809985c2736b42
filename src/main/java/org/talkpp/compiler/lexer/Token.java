package org.talkpp.compiler.lexer;

import org.talkpp.compiler.tree.Action;
import org.talkpp.compiler.tree.SourceSpan;

/**
 * Token types produced by the {@link Lexer}.
 */
public sealed interface Token {
    SourceSpan span();

    /**
     * Short description used in error messages.
     */
    String description();

    // Words

    record KeywordToken(SourceSpan span, Keyword keyword) implements Token {
        @Override
        public String description() {
            return "keyword '" + keyword.word() + "'";
        }
    }

    // send, sends, store, ... normalized to the canonical verb
    record VerbToken(SourceSpan span, Action.Verb verb, String text) implements Token {
        @Override
        public String description() {
            return "verb '" + text + "'";
        }
    }

    // [A-Z][a-zA-Z0-9]*
    record ServiceToken(SourceSpan span, String name) implements Token {
        @Override
        public String description() {
            return "service '" + name + "'";
        }
    }

    // [a-z_][a-zA-Z0-9_]*
    record IdentifierToken(SourceSpan span, String name) implements Token {
        @Override
        public String description() {
            return "identifier '" + name + "'";
        }
    }

    // Literals

    record StringToken(SourceSpan span, String value) implements Token {
        @Override
        public String description() {
            return "string literal";
        }
    }

    record IntegerToken(SourceSpan span, long value) implements Token {
        @Override
        public String description() {
            return "integer " + value;
        }
    }

    record FloatToken(SourceSpan span, double value) implements Token {
        @Override
        public String description() {
            return "number " + value;
        }
    }

    // , . : ;
    record PunctuationToken(SourceSpan span, Punctuation punctuation) implements Token {
        @Override
        public String description() {
            return "'" + punctuation.symbol() + "'";
        }
    }
}
