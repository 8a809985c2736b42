package org.talkpp.compiler.lexer;

import java.util.Optional;

public enum Punctuation {
    COMMA(','),
    DOT('.'),
    COLON(':'),
    SEMICOLON(';');

    private final char symbol;

    Punctuation(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static Optional<Punctuation> fromChar(char c) {
        for (var punctuation : values()) {
            if (punctuation.symbol == c) {
                return Optional.of(punctuation);
            }
        }
        return Optional.empty();
    }
}
