package org.talkpp.compiler.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reserved words of the rule language.
 */
public enum Keyword {
    IF("if"),
    THEN("then"),
    ELSE("else"),
    WHEN("when"),
    AND("and"),
    OR("or"),
    USING("using"),
    WITH("with"),
    TO("to"),
    IN("in"),
    FROM("from");

    private static final Map<String, Keyword> BY_WORD = Arrays.stream(values())
                                                              .collect(Collectors.toUnmodifiableMap(Keyword::word,
                                                                                                    Function.identity()));

    private final String word;

    Keyword(String word) {
        this.word = word;
    }

    public String word() {
        return word;
    }

    public static Optional<Keyword> fromWord(String word) {
        return Optional.ofNullable(BY_WORD.get(word));
    }
}
