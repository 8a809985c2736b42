package org.talkpp.compiler.tree;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The verb of an action statement: one of the canonical verbs or a custom word.
 */
public sealed interface Action {

    /**
     * Canonical lowercase word for the action (the custom word itself for {@link Custom}).
     */
    String word();

    enum Verb implements Action {
        SEND("send", "sends"),
        STORE("store", "stores"),
        VALIDATE("validate", "validates"),
        PROCESS("process", "processes"),
        TRIGGER("trigger", "triggers"),
        CALL("call", "calls");

        private static final Map<String, Verb> BY_SURFACE_FORM = Arrays.stream(values())
                                                                       .flatMap(verb -> Stream.of(Map.entry(verb.word, verb),
                                                                                                  Map.entry(verb.plural, verb)))
                                                                       .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey,
                                                                                                             Map.Entry::getValue));

        private final String word;
        private final String plural;

        Verb(String word, String plural) {
            this.word = word;
            this.plural = plural;
        }

        @Override
        public String word() {
            return word;
        }

        /**
         * Exact (case-sensitive) lookup used by the lexer.
         */
        public static Optional<Verb> fromSurfaceForm(String text) {
            return Optional.ofNullable(BY_SURFACE_FORM.get(text));
        }
    }

    /**
     * Any other verb-like word: "notify", "archive".
     */
    record Custom(String name) implements Action {
        @Override
        public String word() {
            return name;
        }
    }

    /**
     * Normalize a word to an action. Singular and plural forms of the canonical verbs are
     * recognized regardless of case; everything else becomes {@link Custom}.
     */
    static Action fromWord(String word) {
        var canonical = Verb.fromSurfaceForm(word.toLowerCase(Locale.ROOT));
        if (canonical.isPresent()) {
            return canonical.get();
        }
        return new Custom(word);
    }
}
