package org.talkpp.compiler.generator;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Code generation backends.
 */
public enum TargetLanguage {
    RUST("Rust", "rs", Set.of("rust", "rs")),
    PYTHON("Python", "py", Set.of("python", "py", "python3")),
    JAVASCRIPT("JavaScript", "js", Set.of("javascript", "js", "node")),
    TYPESCRIPT("TypeScript", "ts", Set.of("typescript", "ts")),
    BASH("Bash", "sh", Set.of("bash", "sh", "shell"));

    private final String displayName;
    private final String fileExtension;
    private final Set<String> aliases;

    TargetLanguage(String displayName, String fileExtension, Set<String> aliases) {
        this.displayName = displayName;
        this.fileExtension = fileExtension;
        this.aliases = aliases;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Conventional file extension (without the dot) for front ends writing generated code.
     */
    public String fileExtension() {
        return fileExtension;
    }

    /**
     * Case-insensitive lookup by name or common alias ("py", "js", "ts", "sh", ...).
     */
    public static Optional<TargetLanguage> fromName(String name) {
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var language : values()) {
            if (language.aliases.contains(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
