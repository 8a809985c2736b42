package org.talkpp.compiler.generator;

/**
 * Line-oriented text builder with indentation, used by the backends.
 */
final class CodeWriter {
    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int depth;

    CodeWriter line(String text) {
        if (!text.isEmpty()) {
            sb.append(INDENT.repeat(depth));
        }
        sb.append(text).append('\n');
        return this;
    }

    CodeWriter blank() {
        sb.append('\n');
        return this;
    }

    /**
     * Append a multi-line block verbatim at the current indentation.
     */
    CodeWriter block(String text) {
        var body = text.endsWith("\n")
                   ? text.substring(0, text.length() - 1)
                   : text;
        for (var line : body.split("\n", -1)) {
            line(line);
        }
        return this;
    }

    CodeWriter indent() {
        depth++;
        return this;
    }

    CodeWriter dedent() {
        if (depth > 0) {
            depth--;
        }
        return this;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
