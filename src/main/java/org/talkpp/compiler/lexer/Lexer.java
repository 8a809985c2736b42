package org.talkpp.compiler.lexer;

import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.tree.Action;
import org.talkpp.compiler.tree.SourceLocation;
import org.talkpp.compiler.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for rule language source text.
 *
 * <p>Classification follows a fixed priority: keywords, action verbs, capitalized service
 * names, lowercase identifiers, string literals, numbers and punctuation. Whitespace, line
 * comments and block comments are skipped. The first unrecognized input aborts tokenization.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int bytePos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.bytePos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) throws CompilationException {
        if (input.length() > MAX_INPUT_SIZE) {
            throw CompilationException.lexical(0, "Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() throws CompilationException {
        var tokens = new ArrayList<Token>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        return List.copyOf(tokens);
    }

    private Token nextToken() throws CompilationException {
        var start = currentLocation();
        char c = peek();
        if (isLowerWordStart(c)) {
            return scanWord(start);
        }
        if (isUpper(c)) {
            return scanService(start);
        }
        if (c == '"' || c == '`') {
            return scanStringLiteral(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        var punctuation = Punctuation.fromChar(c);
        if (punctuation.isPresent()) {
            advance();
            return new Token.PunctuationToken(span(start), punctuation.get());
        }
        throw CompilationException.lexical(start.byteOffset(),
                                           "Invalid token: '" + Character.toString(input.codePointAt(pos)) + "'");
    }

    // Keywords and verbs share the identifier shape; a keyword only matches the whole word.
    private Token scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        var keyword = Keyword.fromWord(word);
        if (keyword.isPresent()) {
            return new Token.KeywordToken(span(start), keyword.get());
        }
        var verb = Action.Verb.fromSurfaceForm(word);
        if (verb.isPresent()) {
            return new Token.VerbToken(span(start), verb.get(), word);
        }
        return new Token.IdentifierToken(span(start), word);
    }

    private Token scanService(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isAlphanumeric(peek())) {
            sb.append(advance());
        }
        return new Token.ServiceToken(span(start), sb.toString());
    }

    private Token scanStringLiteral(SourceLocation start) throws CompilationException {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                // skip backslash
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            throw CompilationException.lexical(start.byteOffset(), "Unterminated string literal");
        }
        advance();
        // skip closing quote
        return new Token.StringToken(span(start), sb.toString());
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            default -> c;
        };
    }

    private Token scanNumber(SourceLocation start) throws CompilationException {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        if (isFractionStart()) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
            var value = Double.parseDouble(sb.toString());
            if (Double.isInfinite(value)) {
                throw CompilationException.lexical(start.byteOffset(), "Float literal out of range: '" + sb + "'");
            }
            return new Token.FloatToken(span(start), value);
        }
        try {
            return new Token.IntegerToken(span(start), Long.parseLong(sb.toString()));
        } catch (NumberFormatException e) {
            throw CompilationException.lexical(start.byteOffset(), "Integer literal out of range: '" + sb + "'");
        }
    }

    // A '.' only continues a number when a digit follows it; "3." is an integer and a dot.
    private boolean isFractionStart() {
        return pos + 1 < input.length()
            && input.charAt(pos) == '.'
            && isDigit(input.charAt(pos + 1));
    }

    private void skipWhitespaceAndComments() throws CompilationException {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
                advance();
            } else if (c == '/' && lookingAt('/')) {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && lookingAt('*')) {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() throws CompilationException {
        var start = bytePos;
        advance();
        advance();
        // skip /*
        while (!isAtEnd()) {
            if (peek() == '*' && lookingAt('/')) {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw CompilationException.lexical(start, "Unterminated block comment");
    }

    private boolean lookingAt(char next) {
        return pos + 1 < input.length() && input.charAt(pos + 1) == next;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        bytePos += utf8Length(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else if (!Character.isLowSurrogate(c)) {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos, bytePos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    // A surrogate pair encodes to four bytes, two per half.
    private static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800 || Character.isSurrogate(c)) {
            return 2;
        }
        return 3;
    }

    private static boolean isLowerWordStart(char c) {
        return (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || isUpper(c) || isDigit(c);
    }

    private static boolean isIdentifierPart(char c) {
        return isAlphanumeric(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
