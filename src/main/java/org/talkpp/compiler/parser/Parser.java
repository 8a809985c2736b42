package org.talkpp.compiler.parser;

import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.lexer.Keyword;
import org.talkpp.compiler.lexer.Punctuation;
import org.talkpp.compiler.lexer.Token;
import org.talkpp.compiler.tree.Action;
import org.talkpp.compiler.tree.ActionStatement;
import org.talkpp.compiler.tree.AssignmentStatement;
import org.talkpp.compiler.tree.Condition;
import org.talkpp.compiler.tree.ConditionalStatement;
import org.talkpp.compiler.tree.Expression;
import org.talkpp.compiler.tree.LogicalOperator;
import org.talkpp.compiler.tree.Program;
import org.talkpp.compiler.tree.ServiceCall;
import org.talkpp.compiler.tree.SourceLocation;
import org.talkpp.compiler.tree.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive descent parser for the rule language.
 * Converts a token sequence into a {@link Program}; the first error aborts the parse.
 */
public final class Parser {

    private final List<Token> tokens;
    private final SourceLocation endOfInput;
    private int pos;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.endOfInput = tokens.isEmpty()
                          ? SourceLocation.START
                          : tokens.get(tokens.size() - 1).span().end();
        this.pos = 0;
    }

    /**
     * Parse tokens into a program.
     */
    public static Program parse(List<Token> tokens) throws CompilationException {
        return new Parser(tokens).parseProgram();
    }

    private Program parseProgram() throws CompilationException {
        var statements = new ArrayList<Statement>();

        while (!isAtEnd()) {
            var token = peek();

            if (isKeyword(Keyword.IF) || isKeyword(Keyword.WHEN)) {
                statements.add(new Statement.Conditional(parseConditional()));
            } else if (token instanceof Token.VerbToken) {
                statements.add(new Statement.Action(parseAction()));
            } else if (token instanceof Token.IdentifierToken) {
                if (isPunctuationAt(pos + 1, Punctuation.COLON)) {
                    statements.add(new Statement.Assignment(parseAssignment()));
                } else {
                    statements.add(new Statement.Action(parseAction()));
                }
            } else if (token instanceof Token.PunctuationToken) {
                // statement separator
                advance();
            } else {
                throw error("Expected statement, found " + token.description());
            }
        }

        return new Program(statements);
    }

    private ConditionalStatement parseConditional() throws CompilationException {
        advance();
        // skip 'if' / 'when'

        var condition = parseCondition();

        if (!isKeyword(Keyword.THEN)) {
            throw error("Expected 'then' after condition" + foundSuffix());
        }
        advance();

        var thenActions = parseActionList();

        Optional<List<ActionStatement>> elseActions = Optional.empty();
        if (isKeyword(Keyword.ELSE)) {
            advance();
            elseActions = Optional.of(parseActionList());
        }

        return new ConditionalStatement(condition, thenActions, elseActions);
    }

    private List<ActionStatement> parseActionList() throws CompilationException {
        var actions = new ArrayList<ActionStatement>();
        while (canStartAction()) {
            actions.add(parseAction());
        }
        return actions;
    }

    // 'and' and 'or' share one precedence level and fold to the left
    private Condition parseCondition() throws CompilationException {
        var condition = parsePrimaryCondition();

        while (isKeyword(Keyword.AND) || isKeyword(Keyword.OR)) {
            var operator = isKeyword(Keyword.AND)
                           ? LogicalOperator.AND
                           : LogicalOperator.OR;
            advance();

            var right = parsePrimaryCondition();
            condition = new Condition.Logical(condition, operator, right);
        }

        return condition;
    }

    private Condition parsePrimaryCondition() throws CompilationException {
        var words = new ArrayList<String>();
        while (!isAtEnd() && peek() instanceof Token.IdentifierToken identifier) {
            words.add(identifier.name());
            advance();
        }

        if (words.size() < 2) {
            throw error("Expected condition (a subject followed by an event word)" + foundSuffix());
        }

        var subject = String.join(" ", words.subList(0, words.size() - 1));
        var action = words.get(words.size() - 1);

        return new Condition.Event(subject, action, parseContext());
    }

    private Optional<String> parseContext() throws CompilationException {
        if (!(isKeyword(Keyword.IN) || isKeyword(Keyword.FROM) || isKeyword(Keyword.TO))) {
            return Optional.empty();
        }
        var preposition = ((Token.KeywordToken) peek()).keyword();
        advance();

        if (!isAtEnd() && peek() instanceof Token.StringToken string) {
            advance();
            return Optional.of(string.value());
        }
        if (!isAtEnd() && peek() instanceof Token.IdentifierToken identifier) {
            advance();
            return Optional.of(identifier.name());
        }
        throw error("Expected context after '" + preposition.word() + "'" + foundSuffix());
    }

    private ActionStatement parseAction() throws CompilationException {
        var action = parseVerb();

        var target = parseTarget();

        Optional<ServiceCall> service = Optional.empty();
        if (isKeyword(Keyword.USING) || isKeyword(Keyword.WITH)) {
            var keyword = ((Token.KeywordToken) peek()).keyword();
            advance();
            if (isAtEnd() || !(peek() instanceof Token.ServiceToken serviceToken)) {
                throw error("Expected service name after '" + keyword.word() + "'" + foundSuffix());
            }
            advance();
            service = Optional.of(ServiceCall.named(serviceToken.name()));
        }

        return ActionStatement.of(action, target, service);
    }

    // A target is a quoted string or a noun phrase; consecutive words join with a single space.
    private Optional<Expression> parseTarget() {
        if (!isAtEnd() && peek() instanceof Token.StringToken string) {
            advance();
            return Optional.of(Expression.string(string.value()));
        }
        var words = new ArrayList<String>();
        while (isNounPhraseWord()) {
            words.add(((Token.IdentifierToken) peek()).name());
            advance();
        }
        return words.isEmpty()
               ? Optional.empty()
               : Optional.of(Expression.identifier(String.join(" ", words)));
    }

    private Action parseVerb() throws CompilationException {
        if (!isAtEnd() && peek() instanceof Token.VerbToken verb) {
            advance();
            return verb.verb();
        }
        if (!isAtEnd() && peek() instanceof Token.IdentifierToken identifier) {
            advance();
            return Action.fromWord(identifier.name());
        }
        throw error("Expected action verb" + foundSuffix());
    }

    private AssignmentStatement parseAssignment() throws CompilationException {
        if (isAtEnd() || !(peek() instanceof Token.IdentifierToken identifier)) {
            throw error("Expected variable name" + foundSuffix());
        }
        advance();

        if (!isPunctuationAt(pos, Punctuation.COLON)) {
            throw error("Expected ':' after variable name" + foundSuffix());
        }
        advance();

        return new AssignmentStatement(identifier.name(), parseExpression());
    }

    private Expression parseExpression() throws CompilationException {
        if (isAtEnd()) {
            throw error("Expected expression" + foundSuffix());
        }
        var token = peek();

        if (token instanceof Token.IdentifierToken identifier) {
            advance();
            return Expression.identifier(identifier.name());
        }
        if (token instanceof Token.StringToken string) {
            advance();
            return Expression.string(string.value());
        }
        if (token instanceof Token.IntegerToken integer) {
            advance();
            return Expression.integer(integer.value());
        }
        if (token instanceof Token.FloatToken number) {
            advance();
            return Expression.decimal(number.value());
        }
        if (token instanceof Token.ServiceToken service) {
            advance();
            return Expression.identifier(service.name());
        }

        throw error("Expected expression" + foundSuffix());
    }

    // A verb always starts an action; an identifier does unless it is the name of an assignment.
    private boolean canStartAction() {
        if (isAtEnd()) {
            return false;
        }
        return peek() instanceof Token.VerbToken || isNounPhraseWord();
    }

    // An identifier followed by ':' names the next assignment instead.
    private boolean isNounPhraseWord() {
        return !isAtEnd()
            && peek() instanceof Token.IdentifierToken
            && !isPunctuationAt(pos + 1, Punctuation.COLON);
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private boolean isKeyword(Keyword keyword) {
        return !isAtEnd()
            && peek() instanceof Token.KeywordToken token
            && token.keyword() == keyword;
    }

    private boolean isPunctuationAt(int index, Punctuation punctuation) {
        return index < tokens.size()
            && tokens.get(index) instanceof Token.PunctuationToken token
            && token.punctuation() == punctuation;
    }

    private SourceLocation currentLocation() {
        return isAtEnd()
               ? endOfInput
               : peek().span().start();
    }

    private String foundSuffix() {
        return isAtEnd()
               ? ", found end of input"
               : ", found " + peek().description();
    }

    private CompilationException error(String reason) {
        var location = currentLocation();
        return CompilationException.parse(location.line(), location.column(), reason);
    }
}
