package org.talkpp.compiler.parser;

import org.junit.jupiter.api.Test;
import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.error.CompilerError;
import org.talkpp.compiler.lexer.Lexer;
import org.talkpp.compiler.tree.Action;
import org.talkpp.compiler.tree.ActionStatement;
import org.talkpp.compiler.tree.Condition;
import org.talkpp.compiler.tree.ConditionalStatement;
import org.talkpp.compiler.tree.Expression;
import org.talkpp.compiler.tree.LogicalOperator;
import org.talkpp.compiler.tree.Program;
import org.talkpp.compiler.tree.Statement;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static Program parse(String source) throws CompilationException {
        return Parser.parse(Lexer.tokenize(source));
    }

    private static ConditionalStatement conditional(Statement statement) {
        return assertInstanceOf(Statement.Conditional.class, statement).statement();
    }

    private static ActionStatement action(Statement statement) {
        return assertInstanceOf(Statement.Action.class, statement).statement();
    }

    private static CompilerError.ParseError parseError(String source) {
        var exception = assertThrows(CompilationException.class, () -> parse(source));
        return assertInstanceOf(CompilerError.ParseError.class, exception.error());
    }

    // === Conditionals ===

    @Test
    void parse_eventRule_buildsConditional() throws CompilationException {
        var program = parse("if new user registers then validate email using SendGrid");

        assertEquals(1, program.statements().size());
        var statement = conditional(program.statements().get(0));

        var event = assertInstanceOf(Condition.Event.class, statement.condition());
        assertEquals("new user", event.subject());
        assertEquals("registers", event.action());
        assertEquals(Optional.empty(), event.context());

        assertEquals(1, statement.thenActions().size());
        var validate = statement.thenActions().get(0);
        assertEquals(Action.Verb.VALIDATE, validate.action());
        assertEquals(Optional.of(Expression.identifier("email")), validate.target());
        assertEquals("SendGrid", validate.service().orElseThrow().name());
        assertTrue(statement.elseActions().isEmpty());
    }

    @Test
    void parse_whenKeyword_withContext() throws CompilationException {
        var program = parse("when order ships from warehouse then store order");

        var event = (Condition.Event) conditional(program.statements().get(0)).condition();
        assertEquals("order", event.subject());
        assertEquals("ships", event.action());
        assertEquals(Optional.of("warehouse"), event.context());
    }

    @Test
    void parse_quotedContext_keepsText() throws CompilationException {
        var program = parse("if order ships to \"dock 4\" then send notice");

        var event = (Condition.Event) conditional(program.statements().get(0)).condition();
        assertEquals(Optional.of("dock 4"), event.context());
    }

    @Test
    void parse_andCondition_buildsLogical() throws CompilationException {
        var program = parse("if a b c and d e then send x");

        var logical = assertInstanceOf(Condition.Logical.class,
                                       conditional(program.statements().get(0)).condition());
        assertEquals(LogicalOperator.AND, logical.operator());
        assertEquals(new Condition.Event("a b", "c", Optional.empty()), logical.left());
        assertEquals(new Condition.Event("d", "e", Optional.empty()), logical.right());
    }

    @Test
    void parse_mixedLogicalChain_foldsLeft() throws CompilationException {
        var program = parse("if a b and c d or e f then send x");

        var outer = assertInstanceOf(Condition.Logical.class,
                                     conditional(program.statements().get(0)).condition());
        assertEquals(LogicalOperator.OR, outer.operator());
        assertEquals(new Condition.Event("e", "f", Optional.empty()), outer.right());

        var inner = assertInstanceOf(Condition.Logical.class, outer.left());
        assertEquals(LogicalOperator.AND, inner.operator());
        assertEquals("a", ((Condition.Event) inner.left()).subject());
        assertEquals("c", ((Condition.Event) inner.right()).subject());
    }

    @Test
    void parse_elseBranch_collectsActions() throws CompilationException {
        var program = parse("if a b then send x store y else notify admin");

        var statement = conditional(program.statements().get(0));
        assertEquals(2, statement.thenActions().size());
        assertEquals(Action.Verb.STORE, statement.thenActions().get(1).action());

        var elseActions = statement.elseActions().orElseThrow();
        assertEquals(1, elseActions.size());
        assertEquals(new Action.Custom("notify"), elseActions.get(0).action());
        assertEquals(Optional.of(Expression.identifier("admin")), elseActions.get(0).target());
    }

    @Test
    void parse_emptyThenBranch_allowed() throws CompilationException {
        var program = parse("if a b then else send x");

        var statement = conditional(program.statements().get(0));
        assertTrue(statement.thenActions().isEmpty());
        assertEquals(1, statement.elseActions().orElseThrow().size());
    }

    @Test
    void parse_actionListStopsAtAssignment() throws CompilationException {
        var program = parse("if a b then send x retries: 3");

        assertEquals(2, program.statements().size());
        assertEquals(1, conditional(program.statements().get(0)).thenActions().size());
        assertInstanceOf(Statement.Assignment.class, program.statements().get(1));
    }

    @Test
    void parse_actionListStopsAtSeparator() throws CompilationException {
        var program = parse("if a b then send x, store y");

        assertEquals(2, program.statements().size());
        assertEquals(1, conditional(program.statements().get(0)).thenActions().size());
        assertEquals(Action.Verb.STORE, action(program.statements().get(1)).action());
    }

    // === Actions ===

    @Test
    void parse_multiWordTarget_joinedIntoOneAction() throws CompilationException {
        var program = parse("send welcome message using Twilio");

        assertEquals(1, program.statements().size());
        var send = action(program.statements().get(0));
        assertEquals(Action.Verb.SEND, send.action());
        assertEquals(Optional.of(Expression.identifier("welcome message")), send.target());
        assertEquals("Twilio", send.service().orElseThrow().name());
    }

    @Test
    void parse_targetStopsAtVerb() throws CompilationException {
        var program = parse("if a b then notify admin send x");

        var actions = conditional(program.statements().get(0)).thenActions();
        assertEquals(2, actions.size());
        assertEquals(Optional.of(Expression.identifier("admin")), actions.get(0).target());
        assertEquals(Action.Verb.SEND, actions.get(1).action());
    }

    @Test
    void parse_stringTargetWithService() throws CompilationException {
        var program = parse("sends \"hello\" with Twilio");

        var send = action(program.statements().get(0));
        assertEquals(Action.Verb.SEND, send.action());
        assertEquals(Optional.of(Expression.string("hello")), send.target());
        assertEquals("Twilio", send.service().orElseThrow().name());
    }

    @Test
    void parse_bareVerb_hasNoTargetOrService() throws CompilationException {
        var program = parse("process");

        var process = action(program.statements().get(0));
        assertEquals(Action.Verb.PROCESS, process.action());
        assertTrue(process.target().isEmpty());
        assertTrue(process.service().isEmpty());
        assertTrue(process.parameters().isEmpty());
    }

    @Test
    void parse_separators_splitStatements() throws CompilationException {
        var program = parse("send x; store y. validate z,");

        assertEquals(3, program.statements().size());
        program.statements().forEach(statement -> assertInstanceOf(Statement.Action.class, statement));
    }

    @Test
    void parse_emptySource_producesEmptyProgram() throws CompilationException {
        assertTrue(parse("").isEmpty());
        assertTrue(parse("// nothing here").isEmpty());
    }

    // === Assignments ===

    @Test
    void parse_assignments_captureLiteralAndReferenceValues() throws CompilationException {
        var program = parse("""
            retries: 3
            rate: 1.5
            name: "bob"
            owner: Admin
            alias: other
            """);

        var values = program.statements()
                            .stream()
                            .map(statement -> assertInstanceOf(Statement.Assignment.class, statement).statement())
                            .toList();
        assertEquals(List.of("retries", "rate", "name", "owner", "alias"),
                     values.stream().map(value -> value.variable()).toList());
        assertEquals(Expression.integer(3), values.get(0).value());
        assertEquals(Expression.decimal(1.5), values.get(1).value());
        assertEquals(Expression.string("bob"), values.get(2).value());
        assertEquals(Expression.identifier("Admin"), values.get(3).value());
        assertEquals(Expression.identifier("other"), values.get(4).value());
    }

    // === Errors ===

    @Test
    void parse_missingThen_reportsPositionOfOffendingToken() {
        var error = parseError("if new user registers validate email");

        assertEquals(1, error.line());
        assertEquals(23, error.column());
        assertThat(error.reason()).startsWith("Expected 'then' after condition")
                                  .contains("verb 'validate'");
    }

    @Test
    void parse_missingThenAtEnd_reportsEndOfLastToken() {
        var error = parseError("if a b");

        assertEquals(1, error.line());
        assertEquals(7, error.column());
        assertThat(error.reason()).endsWith("found end of input");
    }

    @Test
    void parse_errorOnSecondLine_reportsLine() {
        var error = parseError("send x\nif a b send y");

        assertEquals(2, error.line());
        assertEquals(8, error.column());
    }

    @Test
    void parse_singleWordCondition_fails() {
        var error = parseError("if user then send x");

        assertEquals(9, error.column());
        assertThat(error.reason()).startsWith("Expected condition");
    }

    @Test
    void parse_prepositionWithoutContext_fails() {
        var error = parseError("if order ships to then send x");

        assertEquals(19, error.column());
        assertEquals("Expected context after 'to', found keyword 'then'", error.reason());
    }

    @Test
    void parse_usingWithoutService_fails() {
        var error = parseError("send x using email");

        assertEquals(14, error.column());
        assertEquals("Expected service name after 'using', found identifier 'email'", error.reason());
    }

    @Test
    void parse_strayKeyword_fails() {
        var error = parseError("then send x");

        assertEquals(1, error.line());
        assertEquals(1, error.column());
        assertEquals("Expected statement, found keyword 'then'", error.reason());
    }

    @Test
    void parse_assignmentWithoutValue_fails() {
        var error = parseError("retries: ,");

        assertEquals(10, error.column());
        assertEquals("Expected expression, found ','", error.reason());

        var atEnd = parseError("retries:");
        assertEquals(9, atEnd.column());
        assertEquals("Expected expression, found end of input", atEnd.reason());
    }

    @Test
    void parse_errorMessage_includesPosition() {
        var exception = assertThrows(CompilationException.class, () -> parse("then"));

        assertEquals("Parse error at line 1, column 1: Expected statement, found keyword 'then'",
                     exception.getMessage());
    }
}
