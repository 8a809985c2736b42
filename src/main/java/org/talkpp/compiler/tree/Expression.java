package org.talkpp.compiler.tree;

import java.util.List;

/**
 * Value expressions used as action targets, assignment values and comparison operands.
 */
public sealed interface Expression {

    // === Produced by the parser ===

    /**
     * Reference to a named value: email, user_id
     */
    record Identifier(String name) implements Expression {}

    /**
     * Quoted text: "users" or `users`
     */
    record StringLiteral(String value) implements Expression {}

    /**
     * Whole number: 42
     */
    record IntegerLiteral(long value) implements Expression {}

    /**
     * Decimal number: 3.14
     */
    record FloatLiteral(double value) implements Expression {}

    // === Tree shapes without a surface syntax yet ===

    record BooleanLiteral(boolean value) implements Expression {}

    /**
     * Property access: object.property
     */
    record Property(Expression object, String property) implements Expression {}

    /**
     * Function call: name(arg1, arg2)
     */
    record FunctionCall(String name, List<Expression> arguments) implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    static Expression identifier(String name) {
        return new Identifier(name);
    }

    static Expression string(String value) {
        return new StringLiteral(value);
    }

    static Expression integer(long value) {
        return new IntegerLiteral(value);
    }

    static Expression decimal(double value) {
        return new FloatLiteral(value);
    }

    static Expression bool(boolean value) {
        return new BooleanLiteral(value);
    }

    /**
     * Whether the expression is a literal value that needs no interpretation to be emitted.
     */
    default boolean isLiteral() {
        return this instanceof StringLiteral
            || this instanceof IntegerLiteral
            || this instanceof FloatLiteral
            || this instanceof BooleanLiteral;
    }
}
