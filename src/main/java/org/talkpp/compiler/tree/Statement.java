package org.talkpp.compiler.tree;

/**
 * Top-level statement of a program.
 */
public sealed interface Statement {

    record Conditional(ConditionalStatement statement) implements Statement {}

    record Action(ActionStatement statement) implements Statement {}

    record Assignment(AssignmentStatement statement) implements Statement {}

    /**
     * Free-form comment. The parser never produces it (the lexer drops comments), but trees
     * built programmatically may carry it and every backend renders it.
     */
    record Comment(String text) implements Statement {}
}
