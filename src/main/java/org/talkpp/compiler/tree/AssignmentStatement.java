package org.talkpp.compiler.tree;

/**
 * Local binding: {@code retries: 3}.
 */
public record AssignmentStatement(String variable, Expression value) {}
