package org.talkpp.compiler.tree;

import java.util.List;

/**
 * Root of the syntax tree: statements in source order.
 */
public record Program(List<Statement> statements) {

    public Program {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
