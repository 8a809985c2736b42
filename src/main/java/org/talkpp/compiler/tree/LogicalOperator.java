package org.talkpp.compiler.tree;

public enum LogicalOperator {
    AND,
    OR
}
