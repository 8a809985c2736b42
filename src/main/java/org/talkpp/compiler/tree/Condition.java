package org.talkpp.compiler.tree;

import java.util.Optional;

/**
 * Condition of an {@code if}/{@code when} statement.
 */
public sealed interface Condition {

    /**
     * Event match: {@code new user registers in "signup"}.
     * The last word is the action, the words before it form the subject.
     */
    record Event(String subject, String action, Optional<String> context) implements Condition {

        /**
         * Trigger tag matched against the incoming event type: subject words joined with '_',
         * followed by '_' and the action.
         */
        public String triggerTag() {
            return subject.replace(" ", "_") + "_" + action;
        }
    }

    /**
     * Binary comparison: left op right
     */
    record Comparison(Expression left, ComparisonOperator operator, Expression right) implements Condition {}

    /**
     * Conjunction or disjunction of two conditions. Chains fold to the left.
     */
    record Logical(Condition left, LogicalOperator operator, Condition right) implements Condition {}
}
