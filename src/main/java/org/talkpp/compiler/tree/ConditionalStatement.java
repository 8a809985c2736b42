package org.talkpp.compiler.tree;

import java.util.List;
import java.util.Optional;

public record ConditionalStatement(
 Condition condition,
 List<ActionStatement> thenActions,
 Optional<List<ActionStatement>> elseActions) {

    public ConditionalStatement {
        thenActions = List.copyOf(thenActions);
        elseActions = elseActions.map(List::copyOf);
    }
}
