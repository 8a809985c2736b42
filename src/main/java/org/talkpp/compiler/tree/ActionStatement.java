package org.talkpp.compiler.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A verb with an optional target and service: {@code send welcome message using Twilio}.
 */
public record ActionStatement(
 Action action,
 Optional<Expression> target,
 Optional<ServiceCall> service,
 Map<String, Expression> parameters) {

    public ActionStatement {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ActionStatement of(Action action, Optional<Expression> target, Optional<ServiceCall> service) {
        return new ActionStatement(action, target, service, Map.of());
    }
}
