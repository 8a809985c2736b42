package org.talkpp.compiler.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * External integration attached to an action with {@code using} or {@code with}.
 */
public record ServiceCall(String name, Optional<String> method, Map<String, Expression> config) {

    public ServiceCall {
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public static ServiceCall named(String name) {
        return new ServiceCall(name, Optional.empty(), Map.of());
    }
}
