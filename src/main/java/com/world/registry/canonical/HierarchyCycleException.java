package com.world.registry.canonical;

import java.util.List;

/**
 * Signals that a location walk revisited a name. Caught by {@link CanonicalNameResolver}.
 */
class HierarchyCycleException extends RuntimeException {

    private final List<String> path;

    HierarchyCycleException(List<String> path) {
        super("Location hierarchy cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    String getPath() {
        return String.join(" -> ", path);
    }
}
