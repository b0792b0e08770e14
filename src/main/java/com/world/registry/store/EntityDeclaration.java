package com.world.registry.store;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single entity block: its name and raw {@code tag: value} attribute lines.
 */
public record EntityDeclaration(String name, List<AttributeLine> attributes) {

    public EntityDeclaration {
        Objects.requireNonNull(name, "name is required");
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }

    /**
     * Convenience factory for single-line attributes.
     */
    public static EntityDeclaration of(String name, String... lines) {
        return new EntityDeclaration(name, Arrays.stream(lines).map(AttributeLine::of).toList());
    }
}
