package com.world.registry.store;

import java.util.List;
import java.util.Objects;

/**
 * A raw attribute line plus any indented continuation lines belonging to it.
 *
 * @param text         the {@code tag: value} line
 * @param continuation continuation lines, concatenated into the value
 */
public record AttributeLine(String text, List<String> continuation) {

    public AttributeLine {
        Objects.requireNonNull(text, "text is required");
        continuation = continuation != null ? List.copyOf(continuation) : List.of();
    }

    public static AttributeLine of(String text) {
        return new AttributeLine(text, List.of());
    }

    public static AttributeLine multiline(String text, String... continuation) {
        return new AttributeLine(text, List.of(continuation));
    }
}
