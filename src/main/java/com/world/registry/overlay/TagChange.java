package com.world.registry.overlay;

import java.util.Objects;

/**
 * One tag/value pair carried by a change record. The raw value may include a date range.
 */
public record TagChange(String tag, String rawValue) {

    public TagChange {
        Objects.requireNonNull(tag, "tag is required");
        Objects.requireNonNull(rawValue, "rawValue is required");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
    }

    public static TagChange of(String tag, String rawValue) {
        return new TagChange(tag, rawValue);
    }
}
