package com.world.registry.temporal;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of parsing a raw {@code "<text> (<start>:<end>)"} string.
 *
 * @param text      the value text with any validity suffix removed
 * @param validFrom parsed start bound, or null
 * @param validTo   parsed end bound, or null
 * @param scoped    true when the raw string carried a validity range with at least one usable bound
 */
public record TemporalValue(String text, Instant validFrom, Instant validTo, boolean scoped) {

    public TemporalValue {
        Objects.requireNonNull(text, "text is required");
    }

    public static TemporalValue unscoped(String text) {
        return new TemporalValue(text, null, null, false);
    }

    /**
     * Converts to a time-scoped entry using the parsed bounds.
     */
    public TimeScoped<String> toTimeScoped() {
        return new TimeScoped<>(text, validFrom, validTo);
    }

    /**
     * Converts to a time-scoped entry; values without an explicit range start at the fallback instant.
     */
    public TimeScoped<String> toTimeScoped(Instant fallbackValidFrom) {
        if (validFrom != null || validTo != null) {
            return toTimeScoped();
        }
        return new TimeScoped<>(text, fallbackValidFrom, null);
    }
}
