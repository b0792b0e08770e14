package com.world.registry.rules;

import java.util.Objects;
import java.util.Optional;

/**
 * A consonant alternation undone when looking up an inflected form,
 * for example {@code dzie -> d} ("grodzie" back to "grod").
 *
 * @param inflectedEnding ending as it appears in the inflected form
 * @param baseEnding      ending of the base form
 */
public record StemAlternation(String inflectedEnding, String baseEnding) {

    public StemAlternation {
        Objects.requireNonNull(inflectedEnding, "inflectedEnding is required");
        Objects.requireNonNull(baseEnding, "baseEnding is required");
        if (inflectedEnding.isEmpty()) {
            throw new IllegalArgumentException("inflectedEnding must not be empty");
        }
    }

    /**
     * Returns the candidate base form, or empty if the word does not end with the inflected ending.
     */
    public Optional<String> reverse(String word) {
        if (word.length() <= inflectedEnding.length() || !word.endsWith(inflectedEnding)) {
            return Optional.empty();
        }
        return Optional.of(word.substring(0, word.length() - inflectedEnding.length()) + baseEnding);
    }
}
