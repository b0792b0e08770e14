package com.world.registry.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Language-specific inflection data for morphological matching: an ordered suffix list
 * (always tried longest first) and a table of stem alternations.
 *
 * <p>Operates on keys that are already normalized (lowercase).</p>
 */
public final class InflectionRules {

    private final List<String> suffixes;
    private final List<StemAlternation> alternations;
    private final int minStemLength;

    private InflectionRules(Builder builder) {
        List<String> sorted = new ArrayList<>(builder.suffixes);
        // Stable sort keeps declaration order among equal lengths
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.suffixes = List.copyOf(sorted);
        this.alternations = List.copyOf(builder.alternations);
        this.minStemLength = builder.minStemLength;
    }

    /**
     * Polish nominal and adjectival case endings with the common final-consonant alternations.
     */
    public static InflectionRules polish() {
        return builder()
                .suffixes("owie", "ami", "ach", "owi", "ego", "emu", "iem", "ów", "om", "em",
                        "ie", "ą", "ę", "a", "u", "y", "i", "e", "o")
                .alternation("dzie", "d")
                .alternation("cie", "t")
                .alternation("rze", "r")
                .alternation("le", "ł")
                .alternation("ce", "k")
                .alternation("dze", "g")
                .alternation("sze", "ch")
                .alternation("ca", "iec")
                .alternation("ka", "ek")
                .alternation("ku", "ek")
                .build();
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    public List<StemAlternation> getAlternations() {
        return alternations;
    }

    public int getMinStemLength() {
        return minStemLength;
    }

    /**
     * Returns every stem obtained by removing one suffix, longest suffix first,
     * keeping only stems of at least the minimum length.
     */
    public List<String> strippedStems(String word) {
        List<String> stems = new ArrayList<>();
        for (String suffix : suffixes) {
            if (word.endsWith(suffix) && word.length() - suffix.length() >= minStemLength) {
                stems.add(word.substring(0, word.length() - suffix.length()));
            }
        }
        return stems;
    }

    /**
     * Returns the stem for the longest matching suffix, if any.
     */
    public Optional<String> stem(String word) {
        List<String> stems = strippedStems(word);
        return stems.isEmpty() ? Optional.empty() : Optional.of(stems.get(0));
    }

    /**
     * Returns candidate base forms from every alternation rule the word matches.
     */
    public List<String> alternationCandidates(String word) {
        List<String> candidates = new ArrayList<>();
        for (StemAlternation alternation : alternations) {
            alternation.reverse(word)
                    .filter(c -> c.length() >= minStemLength)
                    .filter(c -> !candidates.contains(c))
                    .ifPresent(candidates::add);
        }
        return candidates;
    }

    /**
     * Returns a copy of these rules with a different minimum stem length.
     */
    public InflectionRules withMinStemLength(int minStemLength) {
        Builder builder = builder().minStemLength(minStemLength);
        builder.suffixes.addAll(suffixes);
        builder.alternations.addAll(alternations);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> suffixes = new ArrayList<>();
        private final List<StemAlternation> alternations = new ArrayList<>();
        private int minStemLength = 3;

        public Builder suffixes(String... values) {
            for (String value : values) {
                Objects.requireNonNull(value, "suffix is required");
                if (!value.isEmpty() && !suffixes.contains(value)) {
                    suffixes.add(value);
                }
            }
            return this;
        }

        public Builder alternation(String inflectedEnding, String baseEnding) {
            alternations.add(new StemAlternation(inflectedEnding, baseEnding));
            return this;
        }

        public Builder minStemLength(int minStemLength) {
            if (minStemLength < 1) {
                throw new IllegalArgumentException("minStemLength must be positive");
            }
            this.minStemLength = minStemLength;
            return this;
        }

        public InflectionRules build() {
            return new InflectionRules(this);
        }
    }
}
