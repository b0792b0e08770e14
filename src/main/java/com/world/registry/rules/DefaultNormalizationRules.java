package com.world.registry.rules;

import java.util.List;

/**
 * Built-in rules for names written in campaign notes: markdown emphasis, wiki-link
 * brackets, surrounding quotes and typographic dashes are stripped before keying.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getRules());
    }

    public static List<NormalizationRule> getRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("markdown-emphasis")
                        .pattern("[*_`~]+")
                        .replacement("")
                        .priority(10)
                        .build(),

                // [[Erathia]] or [Erathia](link)
                NormalizationRule.builder()
                        .name("wiki-link")
                        .pattern("\\[\\[([^\\]]*)\\]\\]|\\[([^\\]]*)\\]\\([^)]*\\)")
                        .replacement("$1$2")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("quotes")
                        .pattern("[\"'„”“«»]")
                        .replacement("")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("dashes")
                        .pattern("[‐‑‒–—―]")
                        .replacement("-")
                        .priority(40)
                        .build(),

                NormalizationRule.builder()
                        .name("trailing-punctuation")
                        .pattern("[.,;:!?]+$")
                        .replacement("")
                        .priority(50)
                        .build()
        );
    }
}
