package com.world.registry.store;

import java.util.List;
import java.util.Objects;

/**
 * One already-tokenized declaration source (for example a registry file).
 *
 * @param sourceId identifier used in diagnostics and entity provenance
 * @param sections typed section blocks, in document order
 */
public record DeclarationSource(String sourceId, List<DeclarationSection> sections) {

    public DeclarationSource {
        Objects.requireNonNull(sourceId, "sourceId is required");
        sections = sections != null ? List.copyOf(sections) : List.of();
    }

    public static DeclarationSource of(String sourceId, DeclarationSection... sections) {
        return new DeclarationSource(sourceId, List.of(sections));
    }
}
