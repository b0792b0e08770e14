package com.world.registry.store;

import java.util.List;
import java.util.Objects;

/**
 * A section block whose label selects the entity type of its declarations.
 *
 * @param label    section label such as {@code "NPC"} or {@code "Lokacje"}
 * @param entities entity declarations in the section
 */
public record DeclarationSection(String label, List<EntityDeclaration> entities) {

    public DeclarationSection {
        Objects.requireNonNull(label, "label is required");
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public static DeclarationSection of(String label, EntityDeclaration... entities) {
        return new DeclarationSection(label, List.of(entities));
    }
}
