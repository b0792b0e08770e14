package com.world.registry.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Declared type of a world entity.
 * Each type knows its canonical-name label and the section labels it is declared under.
 */
public enum EntityType {
    NPC("NPC", IdentityKind.NPC,
            "npc", "npcs", "postacie", "postacie niezależne", "bn"),
    ORGANIZATION("Organization", IdentityKind.ORGANIZATION,
            "organization", "organizations", "organizacja", "organizacje", "frakcje"),
    LOCATION("Location", IdentityKind.LOCATION,
            "location", "locations", "lokacja", "lokacje", "miejsca"),
    PLAYER("Player", IdentityKind.PLAYER,
            "player", "players", "gracz", "gracze"),
    PLAYER_CHARACTER("PlayerCharacter", IdentityKind.PLAYER,
            "player character", "player characters", "postać gracza", "postaci graczy", "pc"),
    ITEM("Item", IdentityKind.ITEM,
            "item", "items", "przedmiot", "przedmioty");

    private final String label;
    private final IdentityKind kind;
    private final Set<String> sectionLabels;

    EntityType(String label, IdentityKind kind, String... sectionLabels) {
        this.label = label;
        this.kind = kind;
        this.sectionLabels = Set.of(sectionLabels);
    }

    public String getLabel() {
        return label;
    }

    /**
     * Logical identity class; both PLAYER and PLAYER_CHARACTER map to {@link IdentityKind#PLAYER}.
     */
    public IdentityKind getKind() {
        return kind;
    }

    /**
     * Maps a declaration section label (English or Polish, case-insensitive) to a type.
     */
    public static Optional<EntityType> fromSectionLabel(String sectionLabel) {
        if (sectionLabel == null) {
            return Optional.empty();
        }
        String normalized = sectionLabel.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.sectionLabels.contains(normalized) || type.label.equalsIgnoreCase(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
