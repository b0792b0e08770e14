package com.world.registry.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of an entity. Entities are never deleted; removal is a status change.
 */
public enum EntityStatus {
    /**
     * Default status of every entity without a status history.
     */
    ACTIVE("aktywny", "aktywna", "aktywne"),

    INACTIVE("nieaktywny", "nieaktywna", "nieaktywne"),

    /**
     * Soft-removed. The entity stays resolvable for historical queries.
     */
    REMOVED("usunięty", "usunięta", "usunięte");

    private final String[] synonyms;

    EntityStatus(String... synonyms) {
        this.synonyms = synonyms;
    }

    /**
     * Parses a status name or Polish synonym, case-insensitive.
     */
    public static Optional<EntityStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityStatus status : values()) {
            if (status.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(status);
            }
            for (String synonym : status.synonyms) {
                if (synonym.equals(normalized)) {
                    return Optional.of(status);
                }
            }
        }
        return Optional.empty();
    }
}
