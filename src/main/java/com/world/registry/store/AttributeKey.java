package com.world.registry.store;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Attribute tags with special behavior. Any other tag is stored as a generic override.
 */
public enum AttributeKey {
    LOCATION("location", "lokacja", "lokalizacja", "położenie"),
    ACCESS_LINK("access-link", "access link", "dostęp", "połączenie"),
    TYPE_OVERRIDE("type-override", "type override", "typ"),
    OWNER("owner", "właściciel"),
    GROUP("group", "grupa", "frakcja"),
    ALIAS("alias", "aliasy", "pseudonim"),
    GENERIC_NAME("generic-name", "generic name", "nazwa ogólna", "nazwa generyczna"),
    STATUS("status"),
    QUANTITY("quantity", "ilość", "liczba"),
    CONTAINS("contains", "zawiera");

    private final Set<String> tags;

    AttributeKey(String... tags) {
        this.tags = Set.of(tags);
    }

    /**
     * Maps a raw tag (English or Polish, case-insensitive) to a known key.
     */
    public static Optional<AttributeKey> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (AttributeKey key : values()) {
            if (key.tags.contains(normalized)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
