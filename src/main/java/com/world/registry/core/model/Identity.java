package com.world.registry.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Anything that can own a name in the name index: store entities and external player records.
 */
public interface Identity {

    /**
     * Primary display name; the identity key.
     */
    String getName();

    /**
     * Every string that resolves to this identity, case-insensitive.
     */
    Set<String> getNames();

    /**
     * Aliases in effect at the given instant (all aliases when null).
     */
    List<String> getActiveAliases(Instant activeOn);

    /**
     * Secondary descriptors that are not names in their own right.
     */
    default List<String> getGenericNames() {
        return List.of();
    }

    IdentityKind getKind();

    String getCanonicalName();

    /**
     * Returns true if the given string is one of this identity's names.
     */
    default boolean hasName(String candidate) {
        return candidate != null && getNames().contains(candidate.trim());
    }

    /**
     * Returns true if this identity and the other share at least one name.
     */
    default boolean sharesNameWith(Identity other) {
        for (String name : other.getNames()) {
            if (getNames().contains(name)) {
                return true;
            }
        }
        return false;
    }
}
