package com.world.registry.index;

/**
 * Priority tier of an index key. A higher tier always overwrites a lower one for the same key.
 */
public enum IndexPriority {
    /**
     * Whitespace token of a multi-word name, or a generic secondary name.
     */
    TOKEN(1),

    /**
     * Full primary name or active alias.
     */
    FULL_NAME_OR_ALIAS(2);

    private final int rank;

    IndexPriority(int rank) {
        this.rank = rank;
    }

    public boolean isHigherThan(IndexPriority other) {
        return rank > other.rank;
    }
}
