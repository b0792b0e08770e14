package com.world.registry.core.model;

/**
 * Logical kind of an identity, used to filter resolution.
 * Players and player characters share {@link #PLAYER}.
 */
public enum IdentityKind {
    NPC,
    ORGANIZATION,
    LOCATION,
    PLAYER,
    ITEM
}
