package com.world.registry.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identity record for a real-world player, supplied alongside the entity store.
 * A player and the PLAYER-kind entity sharing one of its names are the same identity;
 * the player record takes precedence in the name index.
 */
public final class Player implements Identity {
    private final String name;
    private final List<String> aliases;
    private final Set<String> names;

    public Player(String name, List<String> aliases) {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name.trim();
        this.aliases = aliases != null ? aliases.stream().map(String::trim).filter(a -> !a.isEmpty()).toList() : List.of();
        Set<String> all = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        all.add(this.name);
        all.addAll(this.aliases);
        this.names = Collections.unmodifiableSet(all);
    }

    public static Player of(String name, String... aliases) {
        return new Player(name, List.of(aliases));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    @Override
    public Set<String> getNames() {
        return names;
    }

    /**
     * Player aliases carry no validity range.
     */
    @Override
    public List<String> getActiveAliases(Instant activeOn) {
        return aliases;
    }

    @Override
    public IdentityKind getKind() {
        return IdentityKind.PLAYER;
    }

    @Override
    public String getCanonicalName() {
        return EntityType.PLAYER.getLabel() + "/" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Player player = (Player) o;
        return name.equalsIgnoreCase(player.name);
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return "Player{name='" + name + "', aliases=" + aliases + '}';
    }
}
