package com.world.registry.store;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.EntityType;
import com.world.registry.core.model.Identity;
import com.world.registry.core.model.IdentityKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Merged collection of entities keyed case-insensitively by name, in first-declaration order.
 * Built by {@link EntityStoreBuilder}; entities are only ever appended to afterwards.
 */
public class EntityStore {

    private final Map<String, Entity> byName;
    private final List<StoreIssue> issues;
    private final Instant activeOn;

    EntityStore(Map<String, Entity> byName, List<StoreIssue> issues, Instant activeOn) {
        this.byName = new LinkedHashMap<>(byName);
        this.issues = List.copyOf(issues);
        this.activeOn = activeOn;
    }

    /**
     * Looks up an entity by its primary name.
     */
    public Optional<Entity> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(key(name)));
    }

    /**
     * Looks up an entity by primary name first, then by alias or generic name.
     * When several entities share the alias, the first declared one wins.
     */
    public Optional<Entity> findByAnyName(String name) {
        Optional<Entity> primary = findByName(name);
        if (primary.isPresent() || name == null) {
            return primary;
        }
        for (Entity entity : byName.values()) {
            if (entity.hasName(name)) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns every entity of the given identity's kind that shares one of its names.
     */
    public List<Entity> findSharingNames(Identity identity) {
        List<Entity> matches = new ArrayList<>();
        for (Entity entity : byName.values()) {
            if (entity.getKind() == identity.getKind() && entity.sharesNameWith(identity)) {
                matches.add(entity);
            }
        }
        return matches;
    }

    public Collection<Entity> entities() {
        return Collections.unmodifiableCollection(byName.values());
    }

    public List<Entity> ofType(EntityType type) {
        return byName.values().stream().filter(e -> e.getType() == type).toList();
    }

    public List<Entity> ofKind(IdentityKind kind) {
        return byName.values().stream().filter(e -> e.getKind() == kind).toList();
    }

    public int size() {
        return byName.size();
    }

    public List<StoreIssue> getIssues() {
        return issues;
    }

    /**
     * The instant the cached active projections were computed for; null means unscoped.
     */
    public Instant getActiveOn() {
        return activeOn;
    }

    static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
