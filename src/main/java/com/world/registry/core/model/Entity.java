package com.world.registry.core.model;

import com.world.registry.temporal.History;
import com.world.registry.temporal.TimeScoped;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A uniquely-named, typed world record with temporally-scoped attributes.
 *
 * <p>The name is the identity key: two entities are equal when their names match
 * case-insensitively. Every tracked property keeps its full history; the active
 * projection is cached by {@link #refreshActive(Instant)} and recomputed whenever
 * histories change.</p>
 */
public class Entity implements Identity {
    private final String name;
    private final EntityType type;
    private final Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    private final List<String> sourceIds = new ArrayList<>();
    private String canonicalName;

    private final History<String> location = new History<>();
    private final History<String> accessLinks = new History<>();
    private final History<String> typeOverride = new History<>();
    private final History<String> owner = new History<>();
    private final History<String> groups = new History<>();
    private final History<EntityStatus> status = new History<>();
    private final History<Integer> quantity = new History<>();
    private final History<String> aliases = new History<>();
    private final List<String> genericNames = new ArrayList<>();
    private final List<String> contains = new ArrayList<>();
    private final Map<String, History<String>> overrides = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    // Active projection as of the last refresh
    private String activeLocation;
    private List<String> activeAccessLinks = List.of();
    private String activeTypeOverride;
    private String activeOwner;
    private List<String> activeGroups = List.of();
    private EntityStatus activeStatus = EntityStatus.ACTIVE;
    private Integer activeQuantity;

    private Entity(Builder builder) {
        this.name = builder.name.trim();
        this.type = builder.type;
        this.names.add(this.name);
        if (builder.sourceId != null) {
            this.sourceIds.add(builder.sourceId);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    public EntityType getType() {
        return type;
    }

    @Override
    public IdentityKind getKind() {
        return type.getKind();
    }

    @Override
    public Set<String> getNames() {
        return Collections.unmodifiableSet(names);
    }

    /**
     * Returns the memoized canonical name, or the flat {@code Type/Name} form when none was resolved.
     */
    @Override
    public String getCanonicalName() {
        return canonicalName != null ? canonicalName : flatCanonicalName();
    }

    public String flatCanonicalName() {
        return type.getLabel() + "/" + name;
    }

    public void setCanonicalName(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public boolean hasResolvedCanonicalName() {
        return canonicalName != null;
    }

    public List<String> getSourceIds() {
        return Collections.unmodifiableList(sourceIds);
    }

    public void addSourceId(String sourceId) {
        if (sourceId != null && !sourceIds.contains(sourceId)) {
            sourceIds.add(sourceId);
        }
    }

    // ============ Mutation (append-only) ============

    public void addLocation(TimeScoped<String> entry) {
        location.add(entry);
    }

    public void addAccessLink(TimeScoped<String> entry) {
        accessLinks.add(entry);
    }

    public void addTypeOverride(TimeScoped<String> entry) {
        typeOverride.add(entry);
    }

    public void addOwner(TimeScoped<String> entry) {
        owner.add(entry);
    }

    public void addGroup(TimeScoped<String> entry) {
        groups.add(entry);
    }

    public void addStatus(TimeScoped<EntityStatus> entry) {
        status.add(entry);
    }

    public void addQuantity(TimeScoped<Integer> entry) {
        quantity.add(entry);
    }

    public void addAlias(TimeScoped<String> entry) {
        aliases.add(entry);
        names.add(entry.value().trim());
    }

    public void addGenericName(String genericName) {
        String trimmed = genericName.trim();
        if (!containsIgnoreCase(genericNames, trimmed)) {
            genericNames.add(trimmed);
        }
        names.add(trimmed);
    }

    public void addContains(String childName) {
        String trimmed = childName.trim();
        if (!containsIgnoreCase(contains, trimmed)) {
            contains.add(trimmed);
        }
    }

    public void addOverride(String tag, TimeScoped<String> entry) {
        overrides.computeIfAbsent(tag.trim(), k -> new History<>()).add(entry);
    }

    /**
     * Sorts every history by validFrom, nulls first.
     */
    public void sortHistories() {
        location.sort();
        accessLinks.sort();
        typeOverride.sort();
        owner.sort();
        groups.sort();
        status.sort();
        quantity.sort();
        aliases.sort();
        overrides.values().forEach(History::sort);
    }

    /**
     * Sorts histories and recomputes the cached active projection as of the given instant.
     */
    public void refreshActive(Instant activeOn) {
        sortHistories();
        this.activeLocation = location.activeAt(activeOn).orElse(null);
        this.activeAccessLinks = List.copyOf(accessLinks.allActiveAt(activeOn));
        this.activeTypeOverride = typeOverride.activeAt(activeOn).orElse(null);
        this.activeOwner = owner.activeAt(activeOn).orElse(null);
        this.activeGroups = List.copyOf(groups.allActiveAt(activeOn));
        this.activeStatus = status.activeAt(activeOn).orElse(EntityStatus.ACTIVE);
        this.activeQuantity = quantity.activeAt(activeOn).orElse(null);
    }

    // ============ Histories ============

    public History<String> getLocationHistory() {
        return location;
    }

    public History<String> getAccessLinkHistory() {
        return accessLinks;
    }

    public History<String> getTypeOverrideHistory() {
        return typeOverride;
    }

    public History<String> getOwnerHistory() {
        return owner;
    }

    public History<String> getGroupHistory() {
        return groups;
    }

    public History<EntityStatus> getStatusHistory() {
        return status;
    }

    public History<Integer> getQuantityHistory() {
        return quantity;
    }

    public History<String> getAliasHistory() {
        return aliases;
    }

    public List<String> getGenericNames() {
        return Collections.unmodifiableList(genericNames);
    }

    public List<String> getContains() {
        return Collections.unmodifiableList(contains);
    }

    public Map<String, History<String>> getOverrides() {
        return Collections.unmodifiableMap(overrides);
    }

    // ============ Active projection (cached) ============

    public Optional<String> getActiveLocation() {
        return Optional.ofNullable(activeLocation);
    }

    public List<String> getActiveAccessLinks() {
        return activeAccessLinks;
    }

    public Optional<String> getActiveTypeOverride() {
        return Optional.ofNullable(activeTypeOverride);
    }

    public Optional<String> getActiveOwner() {
        return Optional.ofNullable(activeOwner);
    }

    public List<String> getActiveGroups() {
        return activeGroups;
    }

    public EntityStatus getActiveStatus() {
        return activeStatus;
    }

    public Optional<Integer> getActiveQuantity() {
        return Optional.ofNullable(activeQuantity);
    }

    // ============ Active projection (as of an arbitrary instant) ============

    public Optional<String> locationAt(Instant activeOn) {
        return location.activeAt(activeOn);
    }

    public List<String> accessLinksAt(Instant activeOn) {
        return accessLinks.allActiveAt(activeOn);
    }

    public Optional<String> ownerAt(Instant activeOn) {
        return owner.activeAt(activeOn);
    }

    public List<String> groupsAt(Instant activeOn) {
        return groups.allActiveAt(activeOn);
    }

    public EntityStatus statusAt(Instant activeOn) {
        return status.activeAt(activeOn).orElse(EntityStatus.ACTIVE);
    }

    public Optional<Integer> quantityAt(Instant activeOn) {
        return quantity.activeAt(activeOn);
    }

    public Optional<String> overrideAt(String tag, Instant activeOn) {
        History<String> history = overrides.get(tag);
        return history == null ? Optional.empty() : history.activeAt(activeOn);
    }

    @Override
    public List<String> getActiveAliases(Instant activeOn) {
        return aliases.allActiveAt(activeOn);
    }

    public boolean isActive() {
        return activeStatus == EntityStatus.ACTIVE;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        for (String value : values) {
            if (value.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return name.equalsIgnoreCase(entity.name);
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return "Entity{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", canonicalName='" + getCanonicalName() + '\'' +
                ", status=" + activeStatus +
                ", names=" + names +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private EntityType type;
        private String sourceId;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            return new Entity(this);
        }
    }
}
