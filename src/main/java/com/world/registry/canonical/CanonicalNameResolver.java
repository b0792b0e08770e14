package com.world.registry.canonical;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.EntityType;
import com.world.registry.logging.LogContext;
import com.world.registry.metrics.MetricsService;
import com.world.registry.metrics.NoOpMetricsService;
import com.world.registry.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives canonical names for every entity in a store.
 *
 * <p>Non-location entities get the flat form {@code Type/Name}. A location's path is its
 * parent's path plus {@code /Name}, where the parent is the last active location entry or,
 * failing that, the first active access link. A parent that is not a known location becomes
 * a literal path segment. Containment cycles are broken by falling back to the flat form.</p>
 *
 * <p>Completed walks are memoized across the whole entity set so shared ancestors are
 * resolved once. Cycle fallbacks are not memoized, so every member of a cycle detects
 * the cycle on its own walk and falls back to its own flat name.</p>
 */
public class CanonicalNameResolver {
    private static final Logger log = LoggerFactory.getLogger(CanonicalNameResolver.class);

    private final EntityStore store;
    private final Instant activeOn;
    private final MetricsService metricsService;
    private final Map<String, String> memo = new HashMap<>();

    public CanonicalNameResolver(EntityStore store, Instant activeOn) {
        this(store, activeOn, new NoOpMetricsService());
    }

    public CanonicalNameResolver(EntityStore store, Instant activeOn, MetricsService metricsService) {
        this.store = store;
        this.activeOn = activeOn;
        this.metricsService = metricsService;
    }

    /**
     * Resolves and assigns canonical names for all entities in the store.
     *
     * @return number of hierarchy cycles that were broken
     */
    public int resolveAll() {
        try (LogContext ctx = LogContext.forBuild("canonical")) {
            memo.clear();
            int cycles = 0;
            for (Entity entity : store.entities()) {
                String before = memo.get(key(entity.getName()));
                String resolved = before != null ? before : resolveTracked(entity);
                if (resolved == null) {
                    cycles++;
                    resolved = entity.flatCanonicalName();
                }
                entity.setCanonicalName(resolved);
            }
            log.info("canonical.resolved entities={} cycles={}", store.size(), cycles);
            return cycles;
        }
    }

    /**
     * Resolves the canonical name of a single entity, using and filling the memo.
     */
    public String resolve(Entity entity) {
        String cached = memo.get(key(entity.getName()));
        if (cached != null) {
            return cached;
        }
        String resolved = resolveTracked(entity);
        return resolved != null ? resolved : entity.flatCanonicalName();
    }

    /**
     * Returns null when a cycle forced the flat fallback.
     */
    private String resolveTracked(Entity entity) {
        if (entity.getType() != EntityType.LOCATION) {
            String flat = entity.flatCanonicalName();
            memo.put(key(entity.getName()), flat);
            return flat;
        }
        try {
            return walk(entity, new LinkedHashSet<>());
        } catch (HierarchyCycleException e) {
            metricsService.incrementCycleDetected();
            log.warn("canonical.cycle entity='{}' path={} fallback='{}'",
                    entity.getName(), e.getPath(), entity.flatCanonicalName());
            return null;
        }
    }

    private String walk(Entity location, Set<String> visited) {
        String k = key(location.getName());
        String cached = memo.get(k);
        if (cached != null) {
            return cached;
        }
        if (!visited.add(k)) {
            List<String> path = new ArrayList<>(visited);
            path.add(k);
            throw new HierarchyCycleException(path);
        }

        String path;
        Optional<String> parentName = parentOf(location);
        if (parentName.isEmpty()) {
            path = location.flatCanonicalName();
        } else {
            Optional<Entity> parent = store.findByAnyName(parentName.get());
            if (parent.isPresent() && parent.get().getType() == EntityType.LOCATION) {
                path = walk(parent.get(), visited) + "/" + location.getName();
            } else {
                log.debug("canonical.parent.literal entity='{}' parent='{}'", location.getName(), parentName.get());
                path = EntityType.LOCATION.getLabel() + "/" + parentName.get() + "/" + location.getName();
            }
        }
        memo.put(k, path);
        return path;
    }

    private Optional<String> parentOf(Entity location) {
        Optional<String> parent = location.locationAt(activeOn);
        if (parent.isPresent()) {
            return parent;
        }
        return location.getAccessLinkHistory().firstActiveAt(activeOn);
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
