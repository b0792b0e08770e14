package com.world.registry.api;

import com.world.registry.cache.ResolutionCache;
import com.world.registry.canonical.CanonicalNameResolver;
import com.world.registry.core.model.Entity;
import com.world.registry.core.model.IdentityKind;
import com.world.registry.core.model.Player;
import com.world.registry.index.NameIndex;
import com.world.registry.index.NameIndexBuilder;
import com.world.registry.metrics.MetricsService;
import com.world.registry.metrics.NoOpMetricsService;
import com.world.registry.overlay.ChangeRecord;
import com.world.registry.overlay.EventOverlayMerger;
import com.world.registry.overlay.OverlayResult;
import com.world.registry.resolve.FuzzyResolver;
import com.world.registry.resolve.ResolutionResult;
import com.world.registry.store.DeclarationSource;
import com.world.registry.store.EntityStore;
import com.world.registry.store.EntityStoreBuilder;
import com.world.registry.store.StoreIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point wiring the full pipeline: store merge, canonical names, name index,
 * resolver and event overlay.
 *
 * <p>The overlay can add aliases and move entities, so after it runs canonical names are
 * recomputed and the index and resolver are rebuilt before the registry is handed out.
 * The built registry is read-only and safe for concurrent {@link #resolve} calls.</p>
 *
 * <pre>
 * WorldRegistry registry = WorldRegistry.builder()
 *     .addSource(baseRegistry)
 *     .players(players)
 *     .changeRecords(events)
 *     .options(RegistryOptions.builder().activeOn(now).build())
 *     .build();
 * ResolutionResult result = registry.resolve("Korma", IdentityKind.NPC);
 * </pre>
 */
public class WorldRegistry {
    private static final Logger log = LoggerFactory.getLogger(WorldRegistry.class);

    private final EntityStore store;
    private final List<Player> players;
    private final NameIndex index;
    private final FuzzyResolver resolver;
    private final OverlayResult overlayResult;
    private final RegistryOptions options;

    private WorldRegistry(EntityStore store, List<Player> players, NameIndex index, FuzzyResolver resolver,
                          OverlayResult overlayResult, RegistryOptions options) {
        this.store = store;
        this.players = players;
        this.index = index;
        this.resolver = resolver;
        this.overlayResult = overlayResult;
        this.options = options;
    }

    public ResolutionResult resolve(String query) {
        return resolver.resolve(query);
    }

    public ResolutionResult resolve(String query, IdentityKind kind) {
        return resolver.resolve(query, kind);
    }

    /**
     * Resolves a reference and maps it to a store entity; players without a store entity yield empty.
     */
    public Optional<Entity> resolveEntity(String query, IdentityKind kind) {
        return resolve(query, kind).getIdentity().flatMap(identity -> {
            if (identity instanceof Entity entity) {
                return Optional.of(entity);
            }
            return store.findSharingNames(identity).stream().findFirst();
        });
    }

    public EntityStore getStore() {
        return store;
    }

    public List<Player> getPlayers() {
        return players;
    }

    public NameIndex getIndex() {
        return index;
    }

    public FuzzyResolver getResolver() {
        return resolver;
    }

    public OverlayResult getOverlayResult() {
        return overlayResult;
    }

    public List<StoreIssue> getIssues() {
        return store.getIssues();
    }

    public RegistryOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<DeclarationSource> sources = new ArrayList<>();
        private final List<Player> players = new ArrayList<>();
        private final List<ChangeRecord> changeRecords = new ArrayList<>();
        private RegistryOptions options = RegistryOptions.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private ResolutionCache resolutionCache;

        /**
         * Adds a source with higher precedence than every source added before it.
         */
        public Builder addSource(DeclarationSource source) {
            sources.add(source);
            return this;
        }

        public Builder sources(List<DeclarationSource> values) {
            sources.addAll(values);
            return this;
        }

        public Builder players(List<Player> values) {
            players.addAll(values);
            return this;
        }

        public Builder changeRecords(List<ChangeRecord> values) {
            changeRecords.addAll(values);
            return this;
        }

        public Builder options(RegistryOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Overrides the cache created from {@link RegistryOptions#getCacheConfig()}.
         */
        public Builder resolutionCache(ResolutionCache resolutionCache) {
            this.resolutionCache = resolutionCache;
            return this;
        }

        public WorldRegistry build() {
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(metricsService, "metricsService is required");
            ResolutionCache cache = resolutionCache != null
                    ? resolutionCache
                    : options.getCacheConfig().createCache();
            // A supplied cache may hold results pointing at another registry's entities
            cache.invalidateAll();

            EntityStore store = EntityStoreBuilder.create()
                    .addSources(sources)
                    .activeOn(options.getActiveOn())
                    .parallelParsing(options.isParallelSourceParsing())
                    .metricsService(metricsService)
                    .build();

            new CanonicalNameResolver(store, options.getActiveOn(), metricsService).resolveAll();
            NameIndex index = buildIndex(store);
            FuzzyResolver resolver = new FuzzyResolver(index, cache, metricsService);

            OverlayResult overlay = OverlayResult.empty();
            if (!changeRecords.isEmpty()) {
                overlay = new EventOverlayMerger(store, resolver, metricsService).apply(changeRecords);
                if (!overlay.touchedEntities().isEmpty()) {
                    new CanonicalNameResolver(store, options.getActiveOn(), metricsService).resolveAll();
                    cache.invalidateAll();
                    index = buildIndex(store);
                    resolver = new FuzzyResolver(index, cache, metricsService);
                }
            }

            log.info("registry.built entities={} players={} keys={} issues={} overlayChanges={}",
                    store.size(), players.size(), index.size(), store.getIssues().size(), overlay.appliedChanges());
            return new WorldRegistry(store, List.copyOf(players), index, resolver, overlay, options);
        }

        private NameIndex buildIndex(EntityStore store) {
            return NameIndexBuilder.create()
                    .entities(store.entities())
                    .players(players)
                    .inflectionRules(options.getInflectionRules())
                    .minTokenLength(options.getMinTokenLength())
                    .activeOn(options.getActiveOn())
                    .metricsService(metricsService)
                    .build();
        }
    }
}
