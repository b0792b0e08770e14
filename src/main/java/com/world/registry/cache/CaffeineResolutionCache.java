package com.world.registry.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.world.registry.core.model.IdentityKind;
import com.world.registry.resolve.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed resolution cache. Unresolved results are cached too, so repeated
 * misses skip the fuzzy stage.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, ResolutionResult> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<ResolutionResult> get(String normalizedQuery, IdentityKind kind) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(normalizedQuery, kind)));
    }

    @Override
    public void put(String normalizedQuery, IdentityKind kind, ResolutionResult result) {
        cache.put(new CacheKey(normalizedQuery, kind), result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated all entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Kind may be null (no filter).
     */
    record CacheKey(String normalizedQuery, IdentityKind kind) {}
}
