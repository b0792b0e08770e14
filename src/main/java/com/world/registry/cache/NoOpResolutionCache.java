package com.world.registry.cache;

import com.world.registry.core.model.IdentityKind;
import com.world.registry.resolve.ResolutionResult;

import java.util.Optional;

/**
 * No-op cache used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<ResolutionResult> get(String normalizedQuery, IdentityKind kind) {
        return Optional.empty();
    }

    @Override
    public void put(String normalizedQuery, IdentityKind kind, ResolutionResult result) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
