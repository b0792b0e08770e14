package com.world.registry.cache;

import com.world.registry.core.model.IdentityKind;
import com.world.registry.resolve.ResolutionResult;

import java.util.Optional;

/**
 * Cache of resolution results keyed by normalized query and optional kind filter.
 * Implementations must be safe for concurrent use.
 */
public interface ResolutionCache {

    /**
     * @param normalizedQuery the normalized query text
     * @param kind            the kind filter, or null for none
     * @return the cached result, or empty if not cached
     */
    Optional<ResolutionResult> get(String normalizedQuery, IdentityKind kind);

    void put(String normalizedQuery, IdentityKind kind, ResolutionResult result);

    /**
     * Drops every entry. Called whenever the underlying index is rebuilt.
     */
    void invalidateAll();

    CacheStats getStats();
}
