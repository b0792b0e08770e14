package com.world.registry.cdi;

import com.world.registry.api.RegistryOptions;
import com.world.registry.cache.CacheConfig;
import com.world.registry.cache.ResolutionCache;
import com.world.registry.temporal.TemporalParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * CDI producer that builds registry configuration from MicroProfile Config properties.
 *
 * <p>In a CDI container (e.g., Quarkus) the produced beans can be injected and passed to
 * {@link com.world.registry.api.WorldRegistry.Builder}:</p>
 * <pre>
 * world-registry:
 *   active-on: 2025-06-01
 *   index:
 *     min-token-length: 3
 *   cache:
 *     enabled: true
 * </pre>
 */
@ApplicationScoped
public class WorldRegistryProducer {

    private static final Logger log = LoggerFactory.getLogger(WorldRegistryProducer.class);

    // ── Timeline ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "world-registry.active-on")
    Optional<String> activeOn;

    // ── Index ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "world-registry.index.min-token-length", defaultValue = "3")
    int minTokenLength;

    @Inject
    @ConfigProperty(name = "world-registry.index.min-stem-length", defaultValue = "3")
    int minStemLength;

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "world-registry.store.parallel-parsing", defaultValue = "false")
    boolean parallelParsing;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "world-registry.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "world-registry.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "world-registry.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    @Produces
    @ApplicationScoped
    public CacheConfig cacheConfig() {
        return cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled();
    }

    @Produces
    @ApplicationScoped
    public RegistryOptions registryOptions(CacheConfig cacheConfig) {
        Instant instant = activeOn.filter(value -> !value.isBlank())
                .map(WorldRegistryProducer::parseActiveOn)
                .orElse(null);
        RegistryOptions options = RegistryOptions.builder()
                .activeOn(instant)
                .minTokenLength(minTokenLength)
                .minStemLength(minStemLength)
                .parallelSourceParsing(parallelParsing)
                .cacheConfig(cacheConfig)
                .build();
        log.info("Producing RegistryOptions: activeOn={} minTokenLength={} minStemLength={} cache={}",
                instant, minTokenLength, minStemLength, cacheConfig.enabled());
        return options;
    }

    @Produces
    @ApplicationScoped
    public ResolutionCache resolutionCache(CacheConfig cacheConfig) {
        return cacheConfig.createCache();
    }

    static Instant parseActiveOn(String value) {
        Instant instant = TemporalParser.parseStartBound(value);
        if (instant == null) {
            throw new IllegalArgumentException("world-registry.active-on is not a valid date: '" + value + "'");
        }
        return instant;
    }
}
