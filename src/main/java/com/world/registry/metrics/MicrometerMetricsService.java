package com.world.registry.metrics;

import com.world.registry.resolve.MatchTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code registry.resolution.duration}: Timer (tag: tier)</li>
 *   <li>{@code registry.store.issues}: Counter</li>
 *   <li>{@code registry.canonical.cycles}: Counter</li>
 *   <li>{@code registry.index.size}: DistributionSummary</li>
 *   <li>{@code registry.overlay.applied}: Counter (changes applied)</li>
 *   <li>{@code registry.overlay.skipped}: Counter (records skipped)</li>
 *   <li>{@code registry.cache.hit}: Counter</li>
 *   <li>{@code registry.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<MatchTier, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter storeIssueCounter;
    private final Counter cycleCounter;
    private final DistributionSummary indexSizeSummary;
    private final Counter overlayAppliedCounter;
    private final Counter overlaySkippedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.storeIssueCounter = Counter.builder("registry.store.issues")
                .description("Number of malformed declaration lines skipped")
                .register(registry);
        this.cycleCounter = Counter.builder("registry.canonical.cycles")
                .description("Number of location containment cycles broken")
                .register(registry);
        this.indexSizeSummary = DistributionSummary.builder("registry.index.size")
                .description("Number of keys in each built name index")
                .register(registry);
        this.overlayAppliedCounter = Counter.builder("registry.overlay.applied")
                .description("Number of event changes appended to entity histories")
                .register(registry);
        this.overlaySkippedCounter = Counter.builder("registry.overlay.skipped")
                .description("Number of change records skipped for an unresolved target")
                .register(registry);
        this.cacheHitCounter = Counter.builder("registry.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("registry.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordResolution(MatchTier tier, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(tier, t ->
                Timer.builder("registry.resolution.duration")
                        .description("Duration of name resolution")
                        .tag("tier", t.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordStoreIssues(int count) {
        storeIssueCounter.increment(count);
    }

    @Override
    public void incrementCycleDetected() {
        cycleCounter.increment();
    }

    @Override
    public void recordIndexSize(int keys) {
        indexSizeSummary.record(keys);
    }

    @Override
    public void incrementOverlayApplied(int changes) {
        overlayAppliedCounter.increment(changes);
    }

    @Override
    public void incrementOverlaySkipped() {
        overlaySkippedCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
