package com.world.registry.metrics;

import com.world.registry.resolve.MatchTier;

import java.time.Duration;

/**
 * Interface for recording registry metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordResolution(MatchTier tier, Duration duration);

    void recordStoreIssues(int count);

    void incrementCycleDetected();

    void recordIndexSize(int keys);

    void incrementOverlayApplied(int changes);

    void incrementOverlaySkipped();

    void recordCacheHit();

    void recordCacheMiss();
}
