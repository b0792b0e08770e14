package com.world.registry.metrics;

import com.world.registry.resolve.MatchTier;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(MatchTier tier, Duration duration) {
    }

    @Override
    public void recordStoreIssues(int count) {
    }

    @Override
    public void incrementCycleDetected() {
    }

    @Override
    public void recordIndexSize(int keys) {
    }

    @Override
    public void incrementOverlayApplied(int changes) {
    }

    @Override
    public void incrementOverlaySkipped() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
