package com.world.registry.metrics;

import com.world.registry.resolve.MatchTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolution(MatchTier.FUZZY, Duration.ofMillis(3));
                noOp.recordStoreIssues(2);
                noOp.incrementCycleDetected();
                noOp.recordIndexSize(100);
                noOp.incrementOverlayApplied(4);
                noOp.incrementOverlaySkipped();
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record resolution duration per tier")
        void recordResolution() {
            metrics.recordResolution(MatchTier.EXACT, Duration.ofMillis(1));
            metrics.recordResolution(MatchTier.EXACT, Duration.ofMillis(2));
            metrics.recordResolution(MatchTier.UNRESOLVED, Duration.ofMillis(5));

            Timer exact = registry.find("registry.resolution.duration").tag("tier", "EXACT").timer();
            Timer unresolved = registry.find("registry.resolution.duration").tag("tier", "UNRESOLVED").timer();

            assertNotNull(exact);
            assertEquals(2, exact.count());
            assertNotNull(unresolved);
            assertEquals(1, unresolved.count());
        }

        @Test
        @DisplayName("Should count store issues and cycles")
        void storeCounters() {
            metrics.recordStoreIssues(3);
            metrics.incrementCycleDetected();

            assertEquals(3.0, registry.find("registry.store.issues").counter().count());
            assertEquals(1.0, registry.find("registry.canonical.cycles").counter().count());
        }

        @Test
        @DisplayName("Should count overlay outcomes")
        void overlayCounters() {
            metrics.incrementOverlayApplied(5);
            metrics.incrementOverlaySkipped();
            metrics.incrementOverlaySkipped();

            Counter applied = registry.find("registry.overlay.applied").counter();
            Counter skipped = registry.find("registry.overlay.skipped").counter();
            assertEquals(5.0, applied.count());
            assertEquals(2.0, skipped.count());
        }

        @Test
        @DisplayName("Should record index size and cache counters")
        void indexAndCache() {
            metrics.recordIndexSize(42);
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(42.0, registry.find("registry.index.size").summary().totalAmount());
            assertEquals(1.0, registry.find("registry.cache.hit").counter().count());
            assertEquals(2.0, registry.find("registry.cache.miss").counter().count());
        }
    }
}
