package com.world.registry.resolve;

import com.world.registry.cache.CacheConfig;
import com.world.registry.cache.CaffeineResolutionCache;
import com.world.registry.core.model.Entity;
import com.world.registry.core.model.IdentityKind;
import com.world.registry.core.model.Player;
import com.world.registry.index.NameIndex;
import com.world.registry.index.NameIndexBuilder;
import com.world.registry.metrics.MetricsService;
import com.world.registry.store.DeclarationSection;
import com.world.registry.store.DeclarationSource;
import com.world.registry.store.EntityDeclaration;
import com.world.registry.store.EntityStore;
import com.world.registry.store.EntityStoreBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("FuzzyResolver Tests")
class FuzzyResolverTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private EntityStore store;
    private Player marek;
    private NameIndex index;
    private FuzzyResolver resolver;

    @BeforeEach
    void setUp() {
        store = EntityStoreBuilder.create()
                .addSource(DeclarationSource.of("base",
                        DeclarationSection.of("NPC",
                                EntityDeclaration.of("Korm Blackhand", "Location: Zamek Steadwick"),
                                EntityDeclaration.of("Sandro", "Alias: The Necromancer"),
                                EntityDeclaration.of("Janek"),
                                EntityDeclaration.of("Kory")),
                        DeclarationSection.of("Lokacje",
                                EntityDeclaration.of("Erathia"),
                                EntityDeclaration.of("Steadwick", "Location: Erathia"),
                                EntityDeclaration.of("Zamek Steadwick", "Location: Steadwick"),
                                EntityDeclaration.of("Hrad")),
                        DeclarationSection.of("Postaci graczy",
                                EntityDeclaration.of("Xeron Shadowblade"))))
                .activeOn(NOW)
                .build();
        marek = Player.of("Marek", "Xeron Shadowblade");
        index = NameIndexBuilder.create()
                .entities(store.entities())
                .players(List.of(marek))
                .activeOn(NOW)
                .build();
        resolver = new FuzzyResolver(index);
    }

    private Entity entity(String name) {
        return store.findByName(name).orElseThrow();
    }

    @Nested
    @DisplayName("Exact stage")
    class ExactStage {

        @Test
        @DisplayName("Full name resolves with full confidence")
        void fullName() {
            ResolutionResult result = resolver.resolve("korm blackhand");

            assertEquals(MatchTier.EXACT, result.getTier());
            assertSame(entity("Korm Blackhand"), result.getIdentity().orElseThrow());
            assertEquals(1.0, result.getConfidence());
            assertEquals(0, result.getDistance());
        }

        @Test
        @DisplayName("Token of a player character resolves to the player")
        void tokenToPlayer() {
            ResolutionResult result = resolver.resolve("Xeron");

            assertEquals(MatchTier.EXACT, result.getTier());
            assertSame(marek, result.getIdentity().orElseThrow());
            assertEquals("xeron", result.getMatchedKey());
        }

        @Test
        @DisplayName("Alias resolves to its entity")
        void alias() {
            assertSame(entity("Sandro"), resolver.resolve("the Necromancer").getIdentity().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Morphological stages")
    class MorphologicalStages {

        @ParameterizedTest
        @CsvSource({
                "Korma, Korm Blackhand, korm",
                "Erathii, Erathia, erathi",
                "Steadwicku, Steadwick, steadwick",
                "Hradzie, Hrad, hrad",
                "Janka, Janek, janek"
        })
        @DisplayName("Inflected forms resolve through stems and alternations")
        void inflectedForms(String query, String expected, String matchedKey) {
            ResolutionResult result = resolver.resolve(query);

            assertEquals(MatchTier.MORPHOLOGICAL, result.getTier());
            assertSame(entity(expected), result.getIdentity().orElseThrow());
            assertEquals(matchedKey, result.getMatchedKey());
            assertEquals(0.85, result.getConfidence());
        }
    }

    @Nested
    @DisplayName("Fuzzy stage")
    class FuzzyStage {

        @Test
        @DisplayName("Single dropped letter resolves with similarity confidence")
        void droppedLetter() {
            ResolutionResult result = resolver.resolve("Steadwik");

            assertEquals(MatchTier.FUZZY, result.getTier());
            assertSame(entity("Steadwick"), result.getIdentity().orElseThrow());
            assertEquals(1, result.getDistance());
            assertEquals(1.0 - 1.0 / 9, result.getConfidence(), 1e-9);
            assertFalse(result.isTied());
        }

        @Test
        @DisplayName("Distance above the key threshold is rejected")
        void thresholdRejects() {
            ResolutionResult result = resolver.resolve("Kxrq");

            assertEquals(MatchTier.UNRESOLVED, result.getTier());
            assertTrue(result.getIdentity().isEmpty());
            assertNull(result.getMatchedKey());
        }

        @Test
        @DisplayName("Equal-distance keys of different owners are flagged as tied")
        void tiedCandidates() {
            ResolutionResult result = resolver.resolve("Kor");

            assertEquals(MatchTier.FUZZY, result.getTier());
            assertEquals("korm", result.getMatchedKey());
            assertSame(entity("Korm Blackhand"), result.getIdentity().orElseThrow());
            assertTrue(result.isTied());
        }

        @Test
        @DisplayName("Thresholds grow with key length")
        void thresholds() {
            assertEquals(1, FuzzyResolver.threshold("korm"));
            assertEquals(1, FuzzyResolver.threshold("xeron"));
            assertEquals(3, FuzzyResolver.threshold("steadwick"));
        }
    }

    @Nested
    @DisplayName("Filters and ambiguity")
    class FiltersAndAmbiguity {

        @Test
        @DisplayName("Kind filter rejects owners of another kind")
        void kindFilter() {
            assertEquals(MatchTier.UNRESOLVED, resolver.resolve("Steadwick", IdentityKind.NPC).getTier());
            assertEquals(MatchTier.EXACT, resolver.resolve("Steadwick", IdentityKind.LOCATION).getTier());
            assertSame(marek, resolver.resolve("Xeron", IdentityKind.PLAYER).getIdentity().orElseThrow());
        }

        @Test
        @DisplayName("Ambiguous key stays unresolved even with a kind filter")
        void ambiguous() {
            EntityStore shared = EntityStoreBuilder.create()
                    .addSource(DeclarationSource.of("base", DeclarationSection.of("NPC",
                            EntityDeclaration.of("Korm Blackhand"),
                            EntityDeclaration.of("Ulric Blackhand"))))
                    .build();
            FuzzyResolver ambiguousResolver = new FuzzyResolver(
                    NameIndexBuilder.create().entities(shared.entities()).build());

            assertEquals(MatchTier.UNRESOLVED, ambiguousResolver.resolve("Blackhand").getTier());
            assertEquals(MatchTier.UNRESOLVED, ambiguousResolver.resolve("Blackhand", IdentityKind.NPC).getTier());
            assertEquals(MatchTier.EXACT, ambiguousResolver.resolve("Ulric").getTier());
        }

        @Test
        @DisplayName("Blank query is unresolved")
        void blankQuery() {
            ResolutionResult result = resolver.resolve("   ");
            assertFalse(result.isResolved());
            assertEquals("   ", result.getQuery());
        }
    }

    @Nested
    @DisplayName("Caching and metrics")
    class CachingAndMetrics {

        @Test
        @DisplayName("Repeated query is served from the cache")
        void cached() {
            MetricsService metrics = mock(MetricsService.class);
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            FuzzyResolver cachedResolver = new FuzzyResolver(index, cache, metrics);

            ResolutionResult first = cachedResolver.resolve("Korma");
            ResolutionResult second = cachedResolver.resolve("KORMA");

            assertSame(first.getIdentity().orElseThrow(), second.getIdentity().orElseThrow());
            assertEquals(first.getMatchedKey(), second.getMatchedKey());
            assertEquals("Korma", first.getQuery());
            assertEquals("KORMA", second.getQuery());
            assertEquals(1, cache.getStats().hitCount());
            verify(metrics).recordCacheMiss();
            verify(metrics).recordCacheHit();
            verify(metrics, times(1)).recordResolution(eq(MatchTier.MORPHOLOGICAL), any(Duration.class));
        }

        @Test
        @DisplayName("Kind filter is part of the cache key")
        void kindInCacheKey() {
            FuzzyResolver cachedResolver = new FuzzyResolver(index,
                    new CaffeineResolutionCache(CacheConfig.defaults()), mock(MetricsService.class));

            assertTrue(cachedResolver.resolve("Erathia").isResolved());
            assertFalse(cachedResolver.resolve("Erathia", IdentityKind.ITEM).isResolved());
        }
    }
}
