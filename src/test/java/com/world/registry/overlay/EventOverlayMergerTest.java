package com.world.registry.overlay;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.EntityStatus;
import com.world.registry.core.model.Player;
import com.world.registry.index.NameIndexBuilder;
import com.world.registry.metrics.MetricsService;
import com.world.registry.resolve.FuzzyResolver;
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
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("EventOverlayMerger Tests")
class EventOverlayMergerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private EntityStore store;
    private EventOverlayMerger merger;
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        store = EntityStoreBuilder.create()
                .addSource(DeclarationSource.of("base",
                        DeclarationSection.of("NPC",
                                EntityDeclaration.of("Korm Blackhand",
                                        "Location: Steadwick",
                                        "Status: Active")),
                        DeclarationSection.of("Player characters",
                                EntityDeclaration.of("Xeron Shadowblade")),
                        DeclarationSection.of("Locations",
                                EntityDeclaration.of("Steadwick"),
                                EntityDeclaration.of("Deyja"))))
                .activeOn(NOW)
                .build();
        FuzzyResolver resolver = new FuzzyResolver(NameIndexBuilder.create()
                .entities(store.entities())
                .players(List.of(Player.of("Marek", "Xeron Shadowblade")))
                .activeOn(NOW)
                .build());
        metrics = mock(MetricsService.class);
        merger = new EventOverlayMerger(store, resolver, metrics);
    }

    private Entity korm() {
        return store.findByName("Korm Blackhand").orElseThrow();
    }

    @Nested
    @DisplayName("Auto-dating")
    class AutoDating {

        @Test
        @DisplayName("Removal applies from the event date onwards")
        void removalFromEventDate() {
            OverlayResult result = merger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Korm Blackhand", TagChange.of("Status", "Removed"))));

            assertEquals(1, result.appliedRecords());
            assertEquals(1, result.appliedChanges());
            assertEquals(EntityStatus.REMOVED, korm().statusAt(Instant.parse("2026-03-01T00:00:00Z")));
            assertEquals(EntityStatus.ACTIVE, korm().statusAt(Instant.parse("2025-12-01T00:00:00Z")));
            assertEquals(EntityStatus.REMOVED, korm().getActiveStatus());
            assertEquals(List.of(korm()), result.touchedEntities());
        }

        @Test
        @DisplayName("Explicit range in the change value wins over the event date")
        void explicitRange() {
            merger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Korm Blackhand",
                            TagChange.of("Location", "Deyja (2025-06:2025-08)"))));

            assertEquals("Deyja", korm().locationAt(Instant.parse("2025-07-01T00:00:00Z")).orElseThrow());
            assertEquals("Steadwick", korm().getActiveLocation().orElseThrow());
        }

        @ParameterizedTest
        @ValueSource(strings = {"Removed (kiedyś:)", "Removed (:)", "Removed (wkrótce:nigdy)"})
        @DisplayName("Range without a usable bound falls back to the event date")
        void unparseableRange(String rawValue) {
            merger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Korm Blackhand", TagChange.of("Status", rawValue))));

            assertEquals(EntityStatus.ACTIVE, korm().statusAt(Instant.parse("2025-12-01T00:00:00Z")));
            assertEquals(EntityStatus.REMOVED, korm().statusAt(Instant.parse("2026-02-15T00:00:00Z")));
        }

        @Test
        @DisplayName("Records apply in date order regardless of input order")
        void dateOrder() {
            merger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Korm Blackhand", TagChange.of("Location", "Deyja")),
                    ChangeRecord.of(LocalDate.of(2026, 1, 1), "Korm Blackhand", TagChange.of("Location", "Steadwick"))));

            assertEquals("Deyja", korm().getActiveLocation().orElseThrow());
            assertEquals("Steadwick", korm().locationAt(Instant.parse("2026-01-15T00:00:00Z")).orElseThrow());
        }
    }

    @Nested
    @DisplayName("Target resolution")
    class TargetResolution {

        @Test
        @DisplayName("Misspelled target resolves through the fuzzy resolver")
        void fuzzyTarget() {
            OverlayResult result = merger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Korm Blakhand", TagChange.of("Alias", "One-Eye"))));

            assertEquals(1, result.appliedChanges());
            assertTrue(korm().hasName("One-Eye"));
        }

        @Test
        @DisplayName("Player reference maps back to the player character entity")
        void playerTarget() {
            merger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Marek", TagChange.of("Location", "Deyja"))));

            Entity xeron = store.findByName("Xeron Shadowblade").orElseThrow();
            assertEquals("Deyja", xeron.getActiveLocation().orElseThrow());
        }

        @Test
        @DisplayName("Fuzzy target tied between two entities is skipped")
        void tiedTarget() {
            EntityStore twins = EntityStoreBuilder.create()
                    .addSource(DeclarationSource.of("base", DeclarationSection.of("NPC",
                            EntityDeclaration.of("Korm Blackhand"),
                            EntityDeclaration.of("Kory"))))
                    .activeOn(NOW)
                    .build();
            EventOverlayMerger twinMerger = new EventOverlayMerger(twins,
                    new FuzzyResolver(NameIndexBuilder.create().entities(twins.entities()).activeOn(NOW).build()),
                    metrics);

            OverlayResult result = twinMerger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Kor", TagChange.of("Status", "Removed"))));

            assertEquals(0, result.appliedRecords());
            assertEquals(1, result.skipped().size());
            assertEquals(EntityStatus.ACTIVE, twins.findByName("Korm Blackhand").orElseThrow().getActiveStatus());
            assertEquals(EntityStatus.ACTIVE, twins.findByName("Kory").orElseThrow().getActiveStatus());
        }

        @Test
        @DisplayName("Unknown target is skipped and the batch continues")
        void unknownTarget() {
            OverlayResult result = merger.apply(List.of(
                    ChangeRecord.of(LocalDate.of(2026, 1, 1), "Gelu", TagChange.of("Status", "Removed")),
                    ChangeRecord.of(LocalDate.of(2026, 2, 1), "Korm Blackhand", TagChange.of("Status", "Inactive"))));

            assertTrue(result.hasSkipped());
            assertEquals("Gelu", result.skipped().get(0).record().targetName());
            assertEquals(1, result.appliedRecords());
            assertEquals(EntityStatus.INACTIVE, korm().getActiveStatus());
            verify(metrics).incrementOverlaySkipped();
            verify(metrics).incrementOverlayApplied(1);
        }
    }

    @Test
    @DisplayName("Malformed change is skipped while the rest of the record applies")
    void malformedChange() {
        OverlayResult result = merger.apply(List.of(
                ChangeRecord.of(LocalDate.of(2026, 2, 1), "Korm Blackhand",
                        TagChange.of("Status", "Sleeping"),
                        TagChange.of("Owner", "Iron Fist"))));

        assertEquals(1, result.appliedChanges());
        assertEquals(1, result.rejectedChanges());
        assertEquals("Iron Fist", korm().getActiveOwner().orElseThrow());
        assertEquals(EntityStatus.ACTIVE, korm().getActiveStatus());
    }

    @Test
    @DisplayName("Empty batch touches nothing")
    void emptyBatch() {
        OverlayResult result = merger.apply(List.of());
        assertEquals(0, result.appliedRecords());
        assertTrue(result.touchedEntities().isEmpty());
    }
}
