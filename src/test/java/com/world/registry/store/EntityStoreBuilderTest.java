package com.world.registry.store;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.EntityStatus;
import com.world.registry.core.model.EntityType;
import com.world.registry.core.model.IdentityKind;
import com.world.registry.core.model.Player;
import com.world.registry.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("EntityStoreBuilder Tests")
class EntityStoreBuilderTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private DeclarationSource base() {
        return DeclarationSource.of("base",
                DeclarationSection.of("NPC",
                        EntityDeclaration.of("Korm Blackhand",
                                "Location: Erathia",
                                "Group: Iron Fist (2024:)",
                                "Status: Active"),
                        EntityDeclaration.of("Sandro",
                                "Alias: The Necromancer (2025-01:)",
                                "Alias: Apprentice (:2024)")),
                DeclarationSection.of("Lokacje",
                        EntityDeclaration.of("Erathia")));
    }

    private DeclarationSource campaign() {
        return DeclarationSource.of("campaign",
                DeclarationSection.of("NPC",
                        EntityDeclaration.of("Korm Blackhand",
                                "Location: Zamek Steadwick (2025-03:)",
                                "Mood: suspicious")));
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Later source wins for dated entries and keeps provenance")
        void laterSourceWins() {
            EntityStore store = EntityStoreBuilder.create()
                    .addSource(base())
                    .addSource(campaign())
                    .activeOn(NOW)
                    .build();

            Entity korm = store.findByName("korm blackhand").orElseThrow();
            assertEquals("Zamek Steadwick", korm.getActiveLocation().orElseThrow());
            assertEquals("Erathia", korm.locationAt(Instant.parse("2025-01-01T00:00:00Z")).orElseThrow());
            assertEquals(List.of("base", "campaign"), korm.getSourceIds());
            assertEquals("suspicious", korm.overrideAt("Mood", NOW).orElseThrow());
            assertEquals(List.of("Iron Fist"), korm.getActiveGroups());
        }

        @Test
        @DisplayName("Merging the same source twice leaves the active projection unchanged")
        void mergeIdempotentProjection() {
            EntityStore once = EntityStoreBuilder.create().addSource(base()).activeOn(NOW).build();
            EntityStore twice = EntityStoreBuilder.create().addSource(base()).addSource(base()).activeOn(NOW).build();

            Entity a = once.findByName("Korm Blackhand").orElseThrow();
            Entity b = twice.findByName("Korm Blackhand").orElseThrow();
            assertEquals(once.size(), twice.size());
            assertEquals(a.getActiveLocation(), b.getActiveLocation());
            assertEquals(a.getActiveStatus(), b.getActiveStatus());
            assertEquals(List.of("base"), b.getSourceIds());
        }

        @Test
        @DisplayName("Conflicting type keeps the first declaration and records an issue")
        void typeConflict() {
            DeclarationSource other = DeclarationSource.of("other",
                    DeclarationSection.of("Locations", EntityDeclaration.of("Sandro")));

            EntityStore store = EntityStoreBuilder.create().addSource(base()).addSource(other).build();

            assertEquals(EntityType.NPC, store.findByName("Sandro").orElseThrow().getType());
            assertEquals(1, store.getIssues().size());
            assertEquals("other", store.getIssues().get(0).sourceId());
        }

        @Test
        @DisplayName("Parallel parsing produces the same store as sequential parsing")
        void parallelParsing() {
            EntityStore sequential = EntityStoreBuilder.create()
                    .addSources(List.of(base(), campaign())).activeOn(NOW).build();
            EntityStore parallel = EntityStoreBuilder.create()
                    .addSources(List.of(base(), campaign())).activeOn(NOW).parallelParsing(true).build();

            assertEquals(
                    sequential.entities().stream().map(Entity::getName).toList(),
                    parallel.entities().stream().map(Entity::getName).toList());
            assertEquals(
                    sequential.findByName("Korm Blackhand").orElseThrow().getActiveLocation(),
                    parallel.findByName("Korm Blackhand").orElseThrow().getActiveLocation());
        }
    }

    @Nested
    @DisplayName("Aliases")
    class Aliases {

        @Test
        @DisplayName("Expired alias still identifies the entity but is not active")
        void expiredAlias() {
            EntityStore store = EntityStoreBuilder.create().addSource(base()).activeOn(NOW).build();
            Entity sandro = store.findByAnyName("apprentice").orElseThrow();

            assertEquals("Sandro", sandro.getName());
            assertEquals(List.of("The Necromancer"), sandro.getActiveAliases(NOW));
            assertEquals(sandro, store.findByAnyName("the necromancer").orElseThrow());
        }

        @Test
        @DisplayName("Player record finds the store entities that share its names")
        void findSharingNames() {
            DeclarationSource pcs = DeclarationSource.of("pcs",
                    DeclarationSection.of("Player Characters", EntityDeclaration.of("Xeron Shadowblade")));
            EntityStore store = EntityStoreBuilder.create().addSource(base()).addSource(pcs).build();

            List<Entity> sharing = store.findSharingNames(Player.of("Marek", "Xeron Shadowblade"));

            assertEquals(1, sharing.size());
            assertEquals(IdentityKind.PLAYER, sharing.get(0).getKind());
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("Bad lines are skipped and reported without aborting the build")
        void badLinesSkipped() {
            DeclarationSource broken = DeclarationSource.of("broken",
                    DeclarationSection.of("NPC",
                            EntityDeclaration.of("Gem",
                                    "no separator here",
                                    "Status: Sleeping",
                                    "Quantity: many",
                                    ": orphan value",
                                    "Status: Inactive")),
                    DeclarationSection.of("Bestiary", EntityDeclaration.of("Dragon")));

            EntityStore store = EntityStoreBuilder.create().addSource(broken).build();

            assertEquals(4, store.getIssues().size());
            assertEquals(1, store.size());
            assertEquals(EntityStatus.INACTIVE, store.findByName("Gem").orElseThrow().getActiveStatus());
        }

        @Test
        @DisplayName("Issue count is reported to metrics")
        void issuesReported() {
            MetricsService metrics = mock(MetricsService.class);
            DeclarationSource broken = DeclarationSource.of("broken",
                    DeclarationSection.of("NPC", EntityDeclaration.of("Gem", "Status: Sleeping")));

            EntityStoreBuilder.create().addSource(broken).metricsService(metrics).build();

            verify(metrics).recordStoreIssues(1);
        }
    }

    @Test
    @DisplayName("Continuation lines are joined into the value")
    void continuationLines() {
        DeclarationSource source = DeclarationSource.of("base",
                DeclarationSection.of("Items", new EntityDeclaration("Ledger", List.of(
                        AttributeLine.multiline("Notes: first line", "  second line")))));

        EntityStore store = EntityStoreBuilder.create().addSource(source).build();

        assertEquals("first line\nsecond line",
                store.findByName("Ledger").orElseThrow().overrideAt("Notes", null).orElseThrow());
    }
}
