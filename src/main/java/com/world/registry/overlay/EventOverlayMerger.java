package com.world.registry.overlay;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.Identity;
import com.world.registry.logging.LogContext;
import com.world.registry.metrics.MetricsService;
import com.world.registry.metrics.NoOpMetricsService;
import com.world.registry.resolve.FuzzyResolver;
import com.world.registry.resolve.ResolutionResult;
import com.world.registry.store.AttributeApplier;
import com.world.registry.store.EntityStore;
import com.world.registry.store.MalformedAttributeException;
import com.world.registry.temporal.TemporalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Applies dated change records onto the entity store.
 *
 * <p>Records are applied in ascending date order (stable for equal dates). A change without
 * an explicit range is dated from its record's date with an open end. Unknown targets and
 * malformed changes are skipped with a warning; the batch always completes.</p>
 */
public class EventOverlayMerger {
    private static final Logger log = LoggerFactory.getLogger(EventOverlayMerger.class);

    private final EntityStore store;
    private final FuzzyResolver resolver;
    private final AttributeApplier applier = new AttributeApplier();
    private final MetricsService metricsService;

    public EventOverlayMerger(EntityStore store, FuzzyResolver resolver) {
        this(store, resolver, new NoOpMetricsService());
    }

    public EventOverlayMerger(EntityStore store, FuzzyResolver resolver, MetricsService metricsService) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public OverlayResult apply(List<ChangeRecord> records) {
        Objects.requireNonNull(records, "records is required");
        if (records.isEmpty()) {
            return OverlayResult.empty();
        }

        List<ChangeRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(ChangeRecord::date));

        int appliedRecords = 0;
        int appliedChanges = 0;
        int rejectedChanges = 0;
        List<SkippedRecord> skipped = new ArrayList<>();
        Set<Entity> touched = new LinkedHashSet<>();

        try (LogContext ctx = LogContext.forOverlay(LogContext.generateCorrelationId())) {
            for (ChangeRecord record : ordered) {
                Optional<Entity> target = findTarget(record.targetName());
                if (target.isEmpty()) {
                    log.warn("overlay.target.unresolved target='{}' date={}", record.targetName(), record.date());
                    skipped.add(new SkippedRecord(record, "Target '" + record.targetName() + "' did not resolve"));
                    metricsService.incrementOverlaySkipped();
                    continue;
                }

                Entity entity = target.get();
                appliedRecords++;
                for (TagChange change : record.changes()) {
                    try {
                        applier.apply(entity, change.tag(),
                                TemporalParser.parse(change.rawValue()).toTimeScoped(record.date()));
                        appliedChanges++;
                        touched.add(entity);
                    } catch (MalformedAttributeException e) {
                        rejectedChanges++;
                        log.warn("overlay.change.malformed entity='{}' tag='{}' reason='{}'",
                                entity.getName(), change.tag(), e.getMessage());
                    }
                }
            }

            for (Entity entity : touched) {
                entity.sortHistories();
                entity.refreshActive(store.getActiveOn());
            }

            metricsService.incrementOverlayApplied(appliedChanges);
            log.info("overlay.applied records={} changes={} rejected={} skipped={} touched={}",
                    appliedRecords, appliedChanges, rejectedChanges, skipped.size(), touched.size());
        }
        return new OverlayResult(appliedRecords, appliedChanges, rejectedChanges, skipped, new ArrayList<>(touched));
    }

    /**
     * Exact name or alias first, then the full resolver. A resolved player maps back
     * to the store entity sharing one of its names.
     */
    private Optional<Entity> findTarget(String targetName) {
        Optional<Entity> exact = store.findByAnyName(targetName);
        if (exact.isPresent()) {
            return exact;
        }

        ResolutionResult result = resolver.resolve(targetName);
        if (result.getIdentity().isEmpty()) {
            return Optional.empty();
        }
        if (result.isTied()) {
            log.warn("overlay.target.tied target='{}' key='{}' distance={}",
                    targetName, result.getMatchedKey(), result.getDistance());
            return Optional.empty();
        }
        Identity identity = result.getIdentity().get();
        if (identity instanceof Entity entity) {
            log.debug("overlay.target.resolved target='{}' entity='{}' tier={}",
                    targetName, entity.getName(), result.getTier());
            return Optional.of(entity);
        }
        List<Entity> sharing = store.findSharingNames(identity);
        if (sharing.isEmpty()) {
            log.debug("overlay.target.player-only target='{}' player='{}'", targetName, identity.getName());
            return Optional.empty();
        }
        return Optional.of(sharing.get(0));
    }
}
