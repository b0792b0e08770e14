package com.world.registry.store;

import com.world.registry.core.model.Entity;
import com.world.registry.logging.LogContext;
import com.world.registry.metrics.MetricsService;
import com.world.registry.metrics.NoOpMetricsService;
import com.world.registry.store.SourceParser.ParsedAttribute;
import com.world.registry.store.SourceParser.ParsedDeclaration;
import com.world.registry.store.SourceParser.ParsedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds an {@link EntityStore} from ordered declaration sources.
 *
 * <p>Sources are merged in the order they were added: the lowest-precedence source
 * first. A name seen again merges into the existing entity (names, aliases, overrides
 * and every history are unioned). After all sources are merged each history is sorted
 * by validFrom so later-dated entries win.</p>
 *
 * <pre>
 * EntityStore store = EntityStoreBuilder.create()
 *     .addSource(baseRegistry)
 *     .addSource(campaignRegistry)
 *     .activeOn(Instant.parse("2025-01-01T00:00:00Z"))
 *     .build();
 * </pre>
 */
public class EntityStoreBuilder {
    private static final Logger log = LoggerFactory.getLogger(EntityStoreBuilder.class);

    private final List<DeclarationSource> sources = new ArrayList<>();
    private final SourceParser parser = new SourceParser();
    private final AttributeApplier applier = new AttributeApplier();
    private Instant activeOn;
    private boolean parallelParsing;
    private MetricsService metricsService = new NoOpMetricsService();

    public static EntityStoreBuilder create() {
        return new EntityStoreBuilder();
    }

    /**
     * Adds a source with higher precedence than every source added before it.
     */
    public EntityStoreBuilder addSource(DeclarationSource source) {
        sources.add(Objects.requireNonNull(source, "source is required"));
        return this;
    }

    public EntityStoreBuilder addSources(List<DeclarationSource> newSources) {
        newSources.forEach(this::addSource);
        return this;
    }

    public EntityStoreBuilder activeOn(Instant activeOn) {
        this.activeOn = activeOn;
        return this;
    }

    public EntityStoreBuilder parallelParsing(boolean parallelParsing) {
        this.parallelParsing = parallelParsing;
        return this;
    }

    public EntityStoreBuilder metricsService(MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        return this;
    }

    public EntityStore build() {
        try (LogContext ctx = LogContext.forBuild("store")) {
            List<ParsedSource> parsed = parallelParsing
                    ? sources.parallelStream().map(parser::parse).toList()
                    : sources.stream().map(parser::parse).toList();

            Map<String, Entity> byName = new LinkedHashMap<>();
            List<StoreIssue> issues = new ArrayList<>();
            for (ParsedSource source : parsed) {
                issues.addAll(source.issues());
                for (ParsedDeclaration declaration : source.declarations()) {
                    merge(byName, source.sourceId(), declaration, issues);
                }
            }

            for (Entity entity : byName.values()) {
                entity.refreshActive(activeOn);
            }

            metricsService.recordStoreIssues(issues.size());
            log.info("store.built sources={} entities={} issues={} activeOn={}",
                    sources.size(), byName.size(), issues.size(), activeOn);
            return new EntityStore(byName, issues, activeOn);
        }
    }

    private void merge(Map<String, Entity> byName, String sourceId,
                       ParsedDeclaration declaration, List<StoreIssue> issues) {
        Entity entity = byName.get(EntityStore.key(declaration.name()));
        if (entity == null) {
            entity = Entity.builder()
                    .name(declaration.name())
                    .type(declaration.type())
                    .sourceId(sourceId)
                    .build();
            byName.put(EntityStore.key(declaration.name()), entity);
        } else {
            entity.addSourceId(sourceId);
            if (entity.getType() != declaration.type()) {
                String message = "Declared as " + declaration.type() + " but first declared as " + entity.getType();
                log.warn("store.type.conflict sourceId={} entity='{}' existing={} declared={}",
                        sourceId, entity.getName(), entity.getType(), declaration.type());
                issues.add(new StoreIssue(sourceId, entity.getName(), declaration.name(), message));
            }
        }

        for (ParsedAttribute attribute : declaration.attributes()) {
            try {
                applier.apply(entity, attribute.tag(), attribute.value().toTimeScoped());
            } catch (MalformedAttributeException e) {
                log.warn("store.attribute.malformed sourceId={} entity='{}' line='{}' reason={}",
                        sourceId, entity.getName(), attribute.line(), e.getMessage());
                issues.add(new StoreIssue(sourceId, entity.getName(), attribute.line(), e.getMessage()));
            }
        }
    }
}
