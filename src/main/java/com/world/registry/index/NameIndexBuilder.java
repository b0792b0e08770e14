package com.world.registry.index;

import com.world.registry.core.model.Entity;
import com.world.registry.core.model.Identity;
import com.world.registry.core.model.Player;
import com.world.registry.logging.LogContext;
import com.world.registry.metrics.MetricsService;
import com.world.registry.metrics.NoOpMetricsService;
import com.world.registry.rules.DefaultNormalizationRules;
import com.world.registry.rules.InflectionRules;
import com.world.registry.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link NameIndex} from store entities and external player records.
 *
 * <p>Every full name and active alias is keyed at {@link IndexPriority#FULL_NAME_OR_ALIAS};
 * tokens of multi-word names (at least {@code minTokenLength} characters) and generic names
 * are keyed at {@link IndexPriority#TOKEN}. A higher tier overwrites a lower one; the same
 * tier claimed by a different owner marks the key ambiguous.</p>
 *
 * <p>Single-threaded: accumulates into plain maps and hands off an immutable index.</p>
 */
public class NameIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(NameIndexBuilder.class);

    private final List<Entity> entities = new ArrayList<>();
    private final List<Player> players = new ArrayList<>();
    private NormalizationEngine normalizer = DefaultNormalizationRules.createDefaultEngine();
    private InflectionRules inflectionRules = InflectionRules.polish();
    private int minTokenLength = 3;
    private Instant activeOn;
    private MetricsService metricsService = new NoOpMetricsService();

    public static NameIndexBuilder create() {
        return new NameIndexBuilder();
    }

    public NameIndexBuilder entities(Collection<Entity> values) {
        entities.addAll(values);
        return this;
    }

    public NameIndexBuilder players(Collection<Player> values) {
        players.addAll(values);
        return this;
    }

    public NameIndexBuilder normalizer(NormalizationEngine normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        return this;
    }

    public NameIndexBuilder inflectionRules(InflectionRules inflectionRules) {
        this.inflectionRules = Objects.requireNonNull(inflectionRules, "inflectionRules is required");
        return this;
    }

    public NameIndexBuilder minTokenLength(int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be positive");
        }
        this.minTokenLength = minTokenLength;
        return this;
    }

    public NameIndexBuilder activeOn(Instant activeOn) {
        this.activeOn = activeOn;
        return this;
    }

    public NameIndexBuilder metricsService(MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        return this;
    }

    public NameIndex build() {
        try (LogContext ctx = LogContext.forBuild("index")) {
            IdentityDeduplicator dedup = new IdentityDeduplicator(entities, players);
            Accumulator keys = new Accumulator();

            // Players first so they are the first-listed owner of any key they share
            for (Player player : players) {
                indexIdentity(keys, player, player);
            }
            for (Entity entity : entities) {
                indexIdentity(keys, entity, dedup.representativeOf(entity));
            }

            Accumulator stems = new Accumulator();
            for (Map.Entry<String, MutableEntry> e : keys.entries.entrySet()) {
                MutableEntry entry = e.getValue();
                List<String> forms = new ArrayList<>();
                forms.add(e.getKey());
                inflectionRules.stem(e.getKey()).ifPresent(forms::add);
                for (String form : forms) {
                    for (Identity owner : entry.owners) {
                        stems.put(form, owner, entry.priority);
                    }
                }
            }

            NameIndex index = new NameIndex(keys.freeze(), stems.freeze(), normalizer, inflectionRules);
            long ambiguous = index.entries().values().stream().filter(NameIndexEntry::isAmbiguous).count();
            metricsService.recordIndexSize(index.size());
            log.info("index.built identities={} players={} deduplicated={} keys={} stems={} ambiguous={}",
                    entities.size(), players.size(), dedup.mergedCount(), index.size(), index.stemCount(), ambiguous);
            return index;
        }
    }

    private void indexIdentity(Accumulator keys, Identity identity, Identity owner) {
        List<String> fullNames = new ArrayList<>();
        fullNames.add(identity.getName());
        fullNames.addAll(identity.getActiveAliases(activeOn));

        for (String fullName : fullNames) {
            String key = normalizer.normalize(fullName);
            if (key.isEmpty()) {
                continue;
            }
            keys.put(key, owner, IndexPriority.FULL_NAME_OR_ALIAS);
            String[] tokens = key.split(" ");
            if (tokens.length > 1) {
                for (String token : tokens) {
                    if (token.length() >= minTokenLength) {
                        keys.put(token, owner, IndexPriority.TOKEN);
                    }
                }
            }
        }

        for (String genericName : identity.getGenericNames()) {
            String key = normalizer.normalize(genericName);
            if (!key.isEmpty()) {
                keys.put(key, owner, IndexPriority.TOKEN);
            }
        }
    }

    /**
     * Mutable key accumulator applying the priority and ambiguity rules.
     */
    private static final class Accumulator {
        private final Map<String, MutableEntry> entries = new LinkedHashMap<>();

        void put(String key, Identity owner, IndexPriority priority) {
            MutableEntry existing = entries.get(key);
            if (existing == null || priority.isHigherThan(existing.priority)) {
                entries.put(key, new MutableEntry(owner, priority));
                return;
            }
            if (existing.priority != priority) {
                return;
            }
            if (!existing.owners.contains(owner)) {
                existing.owners.add(owner);
                existing.ambiguous = true;
            }
        }

        Map<String, NameIndexEntry> freeze() {
            Map<String, NameIndexEntry> frozen = new LinkedHashMap<>();
            entries.forEach((key, e) -> frozen.put(key,
                    new NameIndexEntry(e.owners.get(0), e.priority, e.ambiguous, e.owners)));
            return frozen;
        }
    }

    private static final class MutableEntry {
        private final IndexPriority priority;
        private final List<Identity> owners = new ArrayList<>();
        private boolean ambiguous;

        MutableEntry(Identity owner, IndexPriority priority) {
            this.priority = priority;
            this.owners.add(owner);
        }
    }
}
