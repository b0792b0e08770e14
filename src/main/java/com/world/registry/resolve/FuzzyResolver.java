package com.world.registry.resolve;

import com.world.registry.cache.NoOpResolutionCache;
import com.world.registry.cache.ResolutionCache;
import com.world.registry.core.model.Identity;
import com.world.registry.core.model.IdentityKind;
import com.world.registry.index.NameIndex;
import com.world.registry.index.NameIndexEntry;
import com.world.registry.logging.LogContext;
import com.world.registry.metrics.MetricsService;
import com.world.registry.metrics.NoOpMetricsService;
import com.world.registry.rules.InflectionRules;
import com.world.registry.similarity.BkTree;
import com.world.registry.similarity.LevenshteinSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves free-text references to identities in four stages, first success wins:
 * exact key, suffix stripping, stem alternation reversal, then bounded edit distance.
 *
 * <p>The BK-tree is built once over the index keys; the resolver is immutable apart
 * from its cache and safe for concurrent use.</p>
 */
public class FuzzyResolver {
    private static final Logger log = LoggerFactory.getLogger(FuzzyResolver.class);

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingInt(Candidate::distance)
            .thenComparingInt(c -> c.key().length())
            .thenComparing(Candidate::key);

    private final NameIndex index;
    private final InflectionRules inflectionRules;
    private final ResolutionCache cache;
    private final MetricsService metricsService;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final BkTree keyTree;

    public FuzzyResolver(NameIndex index) {
        this(index, new NoOpResolutionCache(), new NoOpMetricsService());
    }

    public FuzzyResolver(NameIndex index, ResolutionCache cache, MetricsService metricsService) {
        this.index = Objects.requireNonNull(index, "index is required");
        this.inflectionRules = index.getInflectionRules();
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.keyTree = BkTree.build(index.keys(), levenshtein);
        log.debug("resolver.initialized keys={}", keyTree.size());
    }

    public ResolutionResult resolve(String query) {
        return resolve(query, null);
    }

    /**
     * Resolves a reference, restricted to identities of the given kind when it is non-null.
     * Never throws for unknown names; a miss is returned as {@link MatchTier#UNRESOLVED}.
     */
    public ResolutionResult resolve(String query, IdentityKind kind) {
        Objects.requireNonNull(query, "query is required");
        String normalized = index.getNormalizer().normalize(query);

        Optional<ResolutionResult> cached = cache.get(normalized, kind);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get().withQuery(query);
        }
        metricsService.recordCacheMiss();

        String kindLabel = kind == null ? "ANY" : kind.name();
        try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(), kindLabel)) {
            long start = System.nanoTime();
            ResolutionResult result = normalized.isEmpty()
                    ? ResolutionResult.unresolved(query)
                    : runStages(query, normalized, kind);
            metricsService.recordResolution(result.getTier(), Duration.ofNanos(System.nanoTime() - start));
            log.debug("resolve.completed query='{}' tier={} key='{}'", query, result.getTier(), result.getMatchedKey());
            cache.put(normalized, kind, result);
            return result;
        }
    }

    private ResolutionResult runStages(String query, String normalized, IdentityKind kind) {
        Optional<NameIndexEntry> exact = index.lookupKey(normalized);
        if (exact.isPresent()) {
            Optional<Identity> owner = exact.get().resolve(kind);
            if (owner.isPresent()) {
                return ResolutionResult.exact(query, owner.get(), normalized);
            }
            if (exact.get().isAmbiguous()) {
                log.debug("resolve.ambiguous query='{}' owners={}", query, exact.get().getOwners().size());
            }
        }

        ResolutionResult morphological = stripSuffixes(query, normalized, kind);
        if (morphological != null) {
            return morphological;
        }

        for (String candidate : inflectionRules.alternationCandidates(normalized)) {
            ResolutionResult alternated = lookupStem(query, candidate, kind);
            if (alternated == null) {
                alternated = stripSuffixes(query, candidate, kind);
            }
            if (alternated != null) {
                return alternated;
            }
        }

        return fuzzy(query, normalized, kind);
    }

    private ResolutionResult stripSuffixes(String query, String word, IdentityKind kind) {
        for (String stem : inflectionRules.strippedStems(word)) {
            ResolutionResult result = lookupStem(query, stem, kind);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private ResolutionResult lookupStem(String query, String stem, IdentityKind kind) {
        return index.lookupStem(stem)
                .flatMap(entry -> entry.resolve(kind))
                .map(identity -> ResolutionResult.morphological(query, identity, stem))
                .orElse(null);
    }

    private ResolutionResult fuzzy(String query, String normalized, IdentityKind kind) {
        int radius = Math.max(1, normalized.length() / 2);
        List<Candidate> accepted = new ArrayList<>();
        for (BkTree.Match match : keyTree.search(normalized, radius)) {
            int threshold = threshold(match.key());
            if (match.distance() > threshold
                    || Math.abs(match.key().length() - normalized.length()) > threshold) {
                continue;
            }
            index.lookupKey(match.key())
                    .flatMap(entry -> entry.resolve(kind))
                    .ifPresent(owner -> accepted.add(new Candidate(match.key(), match.distance(), owner)));
        }
        if (accepted.isEmpty()) {
            return ResolutionResult.unresolved(query);
        }

        accepted.sort(CANDIDATE_ORDER);
        Candidate best = accepted.get(0);
        boolean tied = accepted.stream()
                .anyMatch(c -> c.distance() == best.distance() && !c.owner().equals(best.owner()));
        if (tied) {
            log.debug("resolve.fuzzy.tied query='{}' key='{}' distance={}", query, best.key(), best.distance());
        }
        return ResolutionResult.builder()
                .query(query)
                .identity(best.owner())
                .tier(MatchTier.FUZZY)
                .matchedKey(best.key())
                .distance(best.distance())
                .confidence(levenshtein.compute(normalized, best.key()))
                .tied(tied)
                .build();
    }

    /**
     * Maximum accepted edit distance for a key: 1 below five characters, a third of the length otherwise.
     */
    static int threshold(String key) {
        return key.length() < 5 ? 1 : key.length() / 3;
    }

    public NameIndex getIndex() {
        return index;
    }

    public ResolutionCache getCache() {
        return cache;
    }

    private record Candidate(String key, int distance, Identity owner) {
    }
}
