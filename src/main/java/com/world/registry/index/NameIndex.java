package com.world.registry.index;

import com.world.registry.rules.InflectionRules;
import com.world.registry.rules.NormalizationEngine;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reverse lookup from every known name, alias and token to its owning identity,
 * plus the stem index used for morphological matching.
 *
 * <p>Built once by {@link NameIndexBuilder} and read-only afterwards, so it can be
 * shared between concurrent resolvers.</p>
 */
public final class NameIndex {
    private final Map<String, NameIndexEntry> entries;
    private final Map<String, NameIndexEntry> stems;
    private final NormalizationEngine normalizer;
    private final InflectionRules inflectionRules;

    NameIndex(Map<String, NameIndexEntry> entries, Map<String, NameIndexEntry> stems,
              NormalizationEngine normalizer, InflectionRules inflectionRules) {
        this.entries = Collections.unmodifiableMap(entries);
        this.stems = Collections.unmodifiableMap(stems);
        this.normalizer = normalizer;
        this.inflectionRules = inflectionRules;
    }

    /**
     * Case-insensitive exact lookup of a raw name.
     */
    public Optional<NameIndexEntry> lookup(String name) {
        return lookupKey(normalizer.normalize(name));
    }

    /**
     * Lookup of an already-normalized key.
     */
    public Optional<NameIndexEntry> lookupKey(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Lookup in the stem index (keys and their suffix-stripped stems).
     */
    public Optional<NameIndexEntry> lookupStem(String stem) {
        return Optional.ofNullable(stems.get(stem));
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Map<String, NameIndexEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public int stemCount() {
        return stems.size();
    }

    public NormalizationEngine getNormalizer() {
        return normalizer;
    }

    public InflectionRules getInflectionRules() {
        return inflectionRules;
    }
}
