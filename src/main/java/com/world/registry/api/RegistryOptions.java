package com.world.registry.api;

import com.world.registry.cache.CacheConfig;
import com.world.registry.rules.InflectionRules;

import java.time.Instant;
import java.util.Objects;

/**
 * Options for building a {@link WorldRegistry}.
 */
public class RegistryOptions {

    private static final int DEFAULT_MIN_TOKEN_LENGTH = 3;
    private static final int DEFAULT_MIN_STEM_LENGTH = 3;

    private final Instant activeOn;
    private final int minTokenLength;
    private final int minStemLength;
    private final boolean parallelSourceParsing;
    private final CacheConfig cacheConfig;
    private final InflectionRules inflectionRules;

    private RegistryOptions(Builder builder) {
        this.activeOn = builder.activeOn;
        this.minTokenLength = builder.minTokenLength;
        this.minStemLength = builder.minStemLength;
        this.parallelSourceParsing = builder.parallelSourceParsing;
        this.cacheConfig = builder.cacheConfig;
        this.inflectionRules = builder.inflectionRules.getMinStemLength() == builder.minStemLength
                ? builder.inflectionRules
                : builder.inflectionRules.withMinStemLength(builder.minStemLength);
    }

    /**
     * Instant every "active" projection is computed for; null reads every entry as active.
     */
    public Instant getActiveOn() {
        return activeOn;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public int getMinStemLength() {
        return minStemLength;
    }

    public boolean isParallelSourceParsing() {
        return parallelSourceParsing;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Inflection rules with {@link #getMinStemLength()} applied.
     */
    public InflectionRules getInflectionRules() {
        return inflectionRules;
    }

    public static RegistryOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant activeOn;
        private int minTokenLength = DEFAULT_MIN_TOKEN_LENGTH;
        private int minStemLength = DEFAULT_MIN_STEM_LENGTH;
        private boolean parallelSourceParsing = false;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private InflectionRules inflectionRules = InflectionRules.polish();

        public Builder activeOn(Instant activeOn) {
            this.activeOn = activeOn;
            return this;
        }

        public Builder minTokenLength(int minTokenLength) {
            this.minTokenLength = minTokenLength;
            return this;
        }

        public Builder minStemLength(int minStemLength) {
            this.minStemLength = minStemLength;
            return this;
        }

        public Builder parallelSourceParsing(boolean parallelSourceParsing) {
            this.parallelSourceParsing = parallelSourceParsing;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder inflectionRules(InflectionRules inflectionRules) {
            this.inflectionRules = inflectionRules;
            return this;
        }

        public RegistryOptions build() {
            Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            Objects.requireNonNull(inflectionRules, "inflectionRules is required");
            if (minTokenLength < 1) {
                throw new IllegalArgumentException("minTokenLength must be positive");
            }
            if (minStemLength < 1) {
                throw new IllegalArgumentException("minStemLength must be positive");
            }
            return new RegistryOptions(this);
        }
    }
}
