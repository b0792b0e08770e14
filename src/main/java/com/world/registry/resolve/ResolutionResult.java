package com.world.registry.resolve;

import com.world.registry.core.model.Identity;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving a free-text reference against the name index.
 *
 * <p>An unresolved result carries no identity and no matched key; it is a normal outcome,
 * not an error.</p>
 */
public final class ResolutionResult {
    private final String query;
    private final Identity identity;
    private final MatchTier tier;
    private final String matchedKey;
    private final int distance;
    private final double confidence;
    private final boolean tied;

    private ResolutionResult(Builder builder) {
        this.query = builder.query;
        this.identity = builder.identity;
        this.tier = builder.tier;
        this.matchedKey = builder.matchedKey;
        this.distance = builder.distance;
        this.confidence = builder.confidence;
        this.tied = builder.tied;
    }

    public static ResolutionResult unresolved(String query) {
        return builder()
                .query(query)
                .tier(MatchTier.UNRESOLVED)
                .build();
    }

    public static ResolutionResult exact(String query, Identity identity, String matchedKey) {
        return builder()
                .query(query)
                .identity(identity)
                .tier(MatchTier.EXACT)
                .matchedKey(matchedKey)
                .confidence(MatchTier.EXACT.getBaseConfidence())
                .build();
    }

    public static ResolutionResult morphological(String query, Identity identity, String matchedKey) {
        return builder()
                .query(query)
                .identity(identity)
                .tier(MatchTier.MORPHOLOGICAL)
                .matchedKey(matchedKey)
                .confidence(MatchTier.MORPHOLOGICAL.getBaseConfidence())
                .build();
    }

    /**
     * Returns this result reported against a different raw query; everything else is kept.
     */
    public ResolutionResult withQuery(String query) {
        if (Objects.equals(this.query, query)) {
            return this;
        }
        return builder()
                .query(query)
                .identity(identity)
                .tier(tier)
                .matchedKey(matchedKey)
                .distance(distance)
                .confidence(confidence)
                .tied(tied)
                .build();
    }

    public String getQuery() {
        return query;
    }

    public Optional<Identity> getIdentity() {
        return Optional.ofNullable(identity);
    }

    public MatchTier getTier() {
        return tier;
    }

    public boolean isResolved() {
        return tier.isResolved();
    }

    /**
     * Normalized index key (or stem) that matched, null when unresolved.
     */
    public String getMatchedKey() {
        return matchedKey;
    }

    /**
     * Edit distance between the normalized query and the matched key; 0 for non-fuzzy tiers.
     */
    public int getDistance() {
        return distance;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * True when another key at the same fuzzy distance belongs to a different identity.
     */
    public boolean isTied() {
        return tied;
    }

    @Override
    public String toString() {
        return "ResolutionResult{" +
                "query='" + query + '\'' +
                ", tier=" + tier +
                ", identity=" + (identity == null ? null : identity.getCanonicalName()) +
                ", matchedKey='" + matchedKey + '\'' +
                ", distance=" + distance +
                ", confidence=" + confidence +
                ", tied=" + tied +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String query;
        private Identity identity;
        private MatchTier tier;
        private String matchedKey;
        private int distance;
        private double confidence;
        private boolean tied;

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder identity(Identity identity) {
            this.identity = identity;
            return this;
        }

        public Builder tier(MatchTier tier) {
            this.tier = tier;
            return this;
        }

        public Builder matchedKey(String matchedKey) {
            this.matchedKey = matchedKey;
            return this;
        }

        public Builder distance(int distance) {
            this.distance = distance;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder tied(boolean tied) {
            this.tied = tied;
            return this;
        }

        public ResolutionResult build() {
            Objects.requireNonNull(query, "query is required");
            Objects.requireNonNull(tier, "tier is required");
            if (tier.isResolved() && identity == null) {
                throw new IllegalArgumentException("resolved result requires an identity");
            }
            if (!tier.isResolved() && identity != null) {
                throw new IllegalArgumentException("unresolved result cannot carry an identity");
            }
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            return new ResolutionResult(this);
        }
    }
}
