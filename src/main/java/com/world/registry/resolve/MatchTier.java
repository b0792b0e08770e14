package com.world.registry.resolve;

/**
 * Resolution stage that produced a {@link ResolutionResult}.
 */
public enum MatchTier {
    EXACT(1.0),
    MORPHOLOGICAL(0.85),
    /** Confidence comes from the Levenshtein similarity instead. */
    FUZZY(0.0),
    UNRESOLVED(0.0);

    private final double baseConfidence;

    MatchTier(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public boolean isResolved() {
        return this != UNRESOLVED;
    }
}
