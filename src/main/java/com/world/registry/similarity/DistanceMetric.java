package com.world.registry.similarity;

/**
 * Integer distance satisfying the triangle inequality, as required by {@link BkTree}.
 */
@FunctionalInterface
public interface DistanceMetric {

    int distance(String a, String b);
}
