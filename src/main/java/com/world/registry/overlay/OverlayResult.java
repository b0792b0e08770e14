package com.world.registry.overlay;

import com.world.registry.core.model.Entity;

import java.util.List;

/**
 * Outcome of an overlay batch.
 *
 * @param appliedRecords  records whose target resolved
 * @param appliedChanges  individual changes appended to a history
 * @param rejectedChanges changes skipped as malformed within an applied record
 * @param skipped         records skipped because the target did not resolve
 * @param touchedEntities entities that received at least one change, in first-touch order
 */
public record OverlayResult(int appliedRecords, int appliedChanges, int rejectedChanges,
                            List<SkippedRecord> skipped, List<Entity> touchedEntities) {

    public OverlayResult {
        skipped = List.copyOf(skipped);
        touchedEntities = List.copyOf(touchedEntities);
    }

    public static OverlayResult empty() {
        return new OverlayResult(0, 0, 0, List.of(), List.of());
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }
}
