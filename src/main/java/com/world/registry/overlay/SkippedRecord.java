package com.world.registry.overlay;

/**
 * A change record the overlay could not apply because its target did not resolve.
 */
public record SkippedRecord(ChangeRecord record, String reason) {
}
