package com.world.registry.store;

/**
 * A recoverable problem found while building the store. The offending line was skipped.
 *
 * @param sourceId   source the line came from
 * @param entityName entity being declared, or null for section-level issues
 * @param line       the raw line or label
 * @param message    what was wrong
 */
public record StoreIssue(String sourceId, String entityName, String line, String message) {}
