package com.world.registry.overlay;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * A dated event naming an entity and the attribute changes that happened to it.
 *
 * @param date       when the event happened; changes without a range start here
 * @param targetName entity name, alias or a loose reference to it
 * @param changes    changes in declaration order
 */
public record ChangeRecord(Instant date, String targetName, List<TagChange> changes) {

    public ChangeRecord {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(targetName, "targetName is required");
        changes = List.copyOf(changes);
    }

    public static ChangeRecord of(LocalDate date, String targetName, TagChange... changes) {
        return new ChangeRecord(date.atStartOfDay(ZoneOffset.UTC).toInstant(), targetName, List.of(changes));
    }
}
