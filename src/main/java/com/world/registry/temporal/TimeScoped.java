package com.world.registry.temporal;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Function;

/**
 * A value paired with an optional validity range.
 * A {@code null} validFrom means "since the dawn of time", a {@code null} validTo means "indefinitely".
 *
 * @param value     the scoped value
 * @param validFrom first instant the value is active, or null
 * @param validTo   last instant the value is active, or null
 * @param <T>       value type
 */
public record TimeScoped<T>(T value, Instant validFrom, Instant validTo) {

    /**
     * Orders entries by validFrom with unscoped starts first.
     */
    public static final Comparator<TimeScoped<?>> BY_VALID_FROM =
            Comparator.comparing(TimeScoped::validFrom, Comparator.nullsFirst(Comparator.naturalOrder()));

    public TimeScoped {
        Objects.requireNonNull(value, "value is required");
        if (validFrom != null && validTo != null && validFrom.isAfter(validTo)) {
            throw new IllegalArgumentException("validFrom must be <= validTo: " + validFrom + " > " + validTo);
        }
    }

    /**
     * Creates an always-active value.
     */
    public static <T> TimeScoped<T> always(T value) {
        return new TimeScoped<>(value, null, null);
    }

    /**
     * Creates a value active from the given instant onwards.
     */
    public static <T> TimeScoped<T> from(T value, Instant validFrom) {
        return new TimeScoped<>(value, validFrom, null);
    }

    /**
     * Returns true when the instant is absent or falls within the inclusive range.
     */
    public boolean isActiveAt(Instant instant) {
        if (instant == null) {
            return true;
        }
        return (validFrom == null || !instant.isBefore(validFrom))
                && (validTo == null || !instant.isAfter(validTo));
    }

    /**
     * Returns true if either bound is set.
     */
    public boolean isScoped() {
        return validFrom != null || validTo != null;
    }

    /**
     * Returns a copy with the value transformed and the same range.
     */
    public <R> TimeScoped<R> map(Function<? super T, ? extends R> mapper) {
        return new TimeScoped<>(mapper.apply(value), validFrom, validTo);
    }
}
