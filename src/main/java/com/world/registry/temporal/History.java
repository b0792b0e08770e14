package com.world.registry.temporal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of time-scoped values for one property.
 *
 * <p>Entries are stable-sorted by validFrom (nulls first) before any active-value query,
 * so the answer never depends on the order entries were appended in. The active value at
 * an instant is the last sorted entry whose range contains it.</p>
 *
 * <p>Not thread-safe while being appended to. Once {@link #sort()} has run and no further
 * entries are added, reads do not mutate state.</p>
 */
public class History<T> {

    private final List<TimeScoped<T>> entries = new ArrayList<>();
    private boolean sorted = true;

    public void add(TimeScoped<T> entry) {
        entries.add(entry);
        sorted = false;
    }

    public void addAll(Collection<TimeScoped<T>> newEntries) {
        entries.addAll(newEntries);
        sorted = newEntries.isEmpty() && sorted;
    }

    /**
     * Stable-sorts entries by validFrom, unscoped starts first.
     */
    public void sort() {
        if (!sorted) {
            entries.sort(TimeScoped.BY_VALID_FROM);
            sorted = true;
        }
    }

    /**
     * Returns the last entry active at the instant (or the last entry overall when the instant is null).
     */
    public Optional<T> activeAt(Instant instant) {
        sort();
        for (int i = entries.size() - 1; i >= 0; i--) {
            TimeScoped<T> entry = entries.get(i);
            if (entry.isActiveAt(instant)) {
                return Optional.of(entry.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first entry active at the instant.
     */
    public Optional<T> firstActiveAt(Instant instant) {
        sort();
        for (TimeScoped<T> entry : entries) {
            if (entry.isActiveAt(instant)) {
                return Optional.of(entry.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns every entry active at the instant, in sorted order.
     */
    public List<T> allActiveAt(Instant instant) {
        sort();
        List<T> active = new ArrayList<>();
        for (TimeScoped<T> entry : entries) {
            if (entry.isActiveAt(instant)) {
                active.add(entry.value());
            }
        }
        return active;
    }

    public List<TimeScoped<T>> entries() {
        sort();
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "History" + entries;
    }
}
