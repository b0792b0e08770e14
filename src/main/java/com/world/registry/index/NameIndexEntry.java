package com.world.registry.index;

import com.world.registry.core.model.Identity;
import com.world.registry.core.model.IdentityKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable index entry: the owner of a key, its priority tier, and every owner
 * that claimed the key at the same tier when it is ambiguous.
 */
public final class NameIndexEntry {
    private final Identity owner;
    private final IndexPriority priority;
    private final boolean ambiguous;
    private final List<Identity> owners;

    NameIndexEntry(Identity owner, IndexPriority priority, boolean ambiguous, List<Identity> owners) {
        this.owner = Objects.requireNonNull(owner, "owner is required");
        this.priority = Objects.requireNonNull(priority, "priority is required");
        this.ambiguous = ambiguous;
        this.owners = List.copyOf(owners);
    }

    /**
     * First owner that claimed the key. Meaningless for resolution when {@link #isAmbiguous()}.
     */
    public Identity getOwner() {
        return owner;
    }

    public IdentityKind getOwnerKind() {
        return owner.getKind();
    }

    public IndexPriority getPriority() {
        return priority;
    }

    public boolean isAmbiguous() {
        return ambiguous;
    }

    /**
     * All distinct owners at the winning priority, in claim order.
     */
    public List<Identity> getOwners() {
        return owners;
    }

    /**
     * Returns the owner when the entry is unambiguous and matches the optional kind filter.
     * Ambiguous entries never resolve, even if the filter would leave one owner.
     */
    public Optional<Identity> resolve(IdentityKind kind) {
        if (ambiguous) {
            return Optional.empty();
        }
        if (kind != null && owner.getKind() != kind) {
            return Optional.empty();
        }
        return Optional.of(owner);
    }

    @Override
    public String toString() {
        return "NameIndexEntry{" +
                "owner=" + owner.getCanonicalName() +
                ", priority=" + priority +
                ", ambiguous=" + ambiguous +
                ", owners=" + owners.stream().map(Identity::getCanonicalName).toList() +
                '}';
    }
}
