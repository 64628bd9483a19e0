package com.device.registry.resolution;

import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.Device;

import java.util.Objects;

/**
 * Result of resolving an observation. Carries the registry snapshot the decision was
 * made against so the caller can write with an optimistic version check.
 */
public record Classification(
        ClassificationKind kind,
        Device existing,
        String oldIp,
        String newIp,
        ConflictKind conflictKind,
        MatchKey matchedBy,
        String reasoning
) {
    public Classification {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == ClassificationKind.CONFLICT) {
            Objects.requireNonNull(conflictKind, "conflictKind is required for a conflict");
        } else if (conflictKind != null) {
            throw new IllegalArgumentException("conflictKind is only valid for a conflict");
        }
        if ((kind == ClassificationKind.DUPLICATE || kind == ClassificationKind.MOVED) && existing == null) {
            throw new IllegalArgumentException(kind + " requires an existing device");
        }
        if (kind == ClassificationKind.MOVED) {
            Objects.requireNonNull(oldIp, "oldIp is required for a move");
            Objects.requireNonNull(newIp, "newIp is required for a move");
        }
    }

    /**
     * Creates a classification for an observation with no registry match.
     */
    public static Classification newDevice() {
        return new Classification(ClassificationKind.NEW, null, null, null, null, null,
                "No matching device found");
    }

    public static Classification duplicate(Device existing, MatchKey matchedBy, String reasoning) {
        return new Classification(ClassificationKind.DUPLICATE, existing, null, null, null, matchedBy, reasoning);
    }

    public static Classification moved(Device existing, String newIp, MatchKey matchedBy, String reasoning) {
        return new Classification(ClassificationKind.MOVED, existing, existing.getIp(), newIp, null,
                matchedBy, reasoning);
    }

    /**
     * Creates a conflict classification. {@code existing} may be null when no single
     * device is implicated.
     */
    public static Classification conflict(Device existing, ConflictKind conflictKind, MatchKey matchedBy,
                                          String reasoning) {
        return new Classification(ClassificationKind.CONFLICT, existing, null, null, conflictKind,
                matchedBy, reasoning);
    }

    /**
     * Returns the reference of the matched device, or null for {@link ClassificationKind#NEW}.
     */
    public String existingRef() {
        return existing != null ? existing.getId() : null;
    }

    public boolean isNew() {
        return kind == ClassificationKind.NEW;
    }

    public boolean isConflict() {
        return kind == ClassificationKind.CONFLICT;
    }

    /**
     * Returns true if the caller should update an existing device.
     */
    public boolean isMatch() {
        return kind == ClassificationKind.DUPLICATE || kind == ClassificationKind.MOVED;
    }
}
