package com.device.registry.review;

/**
 * Review status of a {@link ConflictEntry}. Only a reviewer moves an entry out of
 * {@link #PENDING}.
 */
public enum ConflictStatus {
    PENDING,
    APPROVED,
    REJECTED,
    IMPORTED,
    DUPLICATE;

    public boolean isTerminal() {
        return this == REJECTED || this == IMPORTED || this == DUPLICATE;
    }
}
