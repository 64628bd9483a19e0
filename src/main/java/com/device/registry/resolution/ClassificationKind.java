package com.device.registry.resolution;

/**
 * Outcome of resolving one observation against the registry.
 */
public enum ClassificationKind {
    NEW,
    DUPLICATE,
    MOVED,
    CONFLICT
}
