package com.device.registry.core.model;

/**
 * Kind of identity collision that could not be resolved automatically.
 */
public enum ConflictKind {
    /** The (source, api device id) pair is already bound to different hardware. */
    DUPLICATE_API_ID,
    /** The observed IP is held by a device whose serial or MAC disagrees. */
    IP_CONFLICT,
    /** A serial or MAC is already registered under a different source binding. */
    CROSS_SOURCE_COLLISION
}
