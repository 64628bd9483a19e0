package com.device.registry.review;

import com.device.registry.api.Page;
import com.device.registry.api.PageRequest;
import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.Observation;

import java.util.Optional;

/**
 * Queue of identity conflicts awaiting human review. The sync core only appends entries
 * and reads their state; the reviewer transitions are invoked by the approval workflow.
 */
public interface ConflictQueue {

    /**
     * Submits a conflict entry to the queue.
     *
     * @param entry the entry to submit
     * @return the submitted entry
     */
    ConflictEntry submit(ConflictEntry entry);

    /**
     * Gets an entry by id.
     *
     * @return the entry, or null if not found
     */
    ConflictEntry get(String entryId);

    /**
     * Gets pending entries, oldest first.
     */
    Page<ConflictEntry> getPending(PageRequest page);

    Page<ConflictEntry> getPendingByKind(ConflictKind kind, PageRequest page);

    Page<ConflictEntry> getPendingBySource(String sourceId, PageRequest page);

    /**
     * Finds a pending entry raised for the same (source, api device id, ip) and kind.
     */
    Optional<ConflictEntry> findPending(Observation observation, ConflictKind kind);

    /**
     * Approves an entry for import.
     *
     * @throws IllegalArgumentException if the id is unknown
     * @throws IllegalStateException    if the entry is not pending
     */
    void approve(String entryId, String reviewerId, String notes);

    void reject(String entryId, String reviewerId, String notes);

    /**
     * Marks an entry as a duplicate of an existing device; nothing is imported.
     */
    void markDuplicate(String entryId, String reviewerId, String notes);

    /**
     * Records that an approved entry was imported as {@code deviceRef}.
     *
     * @throws IllegalStateException if the entry is not approved
     */
    void markImported(String entryId, String deviceRef, String reviewerId);

    long countPending();
}
