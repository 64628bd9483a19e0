package com.device.registry.sync;

import com.device.registry.core.model.Observation;

import java.util.List;

/**
 * Produces observation batches for one vendor source. Vendor authentication, pagination
 * and payload parsing live behind this interface.
 */
public interface SourceAdapter {

    /**
     * The source id this adapter serves.
     */
    String sourceId();

    /**
     * Fetches the current batch of observations.
     *
     * @throws AdapterFetchException if the source is unreachable or the payload is unusable
     */
    List<Observation> fetchBatch(String sourceId);
}
