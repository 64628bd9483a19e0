package com.device.registry.sync;

import java.io.IOException;

/**
 * Retrieves the raw JSON device list for a source, e.g. from a vendor HTTP API.
 */
@FunctionalInterface
public interface PayloadFetcher {

    String fetch(String sourceId) throws IOException;
}
