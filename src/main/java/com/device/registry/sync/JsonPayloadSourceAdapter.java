package com.device.registry.sync;

import com.device.registry.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Source adapter for vendors that return a JSON device list. Transport is delegated to a
 * {@link PayloadFetcher}; parsing to an {@link ObservationMapper}.
 */
public class JsonPayloadSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(JsonPayloadSourceAdapter.class);

    private final String sourceId;
    private final PayloadFetcher fetcher;
    private final ObservationMapper mapper;
    private final Clock clock;

    public JsonPayloadSourceAdapter(String sourceId, PayloadFetcher fetcher) {
        this(sourceId, fetcher, new ObservationMapper(), Clock.systemUTC());
    }

    public JsonPayloadSourceAdapter(String sourceId, PayloadFetcher fetcher, ObservationMapper mapper, Clock clock) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public List<Observation> fetchBatch(String requestedSourceId) {
        if (!sourceId.equals(requestedSourceId)) {
            throw new IllegalArgumentException("Adapter for " + sourceId + " asked to fetch " + requestedSourceId);
        }

        String payload;
        try {
            payload = fetcher.fetch(sourceId);
        } catch (IOException e) {
            throw new AdapterFetchException(sourceId, "Failed to fetch devices from " + sourceId + ": "
                    + e.getMessage(), e);
        }
        if (payload == null || payload.isBlank()) {
            throw new AdapterFetchException(sourceId, "Empty payload from " + sourceId);
        }

        List<Observation> observations = mapper.map(sourceId, payload, clock.instant());
        log.debug("Fetched {} observations from {}", observations.size(), sourceId);
        return observations;
    }
}
