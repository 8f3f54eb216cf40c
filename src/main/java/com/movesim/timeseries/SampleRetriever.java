package com.movesim.timeseries;

import com.movesim.codec.SampleCodec;
import com.movesim.domain.model.Sample;
import com.movesim.exception.SampleEncodingException;
import com.movesim.exception.StoreUnavailableException;
import com.movesim.observability.SimulationMetrics;
import com.movesim.repository.SampleKeys;
import com.movesim.repository.SampleStore;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads an entity's recorded history and returns a chronologically ordered, fraction-windowed
 * slice of it.
 *
 * <p>Storage order is not chronological, so every fetch decodes the full stream and sorts it by
 * timestamp before windowing. Records that fail to decode are logged and skipped; the rest of
 * the fetch proceeds. Reads do not go through the session supervisor and may run concurrently
 * with generators writing the same key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SampleRetriever {

    private final SampleStore sampleStore;
    private final SampleCodec sampleCodec;
    private final SimulationMetrics simulationMetrics;

    /**
     * Returns the samples of {@code entityId} in {@code [floor(min*n), floor(max*n))} of its
     * sorted history. Out-of-range fractions are clamped, see {@link FractionWindow}.
     *
     * @return the windowed samples, oldest first; empty if the entity has no decodable samples
     * @throws StoreUnavailableException if the store cannot be read
     */
    public List<Sample> fetch(String entityId, double minFraction, double maxFraction) {
        return fetch(entityId, new FractionWindow(minFraction, maxFraction));
    }

    public List<Sample> fetch(String entityId, FractionWindow window) {
        String key = SampleKeys.forEntity(entityId);

        List<byte[]> payloads;
        try {
            payloads = sampleStore.readAll(key);
        } catch (StoreUnavailableException e) {
            throw new StoreUnavailableException("Failed to retrieve data for user " + entityId, e);
        }

        List<Sample> samples = new ArrayList<>(payloads.size());
        for (byte[] payload : payloads) {
            try {
                samples.add(sampleCodec.decode(payload));
            } catch (SampleEncodingException e) {
                log.warn("Skipping corrupted record for user {}: {}", entityId, e.getMessage());
                simulationMetrics.recordUndecodable();
            }
        }

        samples.sort(Sample.BY_TIMESTAMP);

        List<Sample> windowed = window.apply(samples);
        log.debug(
                "Fetched {} of {} samples for user {} (window [{}, {}])",
                windowed.size(),
                samples.size(),
                entityId,
                window.minFraction(),
                window.maxFraction());
        return windowed;
    }
}
