package com.movesim.repository;

import com.movesim.exception.StoreUnavailableException;
import java.util.List;

/**
 * Append-only store of opaque sample payloads, one logical stream per key.
 *
 * <p>Implementations must be safe for concurrent use by many generators and readers at once;
 * callers add no locking of their own. Payload order on read is unspecified.
 */
public interface SampleStore {

    /**
     * Appends a batch of payloads to the stream under {@code key}. Repeated calls with the same
     * key accumulate; identical payloads are kept.
     *
     * @throws StoreUnavailableException if the store is closed or unreachable
     */
    void appendBatch(String key, List<byte[]> payloads);

    /**
     * Returns every payload ever appended under {@code key}, or an empty list for an unknown key.
     *
     * @throws StoreUnavailableException if the store is closed or unreachable
     */
    List<byte[]> readAll(String key);
}
