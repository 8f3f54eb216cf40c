package com.movesim.repository.memory;

import com.movesim.exception.StoreUnavailableException;
import com.movesim.repository.SampleStore;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link SampleStore} for running without Redis ({@code movesim.store.type=memory}).
 * Data lives only as long as the application context. After {@link #close()} every call fails
 * with {@link StoreUnavailableException}.
 */
@Repository
@ConditionalOnProperty(prefix = "movesim.store", name = "type", havingValue = "memory")
@Slf4j
public class InMemorySampleStore implements SampleStore {

    private final Map<String, List<byte[]>> streams = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    @Override
    public void appendBatch(String key, List<byte[]> payloads) {
        ensureOpen();
        List<byte[]> stream = streams.computeIfAbsent(key, k -> Collections.synchronizedList(new ArrayList<>()));
        stream.addAll(payloads);
    }

    @Override
    public List<byte[]> readAll(String key) {
        ensureOpen();
        List<byte[]> stream = streams.get(key);
        if (stream == null) {
            return List.of();
        }
        synchronized (stream) {
            return new ArrayList<>(stream);
        }
    }

    @PreDestroy
    public void close() {
        if (!closed) {
            closed = true;
            log.info("In-memory sample store closed ({} keys)", streams.size());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreUnavailableException("Sample store is not initialized or already closed");
        }
    }
}
