package com.movesim.simulator;

import com.movesim.codec.SampleCodec;
import com.movesim.config.SimulationConfig;
import com.movesim.domain.model.Sample;
import com.movesim.exception.SampleEncodingException;
import com.movesim.observability.SimulationMetrics;
import com.movesim.repository.SampleKeys;
import com.movesim.repository.SampleStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates the random-walk sample stream of one entity until its cancellation token fires.
 *
 * <p>Each pass of the loop checks, in order:
 * <ol>
 *   <li>cancelled: flush whatever is buffered and exit</li>
 *   <li>flush interval elapsed: flush the buffer and re-arm the interval</li>
 *   <li>otherwise: generate one sample; a full buffer is flushed at once and also re-arms the
 *       interval</li>
 * </ol>
 * Between passes the task parks on its token until the next sample or flush is due, so a stop
 * wakes it immediately.
 *
 * <p>Flushes are at-most-once: a batch the store rejects is logged and dropped, never retried,
 * and generation carries on. The buffer is replaced on every flush and never shared with another
 * thread. A flush blocks the generator for as long as the store call takes.
 */
@Slf4j
public class MovementGenerator implements Runnable {

    private final String entityId;
    private final String storeKey;
    private final CancellationToken cancellationToken;
    private final MovementModel movementModel;
    private final SampleStore sampleStore;
    private final SampleCodec sampleCodec;
    private final SimulationMetrics simulationMetrics;

    private final int batchSize;
    private final long flushIntervalNanos;
    private final long sampleIntervalNanos;

    public MovementGenerator(
            String entityId,
            CancellationToken cancellationToken,
            MovementModel movementModel,
            SampleStore sampleStore,
            SampleCodec sampleCodec,
            SimulationMetrics simulationMetrics,
            SimulationConfig simulationConfig) {
        if (simulationConfig.getBatchSize() < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.entityId = entityId;
        this.storeKey = SampleKeys.forEntity(entityId);
        this.cancellationToken = cancellationToken;
        this.movementModel = movementModel;
        this.sampleStore = sampleStore;
        this.sampleCodec = sampleCodec;
        this.simulationMetrics = simulationMetrics;
        this.batchSize = simulationConfig.getBatchSize();
        this.flushIntervalNanos = simulationConfig.getFlushInterval().toNanos();
        this.sampleIntervalNanos = simulationConfig.getSampleInterval().toNanos();
    }

    @Override
    public void run() {
        log.info("Starting simulation for entity {}", entityId);
        simulationMetrics.generatorStarted();

        List<Sample> buffer = new ArrayList<>(batchSize);
        try {
            long nextFlushAt = System.nanoTime() + flushIntervalNanos;

            while (!cancellationToken.isCancelled()) {
                long now = System.nanoTime();

                if (now - nextFlushAt >= 0) {
                    buffer = flush(buffer, "interval");
                    nextFlushAt = System.nanoTime() + flushIntervalNanos;
                    continue;
                }

                buffer.add(movementModel.nextStep(Instant.now()));
                simulationMetrics.sampleGenerated();

                if (buffer.size() >= batchSize) {
                    buffer = flush(buffer, "size");
                    nextFlushAt = System.nanoTime() + flushIntervalNanos;
                }

                long waitNanos = Math.min(sampleIntervalNanos, nextFlushAt - System.nanoTime());
                if (waitNanos > 0) {
                    cancellationToken.awaitCancellation(Math.max(1, TimeUnit.NANOSECONDS.toMillis(waitNanos)));
                }
            }
        } catch (InterruptedException e) {
            log.info("Simulation for entity {} interrupted", entityId);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Simulation for entity {} failed: {}", entityId, e.getMessage(), e);
        } finally {
            flush(buffer, "final");
            simulationMetrics.generatorStopped();
            log.info(
                    "Stopping simulation for entity {} ({})",
                    entityId,
                    cancellationToken.getCause().map(Enum::name).orElse("no cancellation"));
        }
    }

    /**
     * Writes the batch to the store and returns a fresh buffer. Samples that fail to encode are
     * skipped; a store failure drops the whole batch.
     */
    private List<Sample> flush(List<Sample> batch, String trigger) {
        if (batch.isEmpty()) {
            return batch;
        }

        List<byte[]> payloads = new ArrayList<>(batch.size());
        for (Sample sample : batch) {
            try {
                payloads.add(sampleCodec.encode(sample));
            } catch (SampleEncodingException e) {
                log.warn("Skipping sample for entity {}: {}", entityId, e.getMessage());
                simulationMetrics.samplesDropped(1);
            }
        }

        try {
            sampleStore.appendBatch(storeKey, payloads);
            simulationMetrics.samplesFlushed(payloads.size());
            log.debug("Flushed {} samples for entity {} ({} trigger)", payloads.size(), entityId, trigger);
        } catch (RuntimeException e) {
            log.error(
                    "Error flushing {} samples for entity {} ({} trigger), batch dropped: {}",
                    payloads.size(),
                    entityId,
                    trigger,
                    e.getMessage());
            simulationMetrics.samplesDropped(payloads.size());
        }

        return new ArrayList<>(batchSize);
    }
}
