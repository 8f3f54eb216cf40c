package com.movesim.observability;

import com.movesim.event.SimulationSessionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the simulation pipeline.
 *
 * <ul>
 *   <li><b>movesim.samples.generated</b> (counter): samples produced by all generators</li>
 *   <li><b>movesim.samples.flushed</b> (counter): samples accepted by the store</li>
 *   <li><b>movesim.samples.dropped</b> (counter): samples lost to failed flushes or encoding</li>
 *   <li><b>movesim.records.undecodable</b> (counter): stored records skipped on read</li>
 *   <li><b>movesim.generators.active</b> (gauge): generator tasks currently running</li>
 *   <li><b>movesim.sessions</b> (counter, tag {@code type}): session lifecycle transitions</li>
 * </ul>
 */
@Service
public class SimulationMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter samplesGenerated;
    private final Counter samplesFlushed;
    private final Counter samplesDropped;
    private final Counter recordsUndecodable;
    private final AtomicInteger activeGenerators = new AtomicInteger();

    public SimulationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.samplesGenerated = Counter.builder("movesim.samples.generated")
                .description("Samples produced by all generators")
                .register(meterRegistry);

        this.samplesFlushed = Counter.builder("movesim.samples.flushed")
                .description("Samples written to the sample store")
                .register(meterRegistry);

        this.samplesDropped = Counter.builder("movesim.samples.dropped")
                .description("Samples discarded by failed flushes or encoding errors")
                .register(meterRegistry);

        this.recordsUndecodable = Counter.builder("movesim.records.undecodable")
                .description("Stored records skipped because they could not be decoded")
                .register(meterRegistry);

        meterRegistry.gauge("movesim.generators.active", activeGenerators);
    }

    public void sampleGenerated() {
        samplesGenerated.increment();
    }

    public void samplesFlushed(int count) {
        samplesFlushed.increment(count);
    }

    public void samplesDropped(int count) {
        samplesDropped.increment(count);
    }

    public void recordUndecodable() {
        recordsUndecodable.increment();
    }

    public void generatorStarted() {
        activeGenerators.incrementAndGet();
    }

    public void generatorStopped() {
        activeGenerators.decrementAndGet();
    }

    public int getActiveGenerators() {
        return activeGenerators.get();
    }

    @EventListener
    public void onSessionEvent(SimulationSessionEvent event) {
        meterRegistry
                .counter("movesim.sessions", "type", event.getEventType().name().toLowerCase(Locale.ROOT))
                .increment();
    }
}
