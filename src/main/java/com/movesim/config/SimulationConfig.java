package com.movesim.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for movement generation and session lifecycle.
 *
 * <p>Batching is size-or-time: a generator flushes its buffer when it holds
 * {@link #batchSize} samples or when {@link #flushInterval} has elapsed since the last flush,
 * whichever comes first.
 */
@Configuration
@ConfigurationProperties(prefix = "movesim.simulation")
@Getter
@Setter
public class SimulationConfig {

    /** Default session length when a start request does not carry its own. */
    private Duration duration = Duration.ofSeconds(30);

    /** Number of buffered samples that forces a flush. */
    private int batchSize = 100;

    /** Maximum time between flushes of a non-empty buffer. */
    private Duration flushInterval = Duration.ofMillis(100);

    /** Pause between two generated samples of one entity. */
    private Duration sampleInterval = Duration.ofMillis(1);

    /** Upper bound of a single step's magnitude. */
    private double maxStepMagnitude = 0.004;

    /** How long stop and start wait for cancelled generators to finish their final flush. */
    private Duration stopGracePeriod = Duration.ofSeconds(2);
}
