package com.movesim.simulator;

import com.movesim.domain.model.Sample;
import java.time.Instant;
import java.util.SplittableRandom;

/**
 * Random-walk step generator: a uniformly random direction in [0, 2&pi;) and a uniformly random
 * magnitude in [0, maxStepMagnitude). The upper bound is exclusive, as
 * {@link SplittableRandom#nextDouble()} never returns 1.0, so a step of exactly
 * {@code maxStepMagnitude} is never produced.
 *
 * <p>Not thread-safe. Each generator owns one instance with its own random stream.
 */
public class MovementModel {

    private static final double FULL_TURN = 2 * Math.PI;

    private final SplittableRandom random;
    private final double maxStepMagnitude;

    public MovementModel(SplittableRandom random, double maxStepMagnitude) {
        if (maxStepMagnitude < 0 || Double.isNaN(maxStepMagnitude) || Double.isInfinite(maxStepMagnitude)) {
            throw new IllegalArgumentException("maxStepMagnitude must be a finite non-negative number");
        }
        this.random = random;
        this.maxStepMagnitude = maxStepMagnitude;
    }

    public Sample nextStep(Instant timestamp) {
        double angle = random.nextDouble() * FULL_TURN;
        double magnitude = random.nextDouble() * maxStepMagnitude;
        return new Sample(magnitude * Math.cos(angle), magnitude * Math.sin(angle), timestamp);
    }
}
