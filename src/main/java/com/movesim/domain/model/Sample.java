package com.movesim.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Comparator;

/**
 * One recorded displacement of an entity.
 *
 * <p>Stored as a JSON document with fields {@code dx}, {@code dy} and {@code ts}. Samples of a
 * single entity are not written in chronological order (size- and time-triggered flushes race),
 * so readers must sort with {@link #BY_TIMESTAMP} before relying on order.
 *
 * @param deltaX    displacement along the x axis
 * @param deltaY    displacement along the y axis
 * @param timestamp when the sample was generated
 */
public record Sample(
        @JsonProperty("dx") double deltaX,
        @JsonProperty("dy") double deltaY,
        @JsonProperty("ts") Instant timestamp) {

    public static final Comparator<Sample> BY_TIMESTAMP = Comparator.comparing(Sample::timestamp);
}
