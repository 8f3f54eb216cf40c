package com.movesim.api.dto.response;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * One displacement sample as returned by {@code GET /user/{userId}}.
 */
@Getter
@Builder
public class LocationPointResponse {

    private final double dx;

    private final double dy;

    private final Instant ts;
}
