package com.movesim.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Snapshot of the simulation session as seen by the supervisor at one moment.
 */
@Data
@Builder
public class SessionSummary {

    /** Whether a session is live. False means every other field except entityIds is null. */
    private boolean active;

    private String sessionId;

    /** Entities with a running generator, in request order. Empty when idle. */
    @Builder.Default
    private List<String> entityIds = List.of();

    private Instant startedAt;

    /** When the session stops on its own if nobody stops it first. */
    private Instant deadline;

    public static SessionSummary idle() {
        return SessionSummary.builder().active(false).build();
    }
}
