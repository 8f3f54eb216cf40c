package com.movesim.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Returned by {@code POST /start} and {@code GET /status}.
 */
@Getter
@Builder
public class SessionStatusResponse {

    private final boolean active;

    @JsonProperty("session_id")
    private final String sessionId;

    /** Users with a running generator. */
    @JsonProperty("user_ids")
    private final List<String> userIds;

    @JsonProperty("started_at")
    private final Instant startedAt;

    /** When the session stops on its own. */
    private final Instant deadline;
}
