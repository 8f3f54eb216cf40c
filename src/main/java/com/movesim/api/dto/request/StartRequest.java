package com.movesim.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /start}: {@code {"user_ids": ["u1", "u2"], "duration_seconds": 30}}.
 * Empty-string ids inside the list are dropped by the supervisor, not rejected here.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class StartRequest {

    @JsonProperty("user_ids")
    @NotEmpty(message = "User ID list cannot be empty")
    private List<String> userIds;

    /** Optional override of the configured session length. */
    @JsonProperty("duration_seconds")
    @Min(value = 1, message = "Duration must be at least 1 second")
    @Max(value = 3600, message = "Duration must be at most 3600 seconds")
    private Integer durationSeconds;
}
