package com.movesim.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Windowed, chronologically ordered history of one user.
 */
@Getter
@Builder
public class UserLocationResponse {

    @JsonProperty("user_id")
    private final String userId;

    private final List<LocationPointResponse> data;
}
