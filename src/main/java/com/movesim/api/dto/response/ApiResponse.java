package com.movesim.api.dto.response;

import java.time.Instant;

/**
 * Success envelope applied to every controller response by
 * {@link com.movesim.config.ApiResponseAdvice}.
 */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
