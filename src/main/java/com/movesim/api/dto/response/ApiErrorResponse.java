package com.movesim.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.movesim.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/**
 * Error envelope written by {@link com.movesim.exception.GlobalExceptionHandler}.
 */
public record ApiErrorResponse(boolean success, ErrorDetail error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> safeDetails = details == null || details.isEmpty() ? null : details;
        return new ApiErrorResponse(
                false, new ErrorDetail(errorCode.getCode(), message, safeDetails, Instant.now(), path));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorDetail(String code, String message, Map<String, Object> details, Instant timestamp, String path) {}
}
