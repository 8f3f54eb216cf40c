package com.movesim.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes written to {@code error.code} of every error response, each
 * bound to the HTTP status it is served with.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED),
    UNSUPPORTED_MEDIA_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    ENDPOINT_NOT_FOUND(HttpStatus.NOT_FOUND),
    NO_DATA_IN_RANGE(HttpStatus.NOT_FOUND),
    /** Per-record codec failure. Contained by generators and readers, so never served in practice. */
    RECORD_UNDECODABLE(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    public String getCode() {
        return name();
    }
}
