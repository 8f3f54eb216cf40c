package com.movesim.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's exceptions. Carries the {@link ErrorCode} the web layer serves it
 * with, plus optional structured details (field name to problem) for the error body.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Throwable cause, Map<String, Object> details) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public boolean isServerError() {
        return errorCode.getHttpStatus().is5xxServerError();
    }
}
