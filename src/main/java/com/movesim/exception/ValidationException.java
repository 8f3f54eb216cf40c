package com.movesim.exception;

import java.util.Map;

/**
 * Malformed or out-of-domain input: an entity list that is empty after filtering, a fraction
 * outside [0, 1], or a lower fraction above the upper one.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, null, details);
    }
}
