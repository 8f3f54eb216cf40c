package com.movesim.exception;

import com.movesim.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure escaping a controller to an {@link ApiErrorResponse}.
 *
 * <p>Client errors (bad JSON, failed bean validation, non-numeric query parameters, unknown
 * paths, wrong content types, application {@link ValidationException}s, empty result windows)
 * are logged at WARN without a stack trace.
 * Store outages and anything unexpected are logged at ERROR with the stack trace.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleApplicationException(BaseException ex, HttpServletRequest request) {
        if (ex.isServerError()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        }
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.warn("{} {} rejected: invalid fields {}", request.getMethod(), request.getRequestURI(), fieldErrors.keySet());
        return respond(ErrorCode.VALIDATION_ERROR, "Request body failed validation", fieldErrors, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleParameterType(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String message = "Invalid '" + ex.getName() + "' parameter: '" + ex.getValue() + "' is not a valid "
                + (ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "value");
        return respond(ErrorCode.VALIDATION_ERROR, message, null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("{} {} rejected: unreadable body", request.getMethod(), request.getRequestURI());
        return respond(ErrorCode.MALFORMED_REQUEST, "Invalid request body", null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleWrongMethod(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return respond(ErrorCode.METHOD_NOT_ALLOWED, "Method " + ex.getMethod() + " is not allowed here", null, request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleWrongContentType(
            HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        log.warn("{} {} rejected: content type {}", request.getMethod(), request.getRequestURI(), ex.getContentType());
        return respond(
                ErrorCode.UNSUPPORTED_MEDIA_TYPE,
                "Content type '" + ex.getContentType() + "' is not supported, use application/json",
                null,
                request);
    }

    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ApiErrorResponse> handleUnknownEndpoint(Exception ex, HttpServletRequest request) {
        log.warn("{} {} rejected: no such endpoint", request.getMethod(), request.getRequestURI());
        return respond(
                ErrorCode.ENDPOINT_NOT_FOUND,
                "No endpoint " + request.getMethod() + " " + request.getRequestURI(),
                null,
                request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} failed unexpectedly", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private static ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiErrorResponse.of(errorCode, message, details, request.getRequestURI()));
    }
}
