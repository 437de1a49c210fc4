package com.farearound.search.exception;

import com.farearound.search.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps search and upstream failures to HTTP responses.
 * Upstream and credential failures surface as 502, or 503 when the upstream kept rate limiting.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SearchValidationException.class)
    public ResponseEntity<ApiError> handleValidation(SearchValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(ex.getErrorCode(), ex.getMessage(), false));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }
        log.warn("Validation errors: {}", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiError.builder()
                        .error("VALIDATION_ERROR")
                        .message("Invalid request")
                        .details(fieldErrors)
                        .build());
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ApiError> handleAuthentication(AuthenticationException ex) {
        log.error("Upstream authentication failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(error(ex.getErrorCode(), ex.getMessage(), ex.isRetryable()));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ApiError> handleUpstream(UpstreamException ex) {
        HttpStatus status = ex.hasStatus(429) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        log.error("Upstream error: status={}, retryable={}, message={}",
                ex.getStatusCode(), ex.isRetryable(), ex.getMessage());

        ApiError apiError = ApiError.builder()
                .error(ex.getErrorCode())
                .message(ex.getMessage())
                .retryable(ex.isRetryable())
                .upstreamStatus(ex.getStatusCode())
                .build();

        return ResponseEntity.status(status).body(apiError);
    }

    @ExceptionHandler(NoPricesException.class)
    public ResponseEntity<ApiError> handleNoPrices(NoPricesException ex) {
        log.warn("No usable prices: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(error(ex.getErrorCode(), ex.getMessage(), false));
    }

    @ExceptionHandler(SearchException.class)
    public ResponseEntity<ApiError> handleSearchException(SearchException ex) {
        log.error("Search error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(ex.getErrorCode(), ex.getMessage(), ex.isRetryable()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParam(MissingServletRequestParameterException ex) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error("MISSING_PARAMETER",
                        "Required parameter missing: " + ex.getParameterName(), false));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch: parameter={}", ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error("TYPE_MISMATCH", "Invalid value for parameter: " + ex.getName(), false));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error("INVALID_ARGUMENT", ex.getMessage(), false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected exception: ", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("INTERNAL_ERROR", "An unexpected error occurred", true));
    }

    private static ApiError error(String code, String message, boolean retryable) {
        return ApiError.builder()
                .error(code)
                .message(message)
                .retryable(retryable)
                .build();
    }
}
