package com.farearound.search.exception;

/**
 * Thrown when the upstream API returned a non-retryable error or retries were exhausted.
 * Carries the last observed HTTP status, or {@code null} when the last failure was network-level.
 */
public class UpstreamException extends SearchException {

    private static final String ERROR_CODE = "UPSTREAM_ERROR";

    private final Integer statusCode;

    public UpstreamException(String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(ERROR_CODE, message, retryable, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean hasStatus(int status) {
        return statusCode != null && statusCode == status;
    }

    public static UpstreamException nonRetryable(String operation, int statusCode, String detail, Throwable cause) {
        return new UpstreamException(
                String.format("Upstream %s rejected with status %d: %s", operation, statusCode, detail),
                statusCode, false, cause);
    }

    public static UpstreamException exhausted(String operation, int attempts, Integer statusCode,
                                              String detail, Throwable cause) {
        String status = statusCode != null ? "status " + statusCode : "network error";
        return new UpstreamException(
                String.format("Upstream %s failed after %d attempts (%s): %s", operation, attempts, status, detail),
                statusCode, true, cause);
    }
}
