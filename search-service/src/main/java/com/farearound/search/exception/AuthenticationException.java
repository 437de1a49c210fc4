package com.farearound.search.exception;

/**
 * Thrown when the client-credentials exchange with the upstream authorization endpoint fails.
 * Never retried internally; callers may retry the whole operation later.
 */
public class AuthenticationException extends SearchException {

    private static final String ERROR_CODE = "AUTHENTICATION_FAILED";

    public AuthenticationException(String message) {
        super(ERROR_CODE, message, true, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ERROR_CODE, message, true, cause);
    }
}
