package com.farearound.search.exception;

import lombok.Getter;


@Getter
public class SearchException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public SearchException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public SearchException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public SearchException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
