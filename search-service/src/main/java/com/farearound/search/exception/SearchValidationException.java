package com.farearound.search.exception;


public class SearchValidationException extends SearchException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public SearchValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
