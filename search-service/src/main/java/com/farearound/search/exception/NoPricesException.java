package com.farearound.search.exception;

/**
 * Thrown when a flight search produced no offer with a usable price.
 */
public class NoPricesException extends SearchException {

    private static final String ERROR_CODE = "NO_PRICES";

    public NoPricesException() {
        super(ERROR_CODE, "No valid flight prices found");
    }
}
