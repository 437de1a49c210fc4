package com.farearound.search.constants;

public final class SearchConstants {

    private SearchConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Flight Search Defaults ==========

    public static final int DEFAULT_ADULTS = 1;
    public static final int MIN_ADULTS = 1;
    public static final int MAX_ADULTS = 9;

    public static final int DEFAULT_MAX_RESULTS = 20;
    public static final int MIN_RESULTS = 1;
    public static final int MAX_RESULTS = 50;

    public static final String DEFAULT_CURRENCY_CODE = "INR";

    // ========== Location Codes ==========

    public static final String IATA_CODE_PATTERN = "^[A-Za-z]{3}$";

    // ========== Insight ==========

    public static final int CLOSE_TO_DEPARTURE_DAYS = 7;
    public static final int MID_RANGE_DEPARTURE_DAYS = 21;
    public static final String DEAL_THRESHOLD = "0.88";
    public static final double BASE_CONFIDENCE = 0.55;
    public static final double MIN_CONFIDENCE = 0.45;
    public static final double MAX_CONFIDENCE = 0.85;
}
