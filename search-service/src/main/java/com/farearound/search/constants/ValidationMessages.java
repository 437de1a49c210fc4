package com.farearound.search.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Flight Search Messages ==========

    public static final String FLIGHT_SEARCH_REQUIRED = "Flight search request is required";
    public static final String ORIGIN_REQUIRED = "Origin is required";
    public static final String DESTINATION_REQUIRED = "Destination is required";
    public static final String ORIGIN_INVALID = "Origin must be a 3-letter IATA code";
    public static final String DESTINATION_INVALID = "Destination must be a 3-letter IATA code";
    public static final String ORIGIN_DESTINATION_SAME = "Origin and destination cannot be the same";
    public static final String DEPARTURE_DATE_REQUIRED = "Departure date is required";
    public static final String DEPARTURE_DATE_NOT_PAST = "Departure date cannot be in the past";
    public static final String ADULTS_OUT_OF_RANGE = "Adults must be between 1 and 9";
    public static final String MAX_OUT_OF_RANGE = "Max results must be between 1 and 50";

    // ========== Hotel Search Messages ==========

    public static final String HOTEL_SEARCH_REQUIRED = "Hotel search request is required";
    public static final String CITY_CODE_REQUIRED = "City code is required";
    public static final String CITY_CODE_INVALID = "City code must be a 3-letter IATA code";
    public static final String CHECK_IN_REQUIRED = "Check-in date is required";
    public static final String CHECK_OUT_REQUIRED = "Check-out date is required";
    public static final String CHECK_OUT_AFTER_CHECK_IN = "Check-out must be after check-in";
}
