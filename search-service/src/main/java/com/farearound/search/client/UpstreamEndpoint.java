package com.farearound.search.client;

import com.farearound.search.constants.UpstreamConstants;

/**
 * Authenticated search endpoints of the upstream travel API.
 */
public enum UpstreamEndpoint {

    FLIGHT_OFFERS("flight-offers", UpstreamConstants.FLIGHT_OFFERS_PATH),
    HOTEL_OFFERS("hotel-offers", UpstreamConstants.HOTEL_OFFERS_PATH);

    private final String operation;
    private final String path;

    UpstreamEndpoint(String operation, String path) {
        this.operation = operation;
        this.path = path;
    }

    public String operation() {
        return operation;
    }

    public String path() {
        return path;
    }
}
