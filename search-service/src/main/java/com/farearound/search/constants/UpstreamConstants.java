package com.farearound.search.constants;

public final class UpstreamConstants {

    private UpstreamConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Upstream Paths ==========

    public static final String TOKEN_PATH = "/v1/security/oauth2/token";
    public static final String FLIGHT_OFFERS_PATH = "/v2/shopping/flight-offers";
    public static final String HOTEL_OFFERS_PATH = "/v1/shopping/hotel-offers";

    // ========== OAuth2 ==========

    public static final String GRANT_TYPE_CLIENT_CREDENTIALS = "client_credentials";
    public static final long DEFAULT_TOKEN_EXPIRES_IN_SECONDS = 3600;
    public static final long DEFAULT_REFRESH_MARGIN_SECONDS = 30;

    // ========== Cache Defaults ==========

    public static final long DEFAULT_CACHE_TTL_SECONDS = 60;
    public static final int DEFAULT_CACHE_CAPACITY = 512;

    // ========== Retry Defaults ==========

    public static final int DEFAULT_MAX_ATTEMPTS = 4;
    public static final long DEFAULT_INITIAL_BACKOFF_MS = 1000;
    public static final String RETRY_AFTER_HEADER = "Retry-After";
    public static final long MAX_RETRY_AFTER_SECONDS = 300;
    public static final long MAX_BACKOFF_MS = 60_000;

    // ========== Metrics ==========

    public static final String METRIC_CACHE_LOOKUPS = "upstream.cache.lookups";
    public static final String METRIC_REQUEST_DURATION = "upstream.request.duration";
}
