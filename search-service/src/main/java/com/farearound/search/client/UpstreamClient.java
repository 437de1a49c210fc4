package com.farearound.search.client;

import com.farearound.search.auth.AccessToken;
import com.farearound.search.auth.TokenStore;
import com.farearound.search.cache.SingleFlight;
import com.farearound.search.cache.TtlCache;
import com.farearound.search.constants.UpstreamConstants;
import com.farearound.search.dto.FlightOffers;
import com.farearound.search.dto.FlightSearchParams;
import com.farearound.search.dto.HotelSearchParams;
import com.farearound.search.exception.UpstreamException;
import com.farearound.search.mapper.FlightOfferMapper;
import com.farearound.search.retry.RetryExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point to the upstream travel API.
 *
 * Flow per search:
 * 1. Derive the cache key from endpoint and parameters
 * 2. Serve a fresh cached payload without touching token or upstream
 * 3. On miss, obtain a valid token, GET through the retry executor, cache the payload
 *
 * Errors are passed through unchanged. Concurrent misses on one key are collapsed into a
 * single upstream call when coalescing is enabled.
 */
@Component
@Slf4j
public class UpstreamClient {

    private final RestTemplate restTemplate;
    private final TtlCache<CacheKey, JsonNode> responseCache;
    private final TokenStore tokenStore;
    private final RetryExecutor retryExecutor;
    private final MeterRegistry meterRegistry;
    private final SingleFlight<CacheKey, JsonNode> singleFlight;

    private final String baseUrl;
    private final Duration cacheTtl;
    private final boolean coalesceMisses;

    public UpstreamClient(
            RestTemplate restTemplate,
            TtlCache<CacheKey, JsonNode> responseCache,
            TokenStore tokenStore,
            RetryExecutor retryExecutor,
            MeterRegistry meterRegistry,
            @Value("${upstream.base-url}") String baseUrl,
            @Value("${upstream.cache.ttl-seconds:" + UpstreamConstants.DEFAULT_CACHE_TTL_SECONDS + "}") long cacheTtlSeconds,
            @Value("${upstream.cache.coalesce-misses:true}") boolean coalesceMisses) {
        this.restTemplate = restTemplate;
        this.responseCache = responseCache;
        this.tokenStore = tokenStore;
        this.retryExecutor = retryExecutor;
        this.meterRegistry = meterRegistry;
        this.singleFlight = new SingleFlight<>();
        this.baseUrl = baseUrl;
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);
        this.coalesceMisses = coalesceMisses;
    }

    public FlightOffers searchFlights(FlightSearchParams params) {
        return FlightOfferMapper.toFlightOffers(fetch(UpstreamEndpoint.FLIGHT_OFFERS, params.toQueryParams()));
    }

    public JsonNode searchHotels(HotelSearchParams params) {
        return fetch(UpstreamEndpoint.HOTEL_OFFERS, params.toQueryParams());
    }

    private JsonNode fetch(UpstreamEndpoint endpoint, Map<String, String> params) {
        CacheKey key = CacheKey.of(endpoint, params);

        Optional<JsonNode> cached = responseCache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            meterRegistry.counter(UpstreamConstants.METRIC_CACHE_LOOKUPS,
                    "endpoint", endpoint.operation(), "result", "hit").increment();
            return cached.get();
        }
        meterRegistry.counter(UpstreamConstants.METRIC_CACHE_LOOKUPS,
                "endpoint", endpoint.operation(), "result", "miss").increment();

        if (coalesceMisses) {
            return singleFlight.execute(key, () -> responseCache.get(key)
                    .orElseGet(() -> load(key, endpoint, params)));
        }
        return load(key, endpoint, params);
    }

    private JsonNode load(CacheKey key, UpstreamEndpoint endpoint, Map<String, String> params) {
        log.info("Cache miss, calling upstream: {}", key);

        AccessToken token = tokenStore.getValidToken();
        URI uri = buildUri(endpoint, params);

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            JsonNode payload = retryExecutor.execute(endpoint.operation(), () -> get(uri, token));
            responseCache.set(key, payload, cacheTtl);
            outcome = "success";
            return payload;
        } catch (UpstreamException e) {
            if (e.hasStatus(401)) {
                tokenStore.invalidate(token);
            }
            throw e;
        } finally {
            sample.stop(Timer.builder(UpstreamConstants.METRIC_REQUEST_DURATION)
                    .tag("endpoint", endpoint.operation())
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private JsonNode get(URI uri, AccessToken token) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, token.authorizationHeader());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<JsonNode> response = restTemplate.exchange(
                uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
        log.debug("Upstream response: status={}, uri={}", response.getStatusCode(), uri.getPath());

        JsonNode body = response.getBody();
        return body != null ? body : JsonNodeFactory.instance.objectNode();
    }

    private URI buildUri(UpstreamEndpoint endpoint, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path(endpoint.path());
        params.forEach((name, value) -> builder.queryParam(name, value));
        return builder.encode().build().toUri();
    }
}
