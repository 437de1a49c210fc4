package com.farearound.search.config;

import com.farearound.search.auth.OAuth2TokenExchanger;
import com.farearound.search.auth.TokenExchanger;
import com.farearound.search.auth.TokenStore;
import com.farearound.search.cache.TtlCache;
import com.farearound.search.client.CacheKey;
import com.farearound.search.constants.UpstreamConstants;
import com.farearound.search.retry.RetryExecutor;
import com.farearound.search.retry.Sleeper;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the long-lived upstream access objects: HTTP client with timeouts, token store,
 * response cache and retry executor. Each is created once and shared by all requests.
 */
@Configuration
@Slf4j
public class UpstreamClientConfiguration {

    @Value("${http.client.connect-timeout-ms:10000}")
    private int connectTimeout;

    @Value("${http.client.read-timeout-ms:20000}")
    private int readTimeout;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeout))
                .setReadTimeout(Duration.ofMillis(readTimeout))
                .build();
    }

    @Bean
    public TokenExchanger tokenExchanger(
            RestTemplate restTemplate,
            Clock clock,
            @Value("${upstream.base-url}") String baseUrl,
            @Value("${upstream.client-id:}") String clientId,
            @Value("${upstream.client-secret:}") String clientSecret) {
        log.info("Upstream base URL: {}", baseUrl);
        return new OAuth2TokenExchanger(restTemplate, baseUrl, clientId, clientSecret, clock);
    }

    @Bean
    public TokenStore tokenStore(
            TokenExchanger tokenExchanger,
            Clock clock,
            @Value("${upstream.token.refresh-margin-seconds:" + UpstreamConstants.DEFAULT_REFRESH_MARGIN_SECONDS + "}")
            long refreshMarginSeconds) {
        return new TokenStore(tokenExchanger, Duration.ofSeconds(refreshMarginSeconds), clock);
    }

    @Bean
    public TtlCache<CacheKey, JsonNode> responseCache(
            Clock clock,
            @Value("${upstream.cache.capacity:" + UpstreamConstants.DEFAULT_CACHE_CAPACITY + "}") int capacity,
            @Value("${upstream.cache.ttl-seconds:" + UpstreamConstants.DEFAULT_CACHE_TTL_SECONDS + "}") long ttlSeconds) {
        log.info("Initialized response cache: capacity={}, ttl={}s", capacity, ttlSeconds);
        return new TtlCache<>(capacity, Duration.ofSeconds(ttlSeconds), clock);
    }

    @Bean
    public RetryExecutor retryExecutor(
            @Value("${upstream.retry.max-attempts:" + UpstreamConstants.DEFAULT_MAX_ATTEMPTS + "}") int maxAttempts,
            @Value("${upstream.retry.initial-backoff-ms:" + UpstreamConstants.DEFAULT_INITIAL_BACKOFF_MS + "}")
            long initialBackoffMs) {
        log.info("Initialized RetryExecutor: maxAttempts={}, initialBackoff={}ms", maxAttempts, initialBackoffMs);
        return new RetryExecutor(maxAttempts, Duration.ofMillis(initialBackoffMs), Sleeper.THREAD);
    }
}
