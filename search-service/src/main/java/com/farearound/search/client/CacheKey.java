package com.farearound.search.client;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Response cache key: the endpoint plus every request parameter, sorted by name.
 * Names and values are percent-encoded, so two requests with the same parameters produce the
 * same key regardless of insertion order and no two different parameter sets collide.
 */
public record CacheKey(UpstreamEndpoint endpoint, String canonicalParams) {

    public CacheKey {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(canonicalParams, "canonicalParams");
    }

    public static CacheKey of(UpstreamEndpoint endpoint, Map<String, ?> params) {
        Objects.requireNonNull(params, "params");
        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<String, Object>(params).forEach((name, value) ->
                joiner.add(encode(name) + "=" + encode(String.valueOf(value))));
        return new CacheKey(endpoint, joiner.toString());
    }

    private static String encode(String s) {
        return UriUtils.encode(s, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return endpoint.operation() + "?" + canonicalParams;
    }
}
