package com.farearound.search.service;

import com.farearound.search.cache.TtlCache;
import com.farearound.search.client.CacheKey;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically drops expired responses so idle keys do not hold memory until evicted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseCacheExpiryService {

    private final TtlCache<CacheKey, JsonNode> responseCache;

    @Scheduled(fixedDelayString = "${upstream.cache.purge-interval-ms:30000}")
    public void purgeExpiredResponses() {
        int removed = responseCache.purgeExpired();
        if (removed > 0) {
            log.debug("Purged {} expired responses, {} remain", removed, responseCache.size());
        }
    }
}
