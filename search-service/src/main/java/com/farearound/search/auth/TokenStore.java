package com.farearound.search.auth;

import com.farearound.search.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the process-wide upstream bearer token and refreshes it synchronously when stale.
 *
 * <p>The check-and-refresh sequence runs under one exclusive lock that stays held for the whole
 * exchange, so at most one exchange is outstanding and concurrent callers wait for its result.
 * A failed exchange stores nothing and leaves the previously held token in place.
 */
@Slf4j
public class TokenStore {

    private final TokenExchanger exchanger;
    private final Clock clock;
    private final Duration refreshMargin;
    private final Lock refreshLock = new ReentrantLock();

    private volatile AccessToken current;

    public TokenStore(TokenExchanger exchanger, Duration refreshMargin, Clock clock) {
        if (refreshMargin == null || refreshMargin.isNegative()) {
            throw new IllegalArgumentException("Refresh margin must be non-negative, got " + refreshMargin);
        }
        this.exchanger = Objects.requireNonNull(exchanger, "exchanger");
        this.refreshMargin = refreshMargin;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AccessToken getValidToken() {
        AccessToken token = current;
        if (token != null && token.isUsableAt(clock.instant(), refreshMargin)) {
            return token;
        }

        refreshLock.lock();
        try {
            // Another caller may have refreshed while we waited for the lock.
            token = current;
            Instant now = clock.instant();
            if (token != null && token.isUsableAt(now, refreshMargin)) {
                log.debug("Reusing token refreshed by a concurrent caller");
                return token;
            }

            log.info("Refreshing upstream token: held={}, expired={}",
                    token != null, token != null && token.isExpiredAt(now));
            AccessToken fresh = exchange();
            current = fresh;
            return fresh;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drops {@code rejected} if it is still the held token, forcing the next caller to refresh.
     */
    public void invalidate(AccessToken rejected) {
        refreshLock.lock();
        try {
            if (rejected != null && rejected == current) {
                log.info("Invalidating upstream token rejected by the API");
                current = null;
            }
        } finally {
            refreshLock.unlock();
        }
    }

    boolean hasToken() {
        return current != null;
    }

    private AccessToken exchange() {
        AccessToken fresh;
        try {
            fresh = exchanger.exchange();
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Token exchange failed unexpectedly", e);
            throw new AuthenticationException("Token exchange failed: " + e.getMessage(), e);
        }
        if (fresh == null || fresh.getValue() == null || fresh.getExpiresAt() == null) {
            throw new AuthenticationException("Token exchange returned an incomplete token");
        }
        return fresh;
    }
}
