package com.farearound.search.auth;

import com.farearound.search.exception.AuthenticationException;
import com.farearound.search.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TokenStore")
class TokenStoreTest {

    private static final Duration MARGIN = Duration.ofSeconds(30);

    @Mock
    private TokenExchanger exchanger;

    private MutableClock clock;
    private TokenStore tokenStore;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-04-01T10:00:00Z");
        tokenStore = new TokenStore(exchanger, MARGIN, clock);
    }

    private AccessToken tokenExpiringIn(String value, Duration lifetime) {
        return AccessToken.builder()
                .value(value)
                .tokenType("Bearer")
                .expiresAt(clock.instant().plus(lifetime))
                .build();
    }

    @Nested
    @DisplayName("Refresh")
    class Refresh {

        @Test
        @DisplayName("exchanges on first use and reuses the token afterwards")
        void reusesFreshToken() {
            AccessToken token = tokenExpiringIn("t1", Duration.ofMinutes(30));
            when(exchanger.exchange()).thenReturn(token);

            assertThat(tokenStore.getValidToken()).isSameAs(token);
            clock.advance(Duration.ofMinutes(10));
            assertThat(tokenStore.getValidToken()).isSameAs(token);

            verify(exchanger, times(1)).exchange();
        }

        @Test
        @DisplayName("refreshes once the token is within the margin of expiry")
        void refreshesInsideMargin() {
            AccessToken first = tokenExpiringIn("t1", Duration.ofSeconds(100));
            AccessToken second = tokenExpiringIn("t2", Duration.ofHours(1));
            when(exchanger.exchange()).thenReturn(first, second);

            assertThat(tokenStore.getValidToken()).isSameAs(first);
            clock.advance(Duration.ofSeconds(70));

            assertThat(tokenStore.getValidToken()).isSameAs(second);
            verify(exchanger, times(2)).exchange();
        }

        @Test
        @DisplayName("returns a freshly exchanged token even if its lifetime is below the margin")
        void shortLivedTokenIsStillReturned() {
            AccessToken shortLived = tokenExpiringIn("short", Duration.ofSeconds(10));
            when(exchanger.exchange()).thenReturn(shortLived);

            assertThat(tokenStore.getValidToken()).isSameAs(shortLived);
        }

        @Test
        @DisplayName("runs exactly one exchange for many concurrent callers")
        void singleExchangeUnderContention() throws Exception {
            int callers = 10;
            AtomicInteger exchanges = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            AccessToken token = tokenExpiringIn("shared", Duration.ofHours(1));

            TokenStore contended = new TokenStore(() -> {
                exchanges.incrementAndGet();
                sleepQuietly(50);
                return token;
            }, MARGIN, clock);

            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<AccessToken>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return contended.getValidToken();
                    }));
                }
                start.countDown();
                for (Future<AccessToken> result : results) {
                    assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(token);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(exchanges.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("propagates an authentication failure and stores nothing")
        void failureStoresNothing() {
            when(exchanger.exchange()).thenThrow(new AuthenticationException("401 from token endpoint"));

            assertThatThrownBy(() -> tokenStore.getValidToken())
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("401");
            assertThat(tokenStore.hasToken()).isFalse();
        }

        @Test
        @DisplayName("keeps the previous token when a refresh fails")
        void failedRefreshKeepsPreviousToken() {
            AccessToken first = tokenExpiringIn("t1", Duration.ofSeconds(60));
            when(exchanger.exchange())
                    .thenReturn(first)
                    .thenThrow(new AuthenticationException("token endpoint down"));

            tokenStore.getValidToken();
            clock.advance(Duration.ofSeconds(45));

            assertThatThrownBy(() -> tokenStore.getValidToken()).isInstanceOf(AuthenticationException.class);
            assertThat(tokenStore.hasToken()).isTrue();
        }

        @Test
        @DisplayName("wraps unexpected exchange errors as authentication failures")
        void wrapsUnexpectedErrors() {
            when(exchanger.exchange()).thenThrow(new IllegalStateException("boom"));

            assertThatThrownBy(() -> tokenStore.getValidToken())
                    .isInstanceOf(AuthenticationException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("rejects an exchange result without an expiry")
        void rejectsIncompleteToken() {
            when(exchanger.exchange()).thenReturn(AccessToken.builder().value("t").build());

            assertThatThrownBy(() -> tokenStore.getValidToken()).isInstanceOf(AuthenticationException.class);
            assertThat(tokenStore.hasToken()).isFalse();
        }

        @Test
        void rejectsNegativeMargin() {
            assertThatThrownBy(() -> new TokenStore(exchanger, Duration.ofSeconds(-1), clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("drops the held token so the next call refreshes")
        void invalidateForcesRefresh() {
            AccessToken first = tokenExpiringIn("t1", Duration.ofHours(1));
            AccessToken second = tokenExpiringIn("t2", Duration.ofHours(1));
            when(exchanger.exchange()).thenReturn(first, second);

            AccessToken held = tokenStore.getValidToken();
            tokenStore.invalidate(held);

            assertThat(tokenStore.getValidToken()).isSameAs(second);
        }

        @Test
        @DisplayName("ignores a stale token that was already replaced")
        void invalidateIgnoresOtherToken() {
            AccessToken current = tokenExpiringIn("t1", Duration.ofHours(1));
            when(exchanger.exchange()).thenReturn(current);
            tokenStore.getValidToken();

            tokenStore.invalidate(AccessToken.builder().value("old").expiresAt(Instant.EPOCH).build());

            assertThat(tokenStore.getValidToken()).isSameAs(current);
            verify(exchanger, times(1)).exchange();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
