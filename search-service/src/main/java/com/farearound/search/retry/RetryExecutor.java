package com.farearound.search.retry;

import com.farearound.search.constants.UpstreamConstants;
import com.farearound.search.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs one upstream HTTP call with bounded retries and exponential backoff.
 *
 * <p>Policy, in priority order:
 * <ol>
 *   <li>network error or timeout: retry after the backoff step</li>
 *   <li>429: wait {@code Retry-After} seconds when present, otherwise the backoff step</li>
 *   <li>5xx: retry after the backoff step</li>
 *   <li>any other non-2xx: fail immediately</li>
 * </ol>
 * The backoff starts at the initial delay and doubles after every failed attempt, up to
 * {@link UpstreamConstants#MAX_BACKOFF_MS}. A {@code Retry-After} above
 * {@link UpstreamConstants#MAX_RETRY_AFTER_SECONDS} is ignored in favour of the backoff. Once the last
 * attempt fails an {@link UpstreamException} carrying the last status is thrown.
 * No state is kept between calls.
 */
@Slf4j
public class RetryExecutor {

    private static final Duration MAX_BACKOFF = Duration.ofMillis(UpstreamConstants.MAX_BACKOFF_MS);
    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(UpstreamConstants.MAX_RETRY_AFTER_SECONDS);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Sleeper sleeper;

    public RetryExecutor(int maxAttempts, Duration initialBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("Initial backoff must be non-negative, got " + initialBackoff);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public <T> T execute(String operation, Supplier<T> call) {
        if (call == null) {
            throw new IllegalArgumentException("Upstream call must not be null");
        }

        Duration backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            Duration delay;
            Integer lastStatus;
            RuntimeException lastError;

            try {
                return call.get();
            } catch (RestClientResponseException e) {
                int status = e.getStatusCode().value();
                if (status == 429) {
                    Optional<Duration> retryAfter = retryAfter(e.getResponseHeaders());
                    delay = retryAfter.orElse(backoff);
                    log.warn("Upstream {} rate limited (429) on attempt {}/{}; waiting {}ms{}",
                            operation, attempt, maxAttempts, delay.toMillis(),
                            retryAfter.isPresent() ? " per Retry-After" : "");
                } else if (e.getStatusCode().is5xxServerError()) {
                    delay = backoff;
                    log.warn("Upstream {} server error {} on attempt {}/{}; backing off {}ms",
                            operation, status, attempt, maxAttempts, delay.toMillis());
                } else {
                    log.error("Upstream {} failed with non-retryable status {}", operation, status);
                    throw UpstreamException.nonRetryable(operation, status, describe(e), e);
                }
                lastStatus = status;
                lastError = e;
            } catch (ResourceAccessException e) {
                delay = backoff;
                lastStatus = null;
                lastError = e;
                log.warn("Upstream {} network error on attempt {}/{}: {}; retrying after {}ms",
                        operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
            } catch (RestClientException e) {
                log.error("Upstream {} failed: {}", operation, e.getMessage());
                throw new UpstreamException("Upstream " + operation + " failed: " + e.getMessage(), null, false, e);
            }

            if (attempt >= maxAttempts) {
                log.error("Upstream {} giving up after {} attempts", operation, attempt);
                throw UpstreamException.exhausted(operation, attempt, lastStatus, describe(lastError), lastError);
            }

            pause(operation, delay, lastError);
            backoff = nextBackoff(backoff);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    private void pause(String operation, Duration delay, RuntimeException lastError) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            UpstreamException interrupted = new UpstreamException(
                    "Interrupted while waiting to retry upstream " + operation, null, false, e);
            interrupted.addSuppressed(lastError);
            throw interrupted;
        }
    }

    static Duration nextBackoff(Duration backoff) {
        if (backoff.compareTo(MAX_BACKOFF) >= 0) {
            return backoff;
        }
        Duration doubled = backoff.multipliedBy(2);
        return doubled.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : doubled;
    }

    static Optional<Duration> retryAfter(HttpHeaders headers) {
        if (headers == null) {
            return Optional.empty();
        }
        String value = headers.getFirst(UpstreamConstants.RETRY_AFTER_HEADER);
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        long seconds;
        try {
            seconds = Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        Duration delay = Duration.ofSeconds(seconds);
        if (delay.compareTo(MAX_RETRY_AFTER) > 0) {
            log.warn("Ignoring Retry-After of {}s, above the {}s ceiling", seconds, MAX_RETRY_AFTER.getSeconds());
            return Optional.empty();
        }
        return Optional.of(delay);
    }

    private static String describe(RuntimeException e) {
        if (e instanceof RestClientResponseException response) {
            String body = response.getResponseBodyAsString();
            return body.isBlank() ? response.getStatusText() : body;
        }
        return e.getMessage();
    }
}
