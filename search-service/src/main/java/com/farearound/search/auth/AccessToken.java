package com.farearound.search.auth;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class AccessToken {

    @ToString.Exclude
    String value;

    String tokenType;

    Instant expiresAt;

    /**
     * True when the token is still valid for at least {@code margin} after {@code now}.
     */
    public boolean isUsableAt(Instant now, Duration margin) {
        return now.plus(margin).isBefore(expiresAt);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public String authorizationHeader() {
        return "Bearer " + value;
    }
}
