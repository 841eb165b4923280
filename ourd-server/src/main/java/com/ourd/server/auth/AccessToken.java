package com.ourd.server.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An issued access token bound to a user.
 *
 * @param expiredAt null for tokens that never expire
 */
public record AccessToken(String accessToken, String userInfoID, Instant issuedAt, Instant expiredAt) {

    public AccessToken {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(userInfoID, "userInfoID");
        Objects.requireNonNull(issuedAt, "issuedAt");
    }

    public static AccessToken issue(String userInfoID, Instant now, Duration ttl) {
        return new AccessToken(UUID.randomUUID().toString(), userInfoID, now, ttl != null ? now.plus(ttl) : null);
    }

    public boolean isExpired(Instant now) {
        return expiredAt != null && !now.isBefore(expiredAt);
    }
}
