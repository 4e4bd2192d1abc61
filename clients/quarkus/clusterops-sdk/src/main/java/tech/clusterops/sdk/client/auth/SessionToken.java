package tech.clusterops.sdk.client.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable session token with its issue time. Replaced wholesale on refresh.
 */
record SessionToken(String value, Instant issuedAt, Duration ttl, Duration expiryBuffer) {

    /**
     * True once the token is within {@code expiryBuffer} of its TTL, so that it cannot expire
     * mid-request.
     */
    boolean isNearExpiry(Instant now) {
        return Duration.between(issuedAt, now).compareTo(ttl.minus(expiryBuffer)) >= 0;
    }

    @Override
    public String toString() {
        return "SessionToken[issuedAt=" + issuedAt + ", ttl=" + ttl + "]";
    }
}
