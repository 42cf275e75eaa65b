package io.cerberus.sdk.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Cerberus session token together with the instant after which it must no longer be presented.
 *
 * @param value  token sent in {@code X-Cerberus-Token}
 * @param expiry end of validity, or {@code null} when the issuer did not say (caller supplied tokens)
 */
public record Token(String value, Instant expiry) {

    /**
     * Subtracted from every lease to absorb request latency and clock skew.
     */
    public static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    public static Token withLease(String value, long leaseSeconds) {
        return new Token(value, Instant.now().plusSeconds(leaseSeconds).minus(EXPIRY_SKEW));
    }

    public static Token withoutExpiry(String value) {
        return new Token(value, null);
    }

    public boolean isValid(Instant now) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return expiry == null || now.isBefore(expiry);
    }

    @Override
    public String toString() {
        return "Token[expiry=" + expiry + "]";
    }
}
