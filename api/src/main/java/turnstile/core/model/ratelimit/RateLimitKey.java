package turnstile.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies a rate limit bucket for a client under a named policy.
 *
 * <p>Each limiter keeps at most one entry per key. The cache key format is
 * {@code turnstile:ratelimit:{policyName}:{clientId}}.
 *
 * @param policyName the policy the bucket belongs to (e.g. {@code standard}, {@code webhook})
 * @param clientId the normalized client identifier (usually an IP or IPv6 subnet)
 */
public record RateLimitKey(String policyName, String clientId) {

    private static final String PREFIX = "turnstile:ratelimit:";

    /**
     * Creates a rate limit key with validation.
     */
    public RateLimitKey {
        Objects.requireNonNull(policyName, "policyName must not be null");
        Objects.requireNonNull(clientId, "clientId must not be null");
    }

    /**
     * Creates a key for the given policy and client.
     *
     * @param policyName the policy name
     * @param clientId the client identifier
     * @return the rate limit key
     */
    public static RateLimitKey of(String policyName, String clientId) {
        return new RateLimitKey(policyName, clientId);
    }

    /**
     * Converts this key to a cache key string.
     *
     * @return the cache key string
     */
    public String toCacheKey() {
        return PREFIX + policyName + ":" + clientId;
    }
}
