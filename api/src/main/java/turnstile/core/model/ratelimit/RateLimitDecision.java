package turnstile.core.model.ratelimit;

/**
 * Result of a consuming rate limit check, with the figures needed for
 * response headers.
 *
 * @param allowed whether the request was admitted
 * @param limit the configured limit (window size or bucket capacity)
 * @param used requests counted against the limit after this check
 * @param remaining requests left before denial
 * @param resetAtMillis when the limit fully resets (epoch millis)
 * @param retryAfterSeconds seconds until a denied client may retry; 0 when allowed
 */
public record RateLimitDecision(
        boolean allowed, long limit, long used, long remaining, long resetAtMillis, long retryAfterSeconds) {

    public RateLimitDecision {
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be non-negative");
        }
    }

    /**
     * Decision for a policy that was never configured: allowed, with no figures.
     *
     * @return the decision
     */
    public static RateLimitDecision unconfigured() {
        return new RateLimitDecision(true, 0, 0, 0, 0, 0);
    }

    public long resetAtEpochSeconds() {
        return Math.floorDiv(resetAtMillis + 999, 1000);
    }
}
