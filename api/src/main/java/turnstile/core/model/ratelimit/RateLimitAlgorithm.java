package turnstile.core.model.ratelimit;

/**
 * Rate limiting algorithms available to admission policies.
 */
public enum RateLimitAlgorithm {
    /** Counts request timestamps within a rolling window. */
    SLIDING_WINDOW,
    /** Continuous refill up to a burst capacity. */
    TOKEN_BUCKET
}
