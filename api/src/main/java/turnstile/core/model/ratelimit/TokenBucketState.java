package turnstile.core.model.ratelimit;

/**
 * Token bucket state for one key.
 *
 * <p>Tokens are fractional so that slow refill rates (for example ten tokens a
 * day) accumulate between requests instead of rounding down to zero.
 *
 * @param tokens the tokens available after the last refill
 * @param lastRefillMillis the timestamp of the last refill (epoch millis)
 */
public record TokenBucketState(double tokens, long lastRefillMillis) {

    /**
     * Creates a bucket state with validation.
     */
    public TokenBucketState {
        if (tokens < 0 || Double.isNaN(tokens)) {
            throw new IllegalArgumentException("tokens must be non-negative");
        }
    }

    /**
     * Creates a full bucket.
     *
     * @param capacity the bucket capacity
     * @param nowMillis the creation time
     * @return the initial state
     */
    public static TokenBucketState full(double capacity, long nowMillis) {
        return new TokenBucketState(capacity, nowMillis);
    }

    /**
     * Returns the state after lazily refilling up to {@code capacity}.
     *
     * @param capacity the maximum tokens
     * @param refillRatePerSecond tokens added per second
     * @param nowMillis the current time
     * @return the refilled state
     */
    public TokenBucketState refill(double capacity, double refillRatePerSecond, long nowMillis) {
        final var elapsedSeconds = Math.max(0, nowMillis - lastRefillMillis) / 1000.0;
        final var refilled = Math.min(capacity, tokens + elapsedSeconds * refillRatePerSecond);
        return new TokenBucketState(refilled, Math.max(nowMillis, lastRefillMillis));
    }

    /**
     * Returns whether {@code cost} tokens are available.
     *
     * @param cost the tokens required
     * @return true if the bucket can pay the cost
     */
    public boolean canConsume(double cost) {
        return tokens >= cost;
    }

    /**
     * Returns the state after consuming {@code cost} tokens.
     *
     * @param cost the tokens to consume
     * @return the new state
     * @throws IllegalStateException if fewer than {@code cost} tokens are available
     */
    public TokenBucketState consume(double cost) {
        if (!canConsume(cost)) {
            throw new IllegalStateException("Not enough tokens to consume");
        }
        return new TokenBucketState(tokens - cost, lastRefillMillis);
    }
}
