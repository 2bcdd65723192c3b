package turnstile.core.model.ratelimit;

import java.time.Duration;

/**
 * Capacity and refill rate for a token bucket limiter.
 *
 * @param capacity maximum tokens (burst size)
 * @param refillRatePerSecond tokens added per second
 */
public record TokenBucketConfig(double capacity, double refillRatePerSecond) {

    /**
     * Creates a token bucket configuration with validation.
     */
    public TokenBucketConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillRatePerSecond < 0) {
            throw new IllegalArgumentException("refillRatePerSecond must be non-negative");
        }
    }

    /**
     * Creates a bucket that refills {@code capacity} tokens over {@code period}.
     *
     * @param capacity the capacity
     * @param period the time to refill an empty bucket
     * @return the configuration
     */
    public static TokenBucketConfig perPeriod(long capacity, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        return new TokenBucketConfig(capacity, capacity / (period.toMillis() / 1000.0));
    }

    /**
     * Seconds needed to accumulate {@code missing} tokens.
     *
     * @param missing the token deficit
     * @return seconds, or {@link Long#MAX_VALUE} if the bucket never refills
     */
    public long secondsToRefill(double missing) {
        if (missing <= 0) {
            return 0;
        }
        if (refillRatePerSecond <= 0) {
            return Long.MAX_VALUE;
        }
        return (long) Math.ceil(missing / refillRatePerSecond);
    }
}
