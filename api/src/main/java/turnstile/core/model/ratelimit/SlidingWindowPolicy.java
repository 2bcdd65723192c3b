package turnstile.core.model.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Sliding window configuration for a named policy.
 *
 * @param name the policy name
 * @param maxRequests maximum requests admitted within any window
 * @param windowMillis window length in milliseconds
 */
public record SlidingWindowPolicy(String name, int maxRequests, long windowMillis) {

    /**
     * Creates a sliding window policy with validation.
     */
    public SlidingWindowPolicy {
        Objects.requireNonNull(name, "name must not be null");
        if (maxRequests < 0) {
            throw new IllegalArgumentException("maxRequests must be non-negative");
        }
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("windowMillis must be positive");
        }
    }

    /**
     * Creates a policy from a {@link Duration} window.
     *
     * @param name the policy name
     * @param maxRequests maximum requests per window
     * @param window the window length
     * @return the policy
     */
    public static SlidingWindowPolicy of(String name, int maxRequests, Duration window) {
        return new SlidingWindowPolicy(name, maxRequests, window.toMillis());
    }
}
