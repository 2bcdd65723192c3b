package turnstile.core.model.auth;

import java.time.Duration;
import java.util.Objects;

/**
 * Brute-force lockout thresholds.
 *
 * @param maxFailures failures that trigger a lockout
 * @param lockoutDuration how long a lockout lasts
 * @param resetWindow idle time after which the next failure starts a new sequence
 */
public record LockoutPolicy(int maxFailures, Duration lockoutDuration, Duration resetWindow) {

    /**
     * Creates a lockout policy with validation.
     */
    public LockoutPolicy {
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be at least 1");
        }
        Objects.requireNonNull(lockoutDuration, "lockoutDuration must not be null");
        Objects.requireNonNull(resetWindow, "resetWindow must not be null");
        if (lockoutDuration.isNegative() || lockoutDuration.isZero()) {
            throw new IllegalArgumentException("lockoutDuration must be positive");
        }
        if (resetWindow.isNegative()) {
            throw new IllegalArgumentException("resetWindow must not be negative");
        }
    }

    /**
     * Creates a lockout policy from millisecond values.
     *
     * @param maxFailures failures that trigger a lockout
     * @param lockoutMillis lockout length
     * @param resetMillis reset window
     * @return the policy
     */
    public static LockoutPolicy ofMillis(int maxFailures, long lockoutMillis, long resetMillis) {
        return new LockoutPolicy(maxFailures, Duration.ofMillis(lockoutMillis), Duration.ofMillis(resetMillis));
    }

    /**
     * Defaults: five failures, fifteen minute lockout, one hour reset window.
     *
     * @return the default policy
     */
    public static LockoutPolicy defaults() {
        return new LockoutPolicy(5, Duration.ofMinutes(15), Duration.ofHours(1));
    }
}
