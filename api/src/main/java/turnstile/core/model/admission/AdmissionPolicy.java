package turnstile.core.model.admission;

import java.time.Duration;
import java.util.Objects;

import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.core.model.ratelimit.SlidingWindowPolicy;
import turnstile.core.model.ratelimit.TokenBucketConfig;
import turnstile.spi.SecurityEvent.Severity;

/**
 * A named admission policy as resolved from configuration.
 *
 * @param name the policy name
 * @param algorithm the limiting algorithm
 * @param maxRequests requests per window, or bucket capacity for token buckets
 * @param window window length, or time to refill an empty bucket
 * @param alertSeverity severity of the security event raised on denial
 * @param bruteForce whether the brute force guard is consulted for this policy
 */
public record AdmissionPolicy(
        String name,
        RateLimitAlgorithm algorithm,
        int maxRequests,
        Duration window,
        Severity alertSeverity,
        boolean bruteForce) {

    public AdmissionPolicy {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(window, "window must not be null");
        alertSeverity = Objects.requireNonNullElse(alertSeverity, Severity.WARNING);
        if (maxRequests < 0) {
            throw new IllegalArgumentException("maxRequests must be non-negative");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    /**
     * Creates a sliding window policy with WARNING alerts and no brute force guard.
     *
     * @param name the policy name
     * @param maxRequests requests per window
     * @param window the window
     * @return the policy
     */
    public static AdmissionPolicy slidingWindow(String name, int maxRequests, Duration window) {
        return new AdmissionPolicy(name, RateLimitAlgorithm.SLIDING_WINDOW, maxRequests, window, Severity.WARNING, false);
    }

    public AdmissionPolicy withAlertSeverity(Severity severity) {
        return new AdmissionPolicy(name, algorithm, maxRequests, window, severity, bruteForce);
    }

    public AdmissionPolicy withBruteForce(boolean enabled) {
        return new AdmissionPolicy(name, algorithm, maxRequests, window, alertSeverity, enabled);
    }

    public SlidingWindowPolicy toSlidingWindowPolicy() {
        return SlidingWindowPolicy.of(name, maxRequests, window);
    }

    public TokenBucketConfig toTokenBucketConfig() {
        return TokenBucketConfig.perPeriod(maxRequests, window);
    }
}
