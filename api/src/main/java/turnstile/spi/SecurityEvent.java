package turnstile.spi;

import java.time.Instant;

/**
 * Sealed interface representing security events raised by the admission layer.
 *
 * <p>Security events are dispatched to registered {@link SecurityEventHandler}
 * implementations for alerting and logging. They are attack signals, not errors:
 * the request that triggered them already received a normal deny verdict.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link RateLimitExceeded} - Client exceeded a policy's rate limit</li>
 *   <li>{@link BruteForceLockout} - Client locked out after repeated failures</li>
 *   <li>{@link SignatureRejected} - Webhook body failed HMAC verification</li>
 *   <li>{@link StateRejected} - OAuth state parameter failed verification</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    /**
     * Return the timestamp when this event occurred.
     *
     * @return event timestamp
     */
    Instant timestamp();

    /**
     * Return the client identifier (hashed).
     *
     * @return client identifier
     */
    String clientIdentifier();

    /**
     * Return the severity level of this event.
     *
     * @return severity level
     */
    Severity severity();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Informational events. */
        INFO,
        /** Warning events requiring attention (e.g., repeated failures). */
        WARNING,
        /** Critical events requiring immediate action (e.g., webhook flooding). */
        CRITICAL
    }

    /**
     * Rate limit exceeded event.
     *
     * @param timestamp when the limit was exceeded
     * @param clientIdentifier hashed client identifier
     * @param policy the admission policy name
     * @param path the request path
     * @param requestCount requests counted in the current window
     * @param threshold the configured limit
     * @param windowSeconds the window length
     * @param severity the severity configured for the policy
     */
    record RateLimitExceeded(
            Instant timestamp,
            String clientIdentifier,
            String policy,
            String path,
            int requestCount,
            int threshold,
            long windowSeconds,
            Severity severity)
            implements SecurityEvent {}

    /**
     * Brute force lockout event.
     *
     * @param timestamp when the lockout started
     * @param clientIdentifier hashed client identifier
     * @param policy the admission policy name
     * @param failureCount failures that triggered the lockout
     * @param lockoutSeconds lockout length
     */
    record BruteForceLockout(
            Instant timestamp, String clientIdentifier, String policy, int failureCount, long lockoutSeconds)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Webhook signature rejected event.
     *
     * @param timestamp when the signature was rejected
     * @param clientIdentifier hashed client identifier
     * @param path the webhook path
     * @param reason the verification failure reason
     */
    record SignatureRejected(Instant timestamp, String clientIdentifier, String path, String reason)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * OAuth state rejected event.
     *
     * @param timestamp when the state was rejected
     * @param clientIdentifier hashed client identifier
     * @param reason the verification failure reason
     * @param remainingAttempts failures left before lockout
     */
    record StateRejected(Instant timestamp, String clientIdentifier, String reason, int remainingAttempts)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return remainingAttempts == 0 ? Severity.WARNING : Severity.INFO;
        }
    }
}
