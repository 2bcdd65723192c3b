package turnstile.core.config;

import java.time.Duration;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.spi.SecurityEvent.Severity;

/**
 * Configuration mapping for request admission.
 *
 * <p>Configuration prefix: {@code turnstile.admission}
 *
 * <p>Each entry under {@code policies} defines a named policy; {@code routes}
 * maps path prefixes to policy names for the HTTP filter.
 *
 * <h2>Example</h2>
 * <pre>
 * turnstile.admission.policies.webhook.max-requests=1000
 * turnstile.admission.policies.webhook.window=PT1M
 * turnstile.admission.policies.webhook.alert-severity=CRITICAL
 * turnstile.admission.routes."/webhooks"=webhook
 * </pre>
 */
@ConfigMapping(prefix = "turnstile.admission")
public interface AdmissionConfig {

    /**
     * Enable or disable admission checks globally.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Include X-RateLimit-* headers on admitted responses as well as denials.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Interval of the background sweep that drops empty sliding window buckets.
     *
     * @return sweep interval (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration sweepInterval();

    /**
     * Policy applied to paths without a route entry.
     *
     * @return the default policy name (default: standard)
     */
    @WithDefault("standard")
    String defaultPolicy();

    /**
     * Upper bound on tracked keys per limiter. Zero disables the bound.
     *
     * <p>Client identifiers come from headers an attacker controls, so without a
     * bound memory grows with every spoofed address.
     *
     * @return maximum keys (default: 100000)
     */
    @WithDefault("100000")
    long maxTrackedKeys();

    /**
     * Idle time after which a bounded store forgets a key.
     *
     * @return idle timeout (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration keyIdleTimeout();

    /**
     * Prefix length IPv6 client addresses are truncated to. 128 keeps full addresses.
     *
     * @return prefix length (default: 64)
     */
    @WithDefault("64")
    int ipv6SubnetPrefix();

    /**
     * Named policies.
     */
    Map<String, PolicyConfig> policies();

    /**
     * Path prefix to policy name.
     */
    Map<String, String> routes();

    /**
     * A single named policy.
     */
    interface PolicyConfig {

        /**
         * @return the algorithm (default: SLIDING_WINDOW)
         */
        @WithDefault("SLIDING_WINDOW")
        RateLimitAlgorithm algorithm();

        /**
         * @return requests per window, or bucket capacity for TOKEN_BUCKET
         */
        int maxRequests();

        /**
         * @return window length, or time to refill an empty bucket for TOKEN_BUCKET
         */
        Duration window();

        /**
         * @return severity of the event raised when a request is denied (default: WARNING)
         */
        @WithDefault("WARNING")
        Severity alertSeverity();

        /**
         * @return true to consult the brute force guard for this policy (default: false)
         */
        @WithDefault("false")
        boolean bruteForce();
    }
}
