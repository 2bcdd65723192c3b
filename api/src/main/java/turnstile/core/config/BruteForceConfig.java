package turnstile.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for brute force protection.
 *
 * <p>Configuration prefix: {@code turnstile.brute-force}
 *
 * @see turnstile.core.service.auth.BruteForceGuard
 */
@ConfigMapping(prefix = "turnstile.brute-force")
public interface BruteForceConfig {

    /**
     * Failures within the reset window that lock a key out.
     *
     * @return max failures (default: 5)
     */
    @WithDefault("5")
    int maxFailures();

    /**
     * Duration of a lockout.
     *
     * @return lockout duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration lockoutDuration();

    /**
     * Idle time after the last failure that starts a fresh attempt sequence.
     *
     * @return reset window (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration resetWindow();
}
