package turnstile.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code turnstile.telemetry}
 */
@ConfigMapping(prefix = "turnstile.telemetry")
public interface TelemetryConfig {

    /**
     * @return true to dispatch security events to handlers (default: true)
     */
    @WithDefault("true")
    boolean securityEvents();

    /**
     * @return true to record Micrometer metrics (default: true)
     */
    @WithDefault("true")
    boolean metrics();
}
