package turnstile.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for trusted proxy validation.
 *
 * <p>Configuration prefix: {@code turnstile.trusted-proxy}
 *
 * <p>When enabled, {@code X-Forwarded-For} is only honoured when the direct
 * connection originates from a listed proxy IP or CIDR range.
 */
@ConfigMapping(prefix = "turnstile.trusted-proxy")
public interface TrustedProxyConfig {

    /** @return true if proxy validation is enabled (default: false) */
    @WithDefault("false")
    boolean enabled();

    /** @return list of trusted proxy IPs/CIDRs, e.g. {@code 10.0.0.0/8} */
    Optional<List<String>> proxies();
}
