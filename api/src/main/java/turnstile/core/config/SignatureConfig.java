package turnstile.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for webhook signatures and OAuth state signing.
 *
 * <p>Configuration prefix: {@code turnstile.signature}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TURNSTILE_SIGNATURE_WEBHOOK_SECRET} - App secret used to sign webhook deliveries</li>
 *   <li>{@code TURNSTILE_SIGNATURE_STATE_SECRET} - Secret used to sign OAuth state</li>
 *   <li>{@code TURNSTILE_SIGNATURE_ALLOWED_ORIGINS} - Comma separated redirect origins</li>
 * </ul>
 */
@ConfigMapping(prefix = "turnstile.signature")
public interface SignatureConfig {

    /**
     * @return the webhook shared secret
     */
    Optional<String> webhookSecret();

    /**
     * @return header carrying the webhook signature (default: X-Hub-Signature-256)
     */
    @WithDefault("X-Hub-Signature-256")
    String webhookHeader();

    /**
     * @return path prefixes whose bodies must carry a valid webhook signature
     */
    Optional<List<String>> webhookPaths();

    /**
     * @return the OAuth state secret
     */
    Optional<String> stateSecret();

    /**
     * @return origins the OAuth callback may redirect to
     */
    Optional<List<String>> allowedOrigins();
}
