package turnstile.core.service.oauth;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.SignatureConfig;
import turnstile.core.model.admission.AdmissionRequest;
import turnstile.core.model.signature.StateVerificationResult;
import turnstile.core.port.out.SecurityEventPublisher;
import turnstile.core.service.admission.AdmissionPolicies;
import turnstile.core.service.admission.AdmissionService;
import turnstile.core.service.common.ClientKeyResolver;
import turnstile.core.service.signature.OAuthStateCodec;
import turnstile.core.util.ClientFingerprint;
import turnstile.spi.SecurityEvent;

/**
 * Issues and checks OAuth {@code state} parameters with the configured secret
 * and origin allow-list.
 *
 * <p>A rejected state counts as a failure against the {@code oauth} policy's
 * brute force guard, so a client guessing states is locked out; an accepted
 * state clears the client's failures.
 */
@ApplicationScoped
public class OAuthStateService {

    private static final Logger LOG = Logger.getLogger(OAuthStateService.class);

    private final OAuthStateCodec codec;
    private final AdmissionService admission;
    private final ClientKeyResolver clientKeyResolver;
    private final SecurityEventPublisher events;
    private final Clock clock;
    private final Optional<String> secret;
    private final List<String> allowedOrigins;

    @Inject
    public OAuthStateService(
            OAuthStateCodec codec,
            AdmissionService admission,
            ClientKeyResolver clientKeyResolver,
            SecurityEventPublisher events,
            SignatureConfig config,
            Clock clock) {
        this.codec = codec;
        this.admission = admission;
        this.clientKeyResolver = clientKeyResolver;
        this.events = events;
        this.clock = clock;
        this.secret = config.stateSecret().filter(s -> !s.isBlank());
        this.allowedOrigins = config.allowedOrigins().orElse(List.of());

        if (secret.isEmpty()) {
            LOG.warn("No OAuth state secret configured; OAuth state parameters cannot be issued or verified");
        }
    }

    /**
     * Sign an origin into a state parameter.
     *
     * @param origin the origin the OAuth callback should return to
     * @return the state, or empty if the origin is not on the allow-list
     * @throws IllegalStateException if no state secret is configured
     */
    public Optional<String> issue(String origin) {
        final var key = secret.orElseThrow(() -> new IllegalStateException("OAuth state secret is not configured"));
        if (!OAuthStateCodec.isAllowed(origin, allowedOrigins)) {
            LOG.debugf("Refusing to issue OAuth state for origin outside the allow-list");
            return Optional.empty();
        }
        final var normalized = OAuthStateCodec.originOf(origin).orElseThrow();
        return Optional.of(codec.encodeState(normalized, key));
    }

    /**
     * Verify a state parameter returned by the OAuth provider.
     *
     * @param state the raw state parameter
     * @param request the callback request, used to attribute failures
     * @return the verification result
     */
    public StateVerificationResult verify(String state, AdmissionRequest request) {
        final var result = secret.map(key -> codec.decodeAndVerify(state, key, allowedOrigins))
                .orElseGet(() -> StateVerificationResult.invalid(StateVerificationResult.INVALID_SIGNATURE));

        if (result.valid()) {
            admission.recordSuccess(AdmissionPolicies.OAUTH, request);
            return result;
        }

        final var reason = result.error().orElse(StateVerificationResult.INVALID_FORMAT);
        final var remaining = admission.recordFailure(AdmissionPolicies.OAUTH, request);
        final var client = ClientFingerprint.of(clientKeyResolver.resolve(request));
        LOG.debugf("Rejected OAuth state from client %s: %s (%d attempts left)", client, reason, remaining);
        events.publish(new SecurityEvent.StateRejected(clock.instant(), client, reason, remaining));
        return result;
    }
}
