package turnstile.core.service.common;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.config.AdmissionConfig;
import turnstile.core.model.admission.AdmissionRequest;

/**
 * Derives the client identifier used as the rate limit key.
 *
 * <p>An explicit {@link AdmissionRequest#subject()} wins. Otherwise the client
 * address is taken from {@code X-Forwarded-For} (if the direct peer is a trusted
 * proxy) or the connection, then normalized.
 */
@ApplicationScoped
public class ClientKeyResolver {

    private final TrustedProxyValidator trustedProxyValidator;
    private final IpAddressNormalizer normalizer;

    @Inject
    public ClientKeyResolver(TrustedProxyValidator trustedProxyValidator, AdmissionConfig config) {
        this(trustedProxyValidator, new IpAddressNormalizer(config.ipv6SubnetPrefix()));
    }

    public ClientKeyResolver(TrustedProxyValidator trustedProxyValidator, IpAddressNormalizer normalizer) {
        this.trustedProxyValidator = trustedProxyValidator;
        this.normalizer = normalizer;
    }

    /**
     * Resolve the client key for a request.
     *
     * @param request the request descriptor
     * @return the client key, {@code unknown} when nothing identifies the client
     */
    public String resolve(AdmissionRequest request) {
        if (request.subject().isPresent() && !request.subject().get().isBlank()) {
            return request.subject().get();
        }
        final var trustForwarded =
                trustedProxyValidator.shouldTrustForwardingHeaders(request.ip().orElse(null));
        final var raw = ClientIpExtractor.extract(request, trustForwarded);
        if (ClientIpExtractor.UNKNOWN.equals(raw)) {
            return raw;
        }
        return normalizer.normalize(raw);
    }
}
