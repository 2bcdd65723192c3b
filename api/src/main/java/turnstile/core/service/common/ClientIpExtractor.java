package turnstile.core.service.common;

import turnstile.core.model.admission.AdmissionRequest;

/**
 * Utility for extracting the client address from a request descriptor.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>First entry of the {@code X-Forwarded-For} chain (when forwarding headers are trusted)</li>
 *   <li>The direct connection address</li>
 *   <li>The literal {@value #UNKNOWN}</li>
 * </ol>
 */
public final class ClientIpExtractor {

    public static final String UNKNOWN = "unknown";

    private ClientIpExtractor() {}

    /**
     * Extract the original client address.
     *
     * @param request the request descriptor
     * @param trustForwardedFor whether {@code X-Forwarded-For} may be used
     * @return the raw client address, never null
     */
    public static String extract(AdmissionRequest request, boolean trustForwardedFor) {
        if (trustForwardedFor) {
            final var forwarded = request.forwardedFor().map(ClientIpExtractor::firstHop);
            if (forwarded.isPresent() && !forwarded.get().isEmpty()) {
                return forwarded.get();
            }
        }
        return request.ip().map(String::trim).filter(ip -> !ip.isEmpty()).orElse(UNKNOWN);
    }

    /**
     * Return the first address in a forwarded-for chain.
     *
     * @param forwardedFor the header value
     * @return the first hop, trimmed
     */
    public static String firstHop(String forwardedFor) {
        final var comma = forwardedFor.indexOf(',');
        final var first = comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor;
        return first.trim();
    }
}
