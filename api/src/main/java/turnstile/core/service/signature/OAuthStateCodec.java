package turnstile.core.service.signature;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.model.signature.SignatureFormat;
import turnstile.core.model.signature.SignedState;
import turnstile.core.model.signature.StateVerificationResult;

/**
 * Encodes and verifies the self-authenticating OAuth {@code state} parameter.
 *
 * <p>The state carries the origin to redirect back to after the OAuth
 * callback. It is never stored server-side: a state is valid when its HMAC
 * matches and its origin is on the allow-list. The origin check only runs
 * after the signature has been verified.
 */
@ApplicationScoped
public class OAuthStateCodec {

    private final HmacSignatureEngine engine;

    @Inject
    public OAuthStateCodec(HmacSignatureEngine engine) {
        this.engine = engine;
    }

    /**
     * Encode an origin into a signed state parameter.
     *
     * @param origin the redirect origin
     * @param secret the state signing secret
     * @return {@code urlEncode(origin) + "|" + hmacHex(origin)}
     */
    public String encodeState(String origin, String secret) {
        return new SignedState(origin, engine.sign(origin, secret)).encode();
    }

    /**
     * Decode a state parameter and verify its signature and origin.
     *
     * @param state the raw state parameter
     * @param secret the state signing secret
     * @param allowedOrigins origins permitted as redirect targets
     * @return the verification result carrying the normalized origin when valid
     */
    public StateVerificationResult decodeAndVerify(String state, String secret, Collection<String> allowedOrigins) {
        if (state == null || state.isBlank()) {
            return StateVerificationResult.invalid(StateVerificationResult.MISSING_STATE);
        }

        final var parsed = SignedState.parse(state);
        if (parsed.isEmpty()) {
            return StateVerificationResult.invalid(StateVerificationResult.INVALID_FORMAT);
        }

        final var signed = parsed.get();
        final var verification = engine.verify(signed.payload(), signed.signatureHex(), secret, SignatureFormat.HEX);
        if (!verification.valid()) {
            return StateVerificationResult.invalid(StateVerificationResult.INVALID_SIGNATURE);
        }

        final var origin = originOf(signed.payload());
        if (origin.isEmpty()) {
            return StateVerificationResult.invalid(StateVerificationResult.INVALID_FORMAT);
        }

        if (!isAllowed(origin.get(), allowedOrigins)) {
            return StateVerificationResult.invalid(StateVerificationResult.ORIGIN_NOT_ALLOWED);
        }
        return StateVerificationResult.valid(origin.get());
    }

    /**
     * Check whether an origin appears on the allow-list.
     *
     * <p>Both sides are normalized first, so {@code https://App.example.com:443/}
     * matches an allow-list entry of {@code https://app.example.com}.
     *
     * @param origin the origin or URL to check
     * @param allowedOrigins the allow-list
     * @return true if allowed
     */
    public static boolean isAllowed(String origin, Collection<String> allowedOrigins) {
        if (origin == null || allowedOrigins == null) {
            return false;
        }
        final var normalized = originOf(origin);
        if (normalized.isEmpty()) {
            return false;
        }
        return allowedOrigins.stream()
                .map(OAuthStateCodec::originOf)
                .flatMap(Optional::stream)
                .anyMatch(normalized.get()::equals);
    }

    /**
     * Reduce a URL to its origin: {@code scheme://host[:port]}.
     *
     * <p>Scheme and host are lowercased and default ports (80 for http, 443 for
     * https) are dropped. Path, query and fragment are ignored.
     *
     * @param url the URL
     * @return the origin, or empty if the value is not an absolute URL with a host
     */
    public static Optional<String> originOf(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        final URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return Optional.empty();
        }

        final var scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        final var host = uri.getHost().toLowerCase(Locale.ROOT);
        final var port = uri.getPort();
        final var defaultPort = ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
        if (port == -1 || defaultPort) {
            return Optional.of(scheme + "://" + host);
        }
        return Optional.of(scheme + "://" + host + ":" + port);
    }
}
