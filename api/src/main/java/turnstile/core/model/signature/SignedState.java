package turnstile.core.model.signature;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * An OAuth {@code state} value: a redirect origin plus its HMAC signature.
 *
 * <p>Wire form is {@code urlEncode(payload) + "|" + signatureHex}. The value is
 * never stored; validity depends only on the signature and the origin allow-list.
 *
 * @param payload the decoded payload (the redirect origin)
 * @param signatureHex the hex HMAC over the decoded payload
 */
public record SignedState(String payload, String signatureHex) {

    static final char SEPARATOR = '|';

    public SignedState {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(signatureHex, "signatureHex must not be null");
    }

    /**
     * Returns the wire form of this state.
     *
     * @return the encoded state parameter
     */
    public String encode() {
        return URLEncoder.encode(payload, StandardCharsets.UTF_8).replace("+", "%20") + SEPARATOR + signatureHex;
    }

    /**
     * Parses a state parameter, splitting on the last {@code |}.
     *
     * @param state the raw state parameter
     * @return the parsed state, or empty if the value is not in wire form
     */
    public static Optional<SignedState> parse(String state) {
        if (state == null) {
            return Optional.empty();
        }
        final var separator = state.lastIndexOf(SEPARATOR);
        if (separator <= 0 || separator == state.length() - 1) {
            return Optional.empty();
        }
        try {
            // A literal '+' is data, not an encoded space
            final var encoded = state.substring(0, separator).replace("+", "%2B");
            final var payload = URLDecoder.decode(encoded, StandardCharsets.UTF_8);
            return Optional.of(new SignedState(payload, state.substring(separator + 1)));
        } catch (IllegalArgumentException e) {
            // malformed percent-encoding
            return Optional.empty();
        }
    }
}
