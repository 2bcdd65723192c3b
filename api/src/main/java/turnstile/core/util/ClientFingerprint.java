package turnstile.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short SHA-256 fingerprints of client identifiers for security events and logs,
 * so raw addresses are not written out.
 */
public final class ClientFingerprint {

    private static final int HEX_CHARS = 16;

    private ClientFingerprint() {}

    /**
     * Fingerprint a client identifier.
     *
     * @param clientId the identifier (may be null)
     * @return the first 16 hex characters of its SHA-256 digest, or {@code unknown}
     */
    public static String of(String clientId) {
        if (clientId == null || clientId.isEmpty()) {
            return "unknown";
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256").digest(clientId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, HEX_CHARS / 2);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
