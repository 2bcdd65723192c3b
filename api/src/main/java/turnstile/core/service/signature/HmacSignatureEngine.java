package turnstile.core.service.signature;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import turnstile.core.model.signature.HmacVerificationResult;
import turnstile.core.model.signature.SignatureFormat;
import turnstile.core.util.TimingSafeComparator;

/**
 * Computes and verifies HMAC-SHA256 signatures.
 *
 * <p>Signing is deterministic and stateless. Verification never throws; every
 * failure is reported through {@link HmacVerificationResult}. The final
 * comparison is timing-safe.
 */
@ApplicationScoped
public class HmacSignatureEngine {

    static final String ALGORITHM = "HmacSHA256";

    private static final HexFormat HEX = HexFormat.of();

    /**
     * Sign a payload.
     *
     * @param payload the bytes to sign
     * @param secret the shared secret (non-empty)
     * @return the lowercase hex digest (64 characters)
     * @throws IllegalArgumentException if the secret is null or empty
     * @throws IllegalStateException if HmacSHA256 is unavailable
     */
    public String sign(byte[] payload, String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        try {
            final var mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HEX.formatHex(mac.doFinal(payload));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    /**
     * Sign a UTF-8 string payload.
     *
     * @param payload the text to sign
     * @param secret the shared secret
     * @return the lowercase hex digest
     */
    public String sign(String payload, String secret) {
        return sign(payload.getBytes(StandardCharsets.UTF_8), secret);
    }

    /**
     * Verify a provided signature against a payload.
     *
     * <p>For {@link SignatureFormat#PREFIXED_HEX} a signature without the
     * {@code sha256=} prefix is rejected with {@code missing prefix} before any
     * digest is computed.
     *
     * @param payload the signed bytes
     * @param signature the provided signature in the given format
     * @param secret the shared secret
     * @param format the wire format of {@code signature}
     * @return the verification result
     */
    public HmacVerificationResult verify(byte[] payload, String signature, String secret, SignatureFormat format) {
        if (payload == null) {
            return HmacVerificationResult.invalid(HmacVerificationResult.MISSING_PAYLOAD);
        }
        if (signature == null || signature.isEmpty()) {
            return HmacVerificationResult.invalid(HmacVerificationResult.MISSING_SIGNATURE);
        }
        if (secret == null || secret.isEmpty()) {
            return HmacVerificationResult.invalid(HmacVerificationResult.MISSING_SECRET);
        }
        if (!signature.startsWith(format.prefix())) {
            return HmacVerificationResult.invalid(HmacVerificationResult.MISSING_PREFIX);
        }

        final var computed = sign(payload, secret);
        if (TimingSafeComparator.equals(signature, format.format(computed))) {
            return HmacVerificationResult.valid(computed);
        }
        return HmacVerificationResult.mismatch(computed);
    }

    /**
     * Verify a provided signature against a UTF-8 string payload.
     *
     * @param payload the signed text
     * @param signature the provided signature
     * @param secret the shared secret
     * @param format the wire format
     * @return the verification result
     */
    public HmacVerificationResult verify(String payload, String signature, String secret, SignatureFormat format) {
        return verify(payload == null ? null : payload.getBytes(StandardCharsets.UTF_8), signature, secret, format);
    }
}
