package turnstile.core.model.signature;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an HMAC signature verification.
 *
 * @param valid whether the signature matched
 * @param computedSignatureHex the locally computed hex digest, when computation happened
 * @param error the failure reason when not valid
 */
public record HmacVerificationResult(boolean valid, Optional<String> computedSignatureHex, Optional<String> error) {

    public static final String MISSING_PAYLOAD = "missing payload";
    public static final String MISSING_SIGNATURE = "missing signature";
    public static final String MISSING_SECRET = "missing secret";
    public static final String MISSING_PREFIX = "missing prefix";
    public static final String SIGNATURE_MISMATCH = "signature mismatch";

    public HmacVerificationResult {
        computedSignatureHex = Objects.requireNonNullElse(computedSignatureHex, Optional.empty());
        error = Objects.requireNonNullElse(error, Optional.empty());
    }

    public static HmacVerificationResult valid(String computedSignatureHex) {
        return new HmacVerificationResult(true, Optional.of(computedSignatureHex), Optional.empty());
    }

    public static HmacVerificationResult mismatch(String computedSignatureHex) {
        return new HmacVerificationResult(false, Optional.of(computedSignatureHex), Optional.of(SIGNATURE_MISMATCH));
    }

    public static HmacVerificationResult invalid(String error) {
        return new HmacVerificationResult(false, Optional.empty(), Optional.of(error));
    }
}
