package turnstile.core.model.signature;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding and verifying an OAuth state parameter.
 *
 * <p>Callers refuse to redirect on any failure; the error distinguishes the
 * failure modes for logging only.
 *
 * @param valid whether the state is authentic and its origin allowed
 * @param origin the verified origin when valid
 * @param error the failure reason when not valid
 */
public record StateVerificationResult(boolean valid, Optional<String> origin, Optional<String> error) {

    public static final String INVALID_FORMAT = "invalid state format";
    public static final String INVALID_SIGNATURE = "invalid signature";
    public static final String ORIGIN_NOT_ALLOWED = "origin not allowed";
    public static final String MISSING_STATE = "missing state";

    public StateVerificationResult {
        origin = Objects.requireNonNullElse(origin, Optional.empty());
        error = Objects.requireNonNullElse(error, Optional.empty());
    }

    public static StateVerificationResult valid(String origin) {
        return new StateVerificationResult(true, Optional.of(origin), Optional.empty());
    }

    public static StateVerificationResult invalid(String error) {
        return new StateVerificationResult(false, Optional.empty(), Optional.of(error));
    }
}
