package turnstile.core.model.admission;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Result of an admission check.
 *
 * @param allowed whether the request may proceed
 * @param retryAfterSeconds seconds until the client may retry (denials only)
 * @param headers rate limit headers to attach to the response
 * @param reason why the request was denied, for logging
 */
public record AdmissionVerdict(
        boolean allowed, OptionalLong retryAfterSeconds, Map<String, String> headers, DenialReason reason) {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String USED_HEADER = "X-RateLimit-Used";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";
    public static final String RETRY_AFTER_HEADER = "Retry-After";

    public AdmissionVerdict {
        retryAfterSeconds = Objects.requireNonNullElse(retryAfterSeconds, OptionalLong.empty());
        headers = Map.copyOf(Objects.requireNonNullElse(headers, Map.of()));
        reason = Objects.requireNonNullElse(reason, DenialReason.NONE);
    }

    /**
     * An allowed verdict without headers.
     *
     * @return the verdict
     */
    public static AdmissionVerdict allow() {
        return new AdmissionVerdict(true, OptionalLong.empty(), Map.of(), DenialReason.NONE);
    }

    public static AdmissionVerdict allow(Map<String, String> headers) {
        return new AdmissionVerdict(true, OptionalLong.empty(), headers, DenialReason.NONE);
    }

    public static AdmissionVerdict deny(DenialReason reason, long retryAfterSeconds, Map<String, String> headers) {
        return new AdmissionVerdict(false, OptionalLong.of(retryAfterSeconds), headers, reason);
    }

    /**
     * Why a request was refused.
     */
    public enum DenialReason {
        NONE,
        RATE_LIMITED,
        LOCKED_OUT
    }
}
