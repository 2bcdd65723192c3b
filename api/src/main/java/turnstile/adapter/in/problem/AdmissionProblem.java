package turnstile.adapter.in.problem;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON error bodies returned when a request is refused.
 *
 * <p>Bodies carry no internal detail: no stack traces, secrets or verification
 * reasons.
 *
 * @param error short error title
 * @param message human readable detail
 * @param retryAfter seconds until retry, for rate limit denials
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdmissionProblem(String error, String message, Long retryAfter) {

    public static AdmissionProblem tooManyRequests(long retryAfterSeconds) {
        return new AdmissionProblem(
                "Too Many Requests",
                "Rate limit exceeded. Retry after %d seconds.".formatted(retryAfterSeconds),
                retryAfterSeconds);
    }

    public static AdmissionProblem lockedOut(long retryAfterSeconds) {
        return new AdmissionProblem(
                "Too Many Requests",
                "Too many failed attempts. Retry after %d seconds.".formatted(retryAfterSeconds),
                retryAfterSeconds);
    }

    public static AdmissionProblem unauthorized() {
        return new AdmissionProblem("Unauthorized", null, null);
    }
}
