package turnstile.core.model.admission;

import java.util.Objects;
import java.util.Optional;

/**
 * The parts of an inbound HTTP request needed for admission decisions.
 *
 * @param ip the direct connection address, if known
 * @param forwardedFor the raw {@code X-Forwarded-For} header, if present
 * @param path the request path
 * @param userAgent the {@code User-Agent} header, for logging only
 * @param subject an explicit client identifier overriding the IP (e.g. a page id for quotas)
 */
public record AdmissionRequest(
        Optional<String> ip,
        Optional<String> forwardedFor,
        String path,
        Optional<String> userAgent,
        Optional<String> subject) {

    public AdmissionRequest {
        ip = Objects.requireNonNullElse(ip, Optional.empty());
        forwardedFor = Objects.requireNonNullElse(forwardedFor, Optional.empty());
        path = Objects.requireNonNullElse(path, "/");
        userAgent = Objects.requireNonNullElse(userAgent, Optional.empty());
        subject = Objects.requireNonNullElse(subject, Optional.empty());
    }

    /**
     * Creates a request descriptor from nullable header values.
     *
     * @param ip the direct address (may be null)
     * @param forwardedFor the X-Forwarded-For header (may be null)
     * @param path the request path
     * @return the request
     */
    public static AdmissionRequest of(String ip, String forwardedFor, String path) {
        return new AdmissionRequest(
                Optional.ofNullable(ip), Optional.ofNullable(forwardedFor), path, Optional.empty(), Optional.empty());
    }

    /**
     * Returns a copy with the user agent set.
     *
     * @param userAgent the user agent (may be null)
     * @return the request
     */
    public AdmissionRequest withUserAgent(String userAgent) {
        return new AdmissionRequest(ip, forwardedFor, path, Optional.ofNullable(userAgent), subject);
    }

    /**
     * Returns a copy keyed on an explicit subject instead of the client IP.
     *
     * @param subject the subject identifier
     * @return the request
     */
    public AdmissionRequest withSubject(String subject) {
        return new AdmissionRequest(ip, forwardedFor, path, userAgent, Optional.ofNullable(subject));
    }
}
