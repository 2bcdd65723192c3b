package turnstile.core.port.out;

/**
 * Port interface for recording admission metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AdmissionMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record an admission decision.
     *
     * @param policy the policy name
     * @param allowed whether the request was admitted
     * @param reason the denial reason ({@code none} when allowed)
     */
    void recordDecision(String policy, boolean allowed, String reason);

    /**
     * Record a signature verification.
     *
     * @param format the signature wire format
     * @param valid whether verification succeeded
     */
    void recordSignatureVerification(String format, boolean valid);

    /**
     * Record a brute force lockout.
     *
     * @param policy the policy name
     */
    void recordLockout(String policy);
}
