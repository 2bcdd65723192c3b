package turnstile.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import turnstile.core.config.TelemetryConfig;
import turnstile.core.port.out.AdmissionMetrics;

/**
 * Records admission metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code turnstile.admission.decisions} - Decisions by policy, outcome and reason</li>
 *   <li>{@code turnstile.signature.verifications} - Signature checks by format and outcome</li>
 *   <li>{@code turnstile.bruteforce.lockouts} - Lockouts by policy</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAdmissionMetrics implements AdmissionMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAdmissionMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = registry != null && config != null && config.metrics();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(String policy, boolean allowed, String reason) {
        if (!enabled) {
            return;
        }
        Counter.builder("turnstile.admission.decisions")
                .description("Admission decisions")
                .tag("policy", policy)
                .tag("outcome", allowed ? "allowed" : "denied")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    @Override
    public void recordSignatureVerification(String format, boolean valid) {
        if (!enabled) {
            return;
        }
        Counter.builder("turnstile.signature.verifications")
                .description("HMAC signature verifications")
                .tag("format", format)
                .tag("outcome", valid ? "valid" : "invalid")
                .register(registry)
                .increment();
    }

    @Override
    public void recordLockout(String policy) {
        if (!enabled) {
            return;
        }
        Counter.builder("turnstile.bruteforce.lockouts")
                .description("Brute force lockouts")
                .tag("policy", policy)
                .register(registry)
                .increment();
    }
}
