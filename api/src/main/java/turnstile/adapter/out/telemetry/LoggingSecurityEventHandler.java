package turnstile.adapter.out.telemetry;

import org.jboss.logging.Logger;

import turnstile.spi.SecurityEvent;
import turnstile.spi.SecurityEventHandler;

/**
 * Security event handler that logs events using JBoss Logging.
 *
 * <p>This is a built-in handler with priority 0 that always runs.
 * Log levels are based on event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    static final String CATEGORY = "turnstile.security";

    private final Logger log;

    public LoggingSecurityEventHandler() {
        this(Logger.getLogger(CATEGORY));
    }

    LoggingSecurityEventHandler(Logger log) {
        this.log = log;
    }

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        final var message = format(event);
        switch (event.severity()) {
            case INFO -> log.debug(message);
            case WARNING -> log.warn(message);
            case CRITICAL -> log.error(message);
        }
    }

    static String format(SecurityEvent event) {
        if (event instanceof SecurityEvent.RateLimitExceeded e) {
            return String.format(
                    "RATE_LIMIT: client=%s policy=%s path=%s requests=%d threshold=%d window=%ds",
                    e.clientIdentifier(), e.policy(), e.path(), e.requestCount(), e.threshold(), e.windowSeconds());
        }
        if (event instanceof SecurityEvent.BruteForceLockout e) {
            return String.format(
                    "BRUTE_FORCE_LOCKOUT: client=%s policy=%s failures=%d lockout=%ds",
                    e.clientIdentifier(), e.policy(), e.failureCount(), e.lockoutSeconds());
        }
        if (event instanceof SecurityEvent.SignatureRejected e) {
            return String.format(
                    "SIGNATURE_REJECTED: client=%s path=%s reason=%s", e.clientIdentifier(), e.path(), e.reason());
        }
        if (event instanceof SecurityEvent.StateRejected e) {
            return String.format(
                    "STATE_REJECTED: client=%s reason=%s remaining=%d",
                    e.clientIdentifier(), e.reason(), e.remainingAttempts());
        }
        return "SECURITY_EVENT: client=" + event.clientIdentifier();
    }
}
