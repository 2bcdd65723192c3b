package turnstile.spi;

/**
 * SPI for handling security events raised by the admission layer.
 *
 * <p>Platform teams can implement this interface to integrate with their
 * alerting systems, e.g. mailing an alert on critical
 * events. Implementations are discovered via {@link java.util.ServiceLoader}.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 * </ul>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/turnstile.spi.SecurityEventHandler}
 */
public interface SecurityEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "email", "slack")
     */
    String name();

    /**
     * Returns the priority of this handler.
     *
     * <p>Higher priority handlers are invoked first. The logging handler uses 0.
     *
     * @return priority value (higher = invoked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler is currently available.
     *
     * @return true if handler is available and should receive events
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a security event.
     *
     * <p>Implementations should catch and log any exceptions rather
     * than propagating them, as this would prevent other handlers
     * from processing the event.
     *
     * @param event the security event to handle
     */
    void handle(SecurityEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
