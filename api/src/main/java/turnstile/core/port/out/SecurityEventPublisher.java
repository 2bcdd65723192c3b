package turnstile.core.port.out;

import turnstile.spi.SecurityEvent;

/**
 * Port interface for reporting attack signals.
 *
 * <p>Publishing never blocks the request and never fails it.
 */
public interface SecurityEventPublisher {

    /**
     * Publish a security event to the registered handlers.
     *
     * @param event the event
     */
    void publish(SecurityEvent event);
}
