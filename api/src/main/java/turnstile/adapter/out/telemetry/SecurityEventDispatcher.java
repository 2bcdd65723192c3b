package turnstile.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.TelemetryConfig;
import turnstile.core.port.out.SecurityEventPublisher;
import turnstile.spi.SecurityEvent;
import turnstile.spi.SecurityEventHandler;

/**
 * Dispatches security events to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first). Events are dispatched asynchronously so a slow handler
 * never delays an admission decision. A failing handler is logged and skipped.
 *
 * <p>When security events are disabled, events are silently dropped.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityEventPublisher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final boolean enabled;
    private final List<SecurityEventHandler> handlers;
    private final ExecutorService executor;

    @Inject
    public SecurityEventDispatcher(TelemetryConfig config) {
        this(config != null && config.securityEvents(), loadHandlers(), newExecutor());
    }

    SecurityEventDispatcher(boolean enabled, List<SecurityEventHandler> handlers, ExecutorService executor) {
        this.enabled = enabled;
        this.handlers = handlers.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
        this.executor = executor;

        if (!enabled) {
            LOG.debug("Security events are disabled - event dispatcher inactive");
        } else if (this.handlers.isEmpty()) {
            LOG.warn("No security event handlers found - events will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d security event handler(s): %s",
                    this.handlers.size(),
                    this.handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        handlers.forEach(handler -> {
            try {
                handler.close();
            } catch (Exception e) {
                LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
            }
        });
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Dispatch a security event to all registered handlers.
     *
     * @param event the event to dispatch
     */
    @Override
    public void publish(SecurityEvent event) {
        if (!enabled || handlers.isEmpty()) {
            return;
        }

        executor.submit(() -> {
            for (var handler : handlers) {
                try {
                    handler.handle(event);
                } catch (Exception e) {
                    LOG.warnf("Handler %s failed to process event: %s", handler.name(), e.getMessage());
                }
            }
        });
    }

    /**
     * Get the registered handlers in dispatch order.
     *
     * @return the handlers
     */
    public List<SecurityEventHandler> getHandlers() {
        return handlers;
    }

    private static List<SecurityEventHandler> loadHandlers() {
        return ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

    private static ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "security-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }
}
