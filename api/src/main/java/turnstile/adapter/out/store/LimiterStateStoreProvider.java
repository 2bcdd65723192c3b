package turnstile.adapter.out.store;

import java.time.Duration;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import turnstile.adapter.out.store.caffeine.CaffeineLimiterStateStore;
import turnstile.adapter.out.store.memory.InMemoryLimiterStateStore;
import turnstile.core.config.AdmissionConfig;
import turnstile.core.config.TelemetryConfig;
import turnstile.core.port.out.LimiterStateStore;
import turnstile.core.port.out.LimiterStateStoreFactory;

/**
 * Creates the state store for each limiter.
 *
 * <p>With a positive {@code turnstile.admission.max-tracked-keys} every store is a
 * bounded {@link CaffeineLimiterStateStore}; with 0 the unbounded
 * {@link InMemoryLimiterStateStore} is used. Bounded stores never evict an
 * entry before the retention its limiter asks for. Each store reports its size as the
 * {@code turnstile.limiter.keys} gauge.
 */
@ApplicationScoped
public class LimiterStateStoreProvider implements LimiterStateStoreFactory {

    private static final Logger LOG = Logger.getLogger(LimiterStateStoreProvider.class);

    private final AdmissionConfig config;
    private final MeterRegistry registry;
    private final boolean metricsEnabled;

    @Inject
    public LimiterStateStoreProvider(AdmissionConfig config, TelemetryConfig telemetry, MeterRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.metricsEnabled = telemetry != null && telemetry.metrics() && registry != null;
    }

    @Override
    public <V> LimiterStateStore<V> create(String name, Function<? super V, Duration> retention) {
        final LimiterStateStore<V> store;
        if (config.maxTrackedKeys() > 0) {
            store = new CaffeineLimiterStateStore<V>(config.maxTrackedKeys(), config.keyIdleTimeout(), retention);
            LOG.debugf(
                    "Created bounded state store %s (max %d keys, idle timeout %s)",
                    name, config.maxTrackedKeys(), config.keyIdleTimeout());
        } else {
            store = new InMemoryLimiterStateStore<>();
            LOG.infof("Created unbounded state store %s", name);
        }

        if (metricsEnabled) {
            Gauge.builder("turnstile.limiter.keys", store, LimiterStateStore::size)
                    .description("Number of keys tracked by a limiter")
                    .tag("limiter", name)
                    .register(registry);
        }
        return store;
    }
}
