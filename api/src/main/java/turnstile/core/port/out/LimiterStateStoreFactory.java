package turnstile.core.port.out;

import java.time.Duration;
import java.util.function.Function;

/**
 * Port interface for creating limiter state stores.
 *
 * <p>Each limiter gets its own store so that the bound on tracked keys and the
 * idle eviction apply per limiter.
 */
public interface LimiterStateStoreFactory {

    /**
     * Create a store for one limiter.
     *
     * <p>Idle entries may be evicted, but never before the retention the limiter
     * reports for their state. A token bucket that is still refilling or a key
     * that is still locked out is therefore kept even when it is not touched.
     *
     * @param name the limiter name, used for metrics and logging
     * @param retention how long an untouched entry must be kept, derived from its state
     * @param <V> the state type
     * @return a new empty store
     */
    <V> LimiterStateStore<V> create(String name, Function<? super V, Duration> retention);

    /**
     * Create a store whose entries carry no retention of their own.
     *
     * @param name the limiter name, used for metrics and logging
     * @param <V> the state type
     * @return a new empty store
     */
    default <V> LimiterStateStore<V> create(String name) {
        return create(name, value -> Duration.ZERO);
    }
}
