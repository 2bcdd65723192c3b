package turnstile;

import java.time.Duration;
import java.util.function.Function;

import turnstile.adapter.out.store.memory.InMemoryLimiterStateStore;
import turnstile.core.port.out.LimiterStateStore;
import turnstile.core.port.out.LimiterStateStoreFactory;

/**
 * Store factory for tests: every limiter gets a fresh unbounded map.
 */
public final class InMemoryStores implements LimiterStateStoreFactory {

    @Override
    public <V> LimiterStateStore<V> create(String name, Function<? super V, Duration> retention) {
        return new InMemoryLimiterStateStore<>();
    }
}
