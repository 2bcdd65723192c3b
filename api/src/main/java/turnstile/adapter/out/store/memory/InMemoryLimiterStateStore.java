package turnstile.adapter.out.store.memory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;

import turnstile.core.port.out.LimiterStateStore;

/**
 * Unbounded in-memory limiter state store.
 *
 * <p>State is not shared across instances and is lost on restart. Keys are only
 * removed by the limiters themselves (sweeps, resets, successes), so this store
 * is selected only when no key bound is configured.
 *
 * @param <V> the state type
 */
public final class InMemoryLimiterStateStore<V> implements LimiterStateStore<V> {

    private final ConcurrentMap<String, V> states = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(states.get(key));
    }

    @Override
    public void set(String key, V value) {
        states.put(key, value);
    }

    @Override
    public void delete(String key) {
        states.remove(key);
    }

    @Override
    public V compute(String key, BiFunction<String, V, V> remapping) {
        return states.compute(key, remapping);
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(states.keySet());
    }

    @Override
    public long size() {
        return states.size();
    }

    @Override
    public void clear() {
        states.clear();
    }
}
