package turnstile.core.port.out;

import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Port interface for per-key limiter state.
 *
 * <p>Limiters hold no maps of their own; they read and write immutable state
 * values through this port. The default implementations keep state in process
 * memory, but the same limiter logic can run against a store shared by several
 * instances as long as {@link #compute} stays atomic per key.
 *
 * @param <V> the state type
 */
public interface LimiterStateStore<V> {

    /**
     * Get the state for a key.
     *
     * @param key the cache key
     * @return the state, or empty if none is stored
     */
    Optional<V> get(String key);

    /**
     * Store state for a key, replacing any previous value.
     *
     * @param key the cache key
     * @param value the state
     */
    void set(String key, V value);

    /**
     * Remove the state for a key.
     *
     * @param key the cache key
     */
    void delete(String key);

    /**
     * Atomically read-modify-write the state for a key.
     *
     * <p>The remapping function receives the current state (or {@code null})
     * and returns the new state; returning {@code null} removes the entry.
     * Concurrent calls for the same key are serialized; calls for different
     * keys do not block each other.
     *
     * @param key the cache key
     * @param remapping the state transition
     * @return the new state, or {@code null} if the entry was removed
     */
    V compute(String key, BiFunction<String, V, V> remapping);

    /**
     * Return a snapshot of the stored keys.
     *
     * @return the keys
     */
    Set<String> keys();

    /**
     * Return the number of stored keys.
     *
     * @return the key count
     */
    long size();

    /**
     * Remove all state.
     */
    void clear();
}
