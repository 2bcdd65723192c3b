package turnstile.adapter.out.store.caffeine;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import turnstile.core.port.out.LimiterStateStore;

/**
 * Caffeine-backed limiter state store with a bound on tracked keys.
 *
 * <p>An entry is evicted once it has been idle for the longer of the idle
 * timeout and the retention its state asks for, so a daily quota outlives a
 * one hour idle timeout. Once the key count reaches the maximum the least
 * valuable entries are evicted first. Losing an entry only forgets that
 * client's history, so under a key flood the limiter degrades towards
 * admitting rather than towards unbounded memory.
 *
 * @param <V> the state type
 */
public class CaffeineLimiterStateStore<V> implements LimiterStateStore<V> {

    // Caffeine caps expiry at roughly 150 years
    private static final long MAX_EXPIRY_NANOS = Long.MAX_VALUE >> 1;

    private final Cache<String, V> cache;

    /**
     * Create a bounded store.
     *
     * @param maxKeys the maximum number of keys
     * @param idleTimeout evict keys not accessed for this long
     */
    public CaffeineLimiterStateStore(long maxKeys, Duration idleTimeout) {
        this(maxKeys, idleTimeout, value -> Duration.ZERO, Ticker.systemTicker());
    }

    /**
     * Create a bounded store whose entries are kept at least as long as their state requires.
     *
     * @param maxKeys the maximum number of keys
     * @param idleTimeout evict keys not accessed for this long
     * @param retention the minimum idle time for an entry, derived from its state
     */
    public CaffeineLimiterStateStore(long maxKeys, Duration idleTimeout, Function<? super V, Duration> retention) {
        this(maxKeys, idleTimeout, retention, Ticker.systemTicker());
    }

    /**
     * Create a bounded store with a custom ticker.
     *
     * @param maxKeys the maximum number of keys
     * @param idleTimeout evict keys not accessed for this long
     * @param retention the minimum idle time for an entry, derived from its state
     * @param ticker the time source for idle expiry
     */
    public CaffeineLimiterStateStore(
            long maxKeys, Duration idleTimeout, Function<? super V, Duration> retention, Ticker ticker) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be positive, got: " + maxKeys);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxKeys)
                .expireAfter(new RetentionExpiry<V>(idleTimeout, retention))
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void set(String key, V value) {
        cache.put(key, value);
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public V compute(String key, BiFunction<String, V, V> remapping) {
        return cache.asMap().compute(key, remapping);
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(cache.asMap().keySet());
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    /**
     * Run pending eviction work. Caffeine otherwise performs it lazily.
     */
    public void cleanUp() {
        cache.cleanUp();
    }

    /**
     * Expire-after-access where the idle limit depends on the entry's state.
     */
    private static final class RetentionExpiry<V> implements Expiry<String, V> {

        private final Duration idleTimeout;
        private final Function<? super V, Duration> retention;

        RetentionExpiry(Duration idleTimeout, Function<? super V, Duration> retention) {
            this.idleTimeout = idleTimeout;
            this.retention = retention;
        }

        @Override
        public long expireAfterCreate(String key, V value, long currentTime) {
            return idleNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, V value, long currentTime, long currentDuration) {
            return idleNanos(value);
        }

        @Override
        public long expireAfterRead(String key, V value, long currentTime, long currentDuration) {
            return idleNanos(value);
        }

        private long idleNanos(V value) {
            final var required = retention.apply(value);
            final var idle = required != null && required.compareTo(idleTimeout) > 0 ? required : idleTimeout;
            if (idle.compareTo(Duration.ofNanos(MAX_EXPIRY_NANOS)) >= 0) {
                return MAX_EXPIRY_NANOS;
            }
            return idle.toNanos();
        }
    }
}
