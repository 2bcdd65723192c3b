package turnstile.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

import org.jboss.logging.Logger;

import turnstile.core.model.ratelimit.RateLimitDecision;
import turnstile.core.model.ratelimit.TokenBucketConfig;
import turnstile.core.model.ratelimit.TokenBucketState;
import turnstile.core.port.out.LimiterStateStore;
import turnstile.core.util.ClientFingerprint;

/**
 * Token bucket rate limiter for a single quota.
 *
 * <p>Each key starts with a full bucket. Tokens refill lazily at check time,
 * proportional to elapsed time and capped at capacity. A check of cost
 * {@code c} is admitted when at least {@code c} tokens remain; a denied check
 * consumes nothing. Checking before {@link #configure} logs a warning and
 * admits the request.
 */
public class TokenBucketRateLimiter {

    private static final Logger LOG = Logger.getLogger(TokenBucketRateLimiter.class);

    // A bucket that never refills; kept below Long.MAX_VALUE so second rounding cannot overflow
    private static final long NEVER = Long.MAX_VALUE - 1000;

    private final String name;
    private final LimiterStateStore<TokenBucketState> store;
    private final Clock clock;
    private volatile TokenBucketConfig config;

    /**
     * Create an unconfigured limiter.
     *
     * @param name the limiter name, for logging
     * @param store the state store
     * @param clock the time source
     */
    public TokenBucketRateLimiter(String name, LimiterStateStore<TokenBucketState> store, Clock clock) {
        this.name = name;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Create a configured limiter.
     *
     * @param name the limiter name, for logging
     * @param store the state store
     * @param clock the time source
     * @param config the capacity and refill rate
     */
    public TokenBucketRateLimiter(
            String name, LimiterStateStore<TokenBucketState> store, Clock clock, TokenBucketConfig config) {
        this(name, store, clock);
        this.config = config;
    }

    /**
     * Set capacity and refill rate. Existing buckets keep their tokens, capped
     * at the new capacity on their next refill.
     *
     * @param capacity the maximum tokens
     * @param refillRatePerSecond tokens added per second
     */
    public void configure(double capacity, double refillRatePerSecond) {
        configure(new TokenBucketConfig(capacity, refillRatePerSecond));
    }

    public void configure(TokenBucketConfig config) {
        this.config = config;
        LOG.debugf(
                "Configured token bucket %s: capacity=%.2f, refill=%.6f/s",
                name, config.capacity(), config.refillRatePerSecond());
    }

    public boolean isConfigured() {
        return config != null;
    }

    public boolean check(String key) {
        return check(key, 1);
    }

    /**
     * Try to consume {@code cost} tokens.
     *
     * @param key the client key
     * @param cost the tokens to consume (positive)
     * @return true if admitted
     */
    public boolean check(String key, double cost) {
        return checkAndConsume(key, cost).allowed();
    }

    /**
     * Try to consume {@code cost} tokens, returning the figures for response headers.
     *
     * @param key the client key
     * @param cost the tokens to consume (positive)
     * @return the decision
     */
    public RateLimitDecision checkAndConsume(String key, double cost) {
        if (!(cost > 0)) {
            throw new IllegalArgumentException("cost must be positive");
        }
        final var current = config;
        if (current == null) {
            LOG.warnf("Token bucket %s is not configured; allowing request", name);
            return RateLimitDecision.unconfigured();
        }

        final var now = clock.millis();
        final var decision = new RateLimitDecision[1];
        store.compute(key, (k, state) -> {
            final var refilled = (state == null ? TokenBucketState.full(current.capacity(), now) : state)
                    .refill(current.capacity(), current.refillRatePerSecond(), now);

            if (!refilled.canConsume(cost)) {
                decision[0] = decisionFor(current, refilled, false, now, cost);
                return refilled;
            }
            final var next = refilled.consume(cost);
            decision[0] = decisionFor(current, next, true, now, cost);
            return next;
        });
        if (!decision[0].allowed()) {
            LOG.debugf("Token bucket %s denied client %s", name, ClientFingerprint.of(key));
        }
        return decision[0];
    }

    /**
     * Tokens currently available for a key, after refill. Does not consume.
     *
     * @param key the client key
     * @return the tokens; capacity for unseen keys, 0 when unconfigured
     */
    public double getTokens(String key) {
        final var current = config;
        if (current == null) {
            return 0;
        }
        final var now = clock.millis();
        return store.get(key)
                .map(s -> s.refill(current.capacity(), current.refillRatePerSecond(), now)
                        .tokens())
                .orElse(current.capacity());
    }

    /**
     * Figures for a key as a check of cost 1 would see them, without consuming.
     *
     * @param key the client key
     * @return the decision; unconfigured when no capacity is set
     */
    public RateLimitDecision status(String key) {
        final var current = config;
        if (current == null) {
            return RateLimitDecision.unconfigured();
        }
        final var now = clock.millis();
        final var state = store.get(key)
                .map(s -> s.refill(current.capacity(), current.refillRatePerSecond(), now))
                .orElseGet(() -> TokenBucketState.full(current.capacity(), now));
        return decisionFor(current, state, state.canConsume(1), now, 1);
    }

    /**
     * Refill a key's bucket to capacity.
     *
     * @param key the client key
     */
    public void reset(String key) {
        store.delete(key);
    }

    public long trackedKeys() {
        return store.size();
    }

    public void clear() {
        store.clear();
    }

    /**
     * How long an untouched bucket must be kept under a configuration: until
     * it would have refilled to capacity. Forgetting it earlier would hand the
     * client a full bucket ahead of time.
     *
     * @param config the capacity and refill rate
     * @return the retention for a bucket state
     */
    public static Function<TokenBucketState, Duration> retention(TokenBucketConfig config) {
        return state -> Duration.ofSeconds(config.secondsToRefill(config.capacity() - state.tokens()));
    }

    private static RateLimitDecision decisionFor(
            TokenBucketConfig config, TokenBucketState state, boolean allowed, long now, double cost) {
        final var capacity = (long) Math.floor(config.capacity());
        final var remaining = (long) Math.floor(state.tokens());
        final var used = Math.max(0, capacity - remaining);
        final var secondsToFull = config.secondsToRefill(config.capacity() - state.tokens());
        final var resetAt = secondsToFull >= (NEVER - now) / 1000 ? NEVER : now + secondsToFull * 1000;
        final var retryAfter = allowed ? 0 : Math.max(1, config.secondsToRefill(cost - state.tokens()));
        return new RateLimitDecision(allowed, capacity, used, remaining, resetAt, retryAfter);
    }
}
