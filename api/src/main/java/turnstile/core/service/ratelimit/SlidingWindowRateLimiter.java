package turnstile.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.AdmissionConfig;
import turnstile.core.model.ratelimit.RateLimitDecision;
import turnstile.core.model.ratelimit.RateLimitKey;
import turnstile.core.model.ratelimit.SlidingWindowBucket;
import turnstile.core.model.ratelimit.SlidingWindowPolicy;
import turnstile.core.model.ratelimit.SlidingWindowStatus;
import turnstile.core.port.out.LimiterStateStore;
import turnstile.core.port.out.LimiterStateStoreFactory;
import turnstile.core.util.ClientFingerprint;

/**
 * Sliding window rate limiter over named policies.
 *
 * <p>Each {@code (policy, key)} pair keeps the timestamps of its admitted
 * requests. A request is admitted when fewer than {@code maxRequests}
 * timestamps fall inside the trailing window; denied requests are not
 * recorded. Checking a policy that was never initialized logs a warning and
 * admits the request.
 *
 * <p>A daemon thread periodically drops expired timestamps and removes keys
 * whose windows have emptied, so idle clients do not accumulate.
 */
@ApplicationScoped
public class SlidingWindowRateLimiter {

    private static final Logger LOG = Logger.getLogger(SlidingWindowRateLimiter.class);

    private final LimiterStateStore<SlidingWindowBucket> store;
    private final Clock clock;
    private final ConcurrentMap<String, SlidingWindowPolicy> policies = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweepExecutor;

    @Inject
    public SlidingWindowRateLimiter(LimiterStateStoreFactory stores, Clock clock, AdmissionConfig config) {
        this(stores.create("sliding-window", SlidingWindowRateLimiter::retention), clock, config.sweepInterval());
    }

    /**
     * Create a limiter.
     *
     * @param store the state store
     * @param clock the time source
     * @param sweepInterval how often to sweep expired state; zero disables the sweep thread
     */
    public SlidingWindowRateLimiter(
            LimiterStateStore<SlidingWindowBucket> store, Clock clock, Duration sweepInterval) {
        this.store = store;
        this.clock = clock;

        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            this.sweepExecutor = null;
            return;
        }
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "sliding-window-sweep");
            t.setDaemon(true);
            return t;
        });
        final var intervalMillis = sweepInterval.toMillis();
        sweepExecutor.scheduleAtFixedRate(this::sweepQuietly, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Register or replace a policy.
     *
     * @param name the policy name
     * @param maxRequests requests admitted per window
     * @param windowMillis the window length
     */
    public void initialize(String name, int maxRequests, long windowMillis) {
        initialize(new SlidingWindowPolicy(name, maxRequests, windowMillis));
    }

    /**
     * Register or replace a policy.
     *
     * @param policy the policy
     */
    public void initialize(SlidingWindowPolicy policy) {
        policies.put(policy.name(), policy);
        LOG.debugf(
                "Initialized sliding window policy %s: %d requests per %d ms",
                policy.name(), policy.maxRequests(), policy.windowMillis());
    }

    public Optional<SlidingWindowPolicy> policy(String name) {
        return Optional.ofNullable(policies.get(name));
    }

    /**
     * Check and record a request.
     *
     * @param policyName the policy
     * @param key the client key
     * @return true if admitted
     */
    public boolean check(String policyName, String key) {
        return checkAndConsume(policyName, key).allowed();
    }

    /**
     * Check and record a request, returning the figures for response headers.
     *
     * <p>The purge, count and append happen atomically per key.
     *
     * @param policyName the policy
     * @param key the client key
     * @return the decision
     */
    public RateLimitDecision checkAndConsume(String policyName, String key) {
        final var policy = policies.get(policyName);
        if (policy == null) {
            LOG.warnf("Sliding window policy %s is not initialized; allowing request", policyName);
            return RateLimitDecision.unconfigured();
        }

        final var now = clock.millis();
        final var decision = new RateLimitDecision[1];
        store.compute(RateLimitKey.of(policyName, key).toCacheKey(), (k, current) -> {
            final var bucket = (current == null
                            ? SlidingWindowBucket.empty(policy.windowMillis())
                            : current.withWindow(policy.windowMillis()))
                    .purge(now);

            if (bucket.count() >= policy.maxRequests()) {
                final var resetAt = bucket.resetAtMillis(now);
                decision[0] = new RateLimitDecision(
                        false, policy.maxRequests(), bucket.count(), 0, resetAt, retryAfterSeconds(resetAt, now));
                return bucket.isEmpty() ? null : bucket;
            }

            final var next = bucket.record(now);
            decision[0] = new RateLimitDecision(
                    true,
                    policy.maxRequests(),
                    next.count(),
                    policy.maxRequests() - next.count(),
                    next.resetAtMillis(now),
                    0);
            return next;
        });
        if (!decision[0].allowed()) {
            LOG.debugf(
                    "Sliding window %s denied client %s: %d/%d",
                    policyName, ClientFingerprint.of(key), decision[0].used(), decision[0].limit());
        }
        return decision[0];
    }

    /**
     * Read the current usage without recording a request.
     *
     * @param policyName the policy
     * @param key the client key
     * @return the status; all zeros when the policy is not initialized
     */
    public SlidingWindowStatus getStatus(String policyName, String key) {
        final var policy = policies.get(policyName);
        if (policy == null) {
            return SlidingWindowStatus.unconfigured();
        }

        final var now = clock.millis();
        final var bucket = store.get(RateLimitKey.of(policyName, key).toCacheKey())
                .map(b -> b.withWindow(policy.windowMillis()).purge(now))
                .orElseGet(() -> SlidingWindowBucket.empty(policy.windowMillis()));

        final var used = bucket.count();
        return new SlidingWindowStatus(
                used, policy.maxRequests(), Math.max(0, policy.maxRequests() - used), bucket.resetAtMillis(now));
    }

    /**
     * Forget all recorded requests for a key.
     *
     * @param policyName the policy
     * @param key the client key
     */
    public void reset(String policyName, String key) {
        store.delete(RateLimitKey.of(policyName, key).toCacheKey());
    }

    /**
     * Drop expired timestamps everywhere and remove keys left empty.
     *
     * @return the number of keys removed
     */
    public int sweep() {
        final var now = clock.millis();
        final var before = store.size();
        for (final var key : store.keys()) {
            store.compute(key, (k, bucket) -> {
                if (bucket == null) {
                    return null;
                }
                final var purged = bucket.purge(now);
                return purged.isEmpty() ? null : purged;
            });
        }
        final var removed = (int) Math.max(0, before - store.size());
        if (removed > 0) {
            LOG.debugf("Swept %d idle sliding window keys", removed);
        }
        return removed;
    }

    /**
     * Number of keys currently tracked.
     *
     * @return the key count
     */
    public long trackedKeys() {
        return store.size();
    }

    @PreDestroy
    public void shutdown() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
        }
        store.clear();
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // An exception would cancel the scheduled task
            LOG.warnf(e, "Sliding window sweep failed");
        }
    }

    /**
     * How long an untouched bucket must be kept: every timestamp in it is
     * expired once a full window has passed.
     *
     * @param bucket the bucket
     * @return the retention
     */
    public static Duration retention(SlidingWindowBucket bucket) {
        return Duration.ofMillis(bucket.windowMillis());
    }

    static long retryAfterSeconds(long resetAtMillis, long nowMillis) {
        return Math.max(1, (long) Math.ceil((resetAtMillis - nowMillis) / 1000.0));
    }
}
