package turnstile.core.service.auth;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.BruteForceConfig;
import turnstile.core.model.auth.BruteForceEntry;
import turnstile.core.model.auth.FailureOutcome;
import turnstile.core.model.auth.LockoutPolicy;
import turnstile.core.port.out.LimiterStateStore;
import turnstile.core.port.out.LimiterStateStoreFactory;
import turnstile.core.util.ClientFingerprint;

/**
 * Locks out keys after repeated failures.
 *
 * <p>Failures are counted per key. A failure that arrives more than the reset
 * window after the previous one starts a new sequence at 1. Once the count
 * reaches the maximum the key is locked for the lockout duration. An expired
 * lock is cleared when observed, but the failure count is kept, so a client
 * that keeps failing inside the reset window is locked again on its next
 * failure. A success forgets the key entirely.
 */
@ApplicationScoped
public class BruteForceGuard {

    private static final Logger LOG = Logger.getLogger(BruteForceGuard.class);

    private final LockoutPolicy policy;
    private final LimiterStateStore<BruteForceEntry> store;
    private final Clock clock;

    @Inject
    public BruteForceGuard(BruteForceConfig config, LimiterStateStoreFactory stores, Clock clock) {
        this(new LockoutPolicy(config.maxFailures(), config.lockoutDuration(), config.resetWindow()), stores, clock);
    }

    private BruteForceGuard(LockoutPolicy policy, LimiterStateStoreFactory stores, Clock clock) {
        this(policy, stores.<BruteForceEntry>create("brute-force", entry -> retention(policy)), clock);
    }

    public BruteForceGuard(LockoutPolicy policy, LimiterStateStore<BruteForceEntry> store, Clock clock) {
        this.policy = policy;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Record a failed attempt.
     *
     * @param key the client key
     * @return attempts left before lockout; 0 once locked
     */
    public int recordFailure(String key) {
        return registerFailure(key).remainingAttempts();
    }

    /**
     * Record a failed attempt and report whether it started a lockout.
     *
     * <p>Failures on a key that is already locked count, but do not start a
     * new lockout.
     *
     * @param key the client key
     * @return the outcome
     */
    public FailureOutcome registerFailure(String key) {
        final var now = clock.instant();
        final var lockStarted = new boolean[1];
        final var entry = store.compute(key, (k, current) -> {
            var next = current;
            if (next != null && next.lockExpired(now)) {
                next = next.unlock();
            }
            final var wasLocked = next != null && next.locked();

            if (next == null) {
                next = BruteForceEntry.firstFailure(now);
            } else if (Duration.between(next.lastFailureAt(), now).compareTo(policy.resetWindow()) > 0) {
                next = next.restartSequence(now);
            } else {
                next = next.increment(now);
            }

            if (next.failureCount() >= policy.maxFailures()) {
                next = next.lock(now.plus(policy.lockoutDuration()));
            }
            lockStarted[0] = next.locked() && !wasLocked;
            return next;
        });

        if (lockStarted[0]) {
            LOG.warnf(
                    "Brute force protection triggered for client %s after %d failures; locked for %d seconds",
                    ClientFingerprint.of(key), entry.failureCount(), policy.lockoutDuration().toSeconds());
        } else {
            LOG.debugf("Recorded failure %d for client %s", entry.failureCount(), ClientFingerprint.of(key));
        }
        return new FailureOutcome(
                entry.failureCount(), Math.max(0, policy.maxFailures() - entry.failureCount()), lockStarted[0]);
    }

    /**
     * Check whether a key is locked. Clears a lock whose time has passed.
     *
     * @param key the client key
     * @return true if locked
     */
    public boolean isLocked(String key) {
        final var now = clock.instant();
        final var entry = store.compute(key, (k, current) -> {
            if (current != null && current.lockExpired(now)) {
                LOG.debugf("Lockout expired for client %s", ClientFingerprint.of(k));
                return current.unlock();
            }
            return current;
        });
        return entry != null && entry.locked();
    }

    /**
     * Forget all failures and any lock for a key.
     *
     * @param key the client key
     */
    public void recordSuccess(String key) {
        store.delete(key);
    }

    /**
     * Time left on a key's lock.
     *
     * @param key the client key
     * @return the remaining lock time in milliseconds, or 0 when not locked
     */
    public long getLockoutTimeRemaining(String key) {
        final var now = clock.instant();
        return store.get(key)
                .filter(BruteForceEntry::locked)
                .flatMap(BruteForceEntry::lockedUntil)
                .filter(until -> until.isAfter(now))
                .map(until -> Duration.between(now, until).toMillis())
                .orElse(0L);
    }

    /**
     * Failures counted in the current sequence.
     *
     * @param key the client key
     * @return the count, 0 for unknown keys
     */
    public int getFailureCount(String key) {
        return store.get(key).map(BruteForceEntry::failureCount).orElse(0);
    }

    /**
     * How long an untouched entry must be kept: through its lockout and
     * through the window in which its failures still count.
     *
     * @param policy the lockout policy
     * @return the retention
     */
    public static Duration retention(LockoutPolicy policy) {
        return policy.lockoutDuration().compareTo(policy.resetWindow()) > 0
                ? policy.lockoutDuration()
                : policy.resetWindow();
    }

    public LockoutPolicy policy() {
        return policy;
    }

    public void clear() {
        store.clear();
    }
}
