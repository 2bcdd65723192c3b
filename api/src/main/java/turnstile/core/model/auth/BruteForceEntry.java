package turnstile.core.model.auth;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Failure history for one brute-force tracking key.
 *
 * <p>{@code locked} implies {@code lockedUntil} is present. Readers that find
 * {@code lockedUntil} in the past must call {@link #unlock()} before answering.
 *
 * @param failureCount failures in the current attempt sequence
 * @param lastFailureAt time of the most recent failure
 * @param locked whether the key is currently locked out
 * @param lockedUntil when the lockout ends
 */
public record BruteForceEntry(int failureCount, Instant lastFailureAt, boolean locked, Optional<Instant> lockedUntil) {

    /**
     * Creates an entry with validation.
     */
    public BruteForceEntry {
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must be non-negative");
        }
        Objects.requireNonNull(lastFailureAt, "lastFailureAt must not be null");
        lockedUntil = Objects.requireNonNullElse(lockedUntil, Optional.empty());
        if (locked && lockedUntil.isEmpty()) {
            throw new IllegalArgumentException("a locked entry requires lockedUntil");
        }
    }

    /**
     * Creates the entry for a first failure.
     *
     * @param now the failure time
     * @return the entry
     */
    public static BruteForceEntry firstFailure(Instant now) {
        return new BruteForceEntry(1, now, false, Optional.empty());
    }

    /**
     * Returns an entry whose attempt sequence restarted at one failure, keeping the lock fields.
     *
     * @param now the failure time
     * @return the entry
     */
    public BruteForceEntry restartSequence(Instant now) {
        return new BruteForceEntry(1, now, locked, lockedUntil);
    }

    /**
     * Returns an entry with one more failure.
     *
     * @param now the failure time
     * @return the entry
     */
    public BruteForceEntry increment(Instant now) {
        return new BruteForceEntry(failureCount + 1, now, locked, lockedUntil);
    }

    /**
     * Returns a locked copy.
     *
     * @param until when the lockout ends
     * @return the entry
     */
    public BruteForceEntry lock(Instant until) {
        return new BruteForceEntry(failureCount, lastFailureAt, true, Optional.of(until));
    }

    /**
     * Returns an unlocked copy. The failure count is kept.
     *
     * @return the entry
     */
    public BruteForceEntry unlock() {
        return new BruteForceEntry(failureCount, lastFailureAt, false, Optional.empty());
    }

    /**
     * Returns whether the lockout has ended at {@code now}.
     *
     * @param now the current time
     * @return true if locked with an expiry at or before {@code now}
     */
    public boolean lockExpired(Instant now) {
        return locked && lockedUntil.map(until -> !until.isAfter(now)).orElse(true);
    }
}
