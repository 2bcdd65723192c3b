package turnstile.core.model.ratelimit;

/**
 * Read-only view of a sliding window bucket.
 *
 * @param used requests counted in the current window
 * @param limit the maximum requests per window
 * @param remaining requests still admissible in the window
 * @param resetAtMillis epoch millis when the oldest counted request leaves the window
 */
public record SlidingWindowStatus(int used, int limit, int remaining, long resetAtMillis) {

    /**
     * Status reported for a policy that was never initialized.
     *
     * @return an all-zero status
     */
    public static SlidingWindowStatus unconfigured() {
        return new SlidingWindowStatus(0, 0, 0, 0);
    }

    /**
     * Returns the reset time as epoch seconds, rounded up.
     *
     * @return reset time as epoch seconds
     */
    public long resetAtEpochSeconds() {
        return (resetAtMillis + 999) / 1000;
    }
}
