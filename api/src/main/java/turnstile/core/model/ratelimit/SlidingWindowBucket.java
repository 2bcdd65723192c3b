package turnstile.core.model.ratelimit;

import java.util.Arrays;

/**
 * Request timestamps recorded for one sliding window key.
 *
 * <p>Timestamps are epoch milliseconds in ascending insertion order. Instances
 * are immutable; every mutation returns a new bucket so the value can be handed
 * to any {@link turnstile.core.port.out.LimiterStateStore} implementation.
 *
 * <p>After {@link #purge(long)} every retained timestamp {@code t} satisfies
 * {@code t > now - windowMillis}.
 */
public final class SlidingWindowBucket {

    private static final long[] EMPTY = new long[0];

    private final long[] timestamps;
    private final long windowMillis;

    private SlidingWindowBucket(long[] timestamps, long windowMillis) {
        this.timestamps = timestamps;
        this.windowMillis = windowMillis;
    }

    /**
     * Creates an empty bucket.
     *
     * @param windowMillis the window length in milliseconds
     * @return an empty bucket
     */
    public static SlidingWindowBucket empty(long windowMillis) {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("windowMillis must be positive");
        }
        return new SlidingWindowBucket(EMPTY, windowMillis);
    }

    /**
     * Returns a bucket without timestamps at or before {@code nowMillis - windowMillis}.
     *
     * @param nowMillis the current time
     * @return this bucket if nothing expired, otherwise a purged copy
     */
    public SlidingWindowBucket purge(long nowMillis) {
        final var windowStart = nowMillis - windowMillis;
        var firstValid = 0;
        while (firstValid < timestamps.length && timestamps[firstValid] <= windowStart) {
            firstValid++;
        }
        if (firstValid == 0) {
            return this;
        }
        return new SlidingWindowBucket(Arrays.copyOfRange(timestamps, firstValid, timestamps.length), windowMillis);
    }

    /**
     * Returns a bucket with {@code nowMillis} appended.
     *
     * @param nowMillis the request time
     * @return the new bucket
     */
    public SlidingWindowBucket record(long nowMillis) {
        final var next = Arrays.copyOf(timestamps, timestamps.length + 1);
        next[timestamps.length] = nowMillis;
        return new SlidingWindowBucket(next, windowMillis);
    }

    /**
     * Returns the number of recorded timestamps.
     *
     * @return the request count
     */
    public int count() {
        return timestamps.length;
    }

    /**
     * Returns a bucket with the same timestamps measured against another window.
     *
     * @param newWindowMillis the window length in milliseconds
     * @return this bucket if the window is unchanged, otherwise a copy
     */
    public SlidingWindowBucket withWindow(long newWindowMillis) {
        if (newWindowMillis == windowMillis) {
            return this;
        }
        if (newWindowMillis <= 0) {
            throw new IllegalArgumentException("windowMillis must be positive");
        }
        return new SlidingWindowBucket(timestamps, newWindowMillis);
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public long windowMillis() {
        return windowMillis;
    }

    /**
     * Returns the moment the oldest recorded request leaves the window.
     *
     * @param nowMillis the current time, used when the bucket is empty
     * @return the reset time in epoch milliseconds
     */
    public long resetAtMillis(long nowMillis) {
        if (timestamps.length == 0) {
            return nowMillis + windowMillis;
        }
        return timestamps[0] + windowMillis;
    }

    @Override
    public String toString() {
        return "SlidingWindowBucket[count=" + timestamps.length + ", windowMillis=" + windowMillis + "]";
    }
}
