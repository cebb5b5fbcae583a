package io.github.hotbrkm.outreach.dispatcher.send.limit;

/**
 * Fixed window counter with a reset timestamp.
 * <p>
 * Not thread-safe on its own; {@link RateLimiter} guards every access.
 */
final class WindowCounter {

    private final long windowMillis;
    private int count;
    private long windowStartMillis;

    WindowCounter(long windowMillis, long nowMillis) {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("windowMillis must be positive: " + windowMillis);
        }
        this.windowMillis = windowMillis;
        this.windowStartMillis = nowMillis;
    }

    /**
     * Resets the counter once the window has elapsed.
     */
    void roll(long nowMillis) {
        if (nowMillis - windowStartMillis >= windowMillis) {
            windowStartMillis = nowMillis;
            count = 0;
        }
    }

    void increment() {
        count++;
    }

    /**
     * Takes back one count, unless the window has rolled since {@code startedAt}.
     */
    void decrement(long startedAt) {
        if (windowStartMillis == startedAt && count > 0) {
            count--;
        }
    }

    long windowStart() {
        return windowStartMillis;
    }

    int count() {
        return count;
    }

    long remainingMillis(long nowMillis) {
        return Math.max(0L, windowMillis - (nowMillis - windowStartMillis));
    }
}
