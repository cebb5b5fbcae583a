package io.github.hotbrkm.outreach.dispatcher.send.limit;

/**
 * Point-in-time view of the limiter counters.
 */
public record RateLimitStatus(boolean allowed, int sentThisSecond, int maxPerSecond, int sentThisMinute, int maxPerMinute,
                              int sentThisHour, int maxPerHour, int sentToday, int maxPerDay,
                              int consecutiveFailures, long retryAfterMs) {

    public int remainingToday() {
        return Math.max(0, maxPerDay - sentToday);
    }
}
