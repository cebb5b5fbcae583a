package io.github.hotbrkm.outreach.dispatcher.send.limit;

/**
 * Answer to "may I send now".
 *
 * @param allowed      whether a send may start immediately
 * @param reason       the first violated constraint, {@link RateLimitReason#NONE} when allowed
 * @param retryAfterMs time until the violated constraint clears
 * @param message      human readable detail
 */
public record RateLimitDecision(boolean allowed, RateLimitReason reason, long retryAfterMs, String message) {

    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, RateLimitReason.NONE, 0L, null);

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision deny(RateLimitReason reason, long retryAfterMs, String message) {
        return new RateLimitDecision(false, reason, Math.max(0L, retryAfterMs), message);
    }
}
