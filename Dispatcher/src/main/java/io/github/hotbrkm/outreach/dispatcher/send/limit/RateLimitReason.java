package io.github.hotbrkm.outreach.dispatcher.send.limit;

/**
 * Why a send was refused, ordered from the most to the least restrictive check.
 */
public enum RateLimitReason {
    NONE,
    RATE_LIMIT_SECOND,
    RATE_LIMIT_MINUTE,
    RATE_LIMIT_HOUR,
    RATE_LIMIT_DAY,
    ADAPTIVE_THROTTLE,
    DOMAIN_COOLDOWN
}
