package io.github.hotbrkm.outreach.dispatcher.send.limit;

import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide send limiter.
 * <p>
 * Tracks rolling per-second/minute/hour counters, a day counter that resets at local midnight,
 * per-domain cooldowns and adaptive backoff after consecutive failures.
 * Every read and update goes through the instance monitor, so there is exactly one mutating path.
 * <p>
 * Senders call {@link #tryAcquire(String)}, which checks every limit and reserves the slot in the same monitor
 * section. Concurrent senders therefore cannot both take the last slot of a window or of the day.
 */
@Slf4j
public class RateLimiter {

    private static final long SECOND_MS = 1_000L;
    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 3_600_000L;

    private final Clock clock;
    private final int maxPerSecond;
    private final int maxPerMinute;
    private final int maxPerHour;
    private final int maxPerDay;
    private final int failureThreshold;
    private final long backoffBaseMs;
    private final long backoffMaxMs;
    private final long domainCooldownMs;
    private final boolean adaptiveThrottling;

    private final WindowCounter secondWindow;
    private final WindowCounter minuteWindow;
    private final WindowCounter hourWindow;
    private final Map<String, Long> domainLastSent = new HashMap<>();

    private LocalDate currentDay;
    private int sentToday;
    private int consecutiveFailures;
    private long lastFailureMillis;

    public RateLimiter(DispatcherProperties.Rate rate, int dailyLimit) {
        this(rate, dailyLimit, Clock.systemDefaultZone());
    }

    public RateLimiter(DispatcherProperties.Rate rate, int dailyLimit, Clock clock) {
        Objects.requireNonNull(rate, "rate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxPerSecond = Math.max(1, rate.getPerSecond());
        this.maxPerMinute = Math.max(1, rate.getPerMinute());
        this.maxPerHour = Math.max(1, rate.getPerHour());
        this.maxPerDay = Math.max(0, dailyLimit);
        this.failureThreshold = rate.resolveFailureThreshold();
        this.backoffBaseMs = rate.resolveBackoffBaseMs();
        this.backoffMaxMs = rate.resolveBackoffMaxMs();
        this.domainCooldownMs = Math.max(0L, rate.getDomainCooldownMs());
        this.adaptiveThrottling = rate.isAdaptiveThrottlingEnabled();

        long now = clock.millis();
        this.secondWindow = new WindowCounter(SECOND_MS, now);
        this.minuteWindow = new WindowCounter(MINUTE_MS, now);
        this.hourWindow = new WindowCounter(HOUR_MS, now);
        this.currentDay = LocalDate.now(clock);
    }

    /**
     * Evaluates the limits from most to least restrictive and returns the first violation. Reserves nothing.
     *
     * @param destinationDomain recipient domain, or null to skip the domain cooldown check
     */
    public synchronized RateLimitDecision checkAllowance(String destinationDomain) {
        long now = clock.millis();
        rollWindows(now);

        if (secondWindow.count() >= maxPerSecond) {
            return RateLimitDecision.deny(RateLimitReason.RATE_LIMIT_SECOND, secondWindow.remainingMillis(now),
                    "Too many emails per second (" + secondWindow.count() + "/" + maxPerSecond + ")");
        }
        if (minuteWindow.count() >= maxPerMinute) {
            return RateLimitDecision.deny(RateLimitReason.RATE_LIMIT_MINUTE, minuteWindow.remainingMillis(now),
                    "Rate limit exceeded: " + minuteWindow.count() + "/" + maxPerMinute + " emails per minute");
        }
        if (hourWindow.count() >= maxPerHour) {
            return RateLimitDecision.deny(RateLimitReason.RATE_LIMIT_HOUR, hourWindow.remainingMillis(now),
                    "Rate limit exceeded: " + hourWindow.count() + "/" + maxPerHour + " emails per hour");
        }
        if (sentToday >= maxPerDay) {
            return RateLimitDecision.deny(RateLimitReason.RATE_LIMIT_DAY, millisUntilMidnight(),
                    "Daily limit reached: " + sentToday + "/" + maxPerDay);
        }

        if (adaptiveThrottling && consecutiveFailures >= failureThreshold) {
            long backoff = computeBackoffMillis(consecutiveFailures);
            long sinceLastFailure = now - lastFailureMillis;
            if (sinceLastFailure < backoff) {
                return RateLimitDecision.deny(RateLimitReason.ADAPTIVE_THROTTLE, backoff - sinceLastFailure,
                        "Adaptive throttling: " + consecutiveFailures + " consecutive failures");
            }
        }

        String domain = normalizeDomain(destinationDomain);
        if (domain != null && domainCooldownMs > 0) {
            Long lastSent = domainLastSent.get(domain);
            if (lastSent != null) {
                long sinceDomainSend = now - lastSent;
                if (sinceDomainSend < domainCooldownMs) {
                    return RateLimitDecision.deny(RateLimitReason.DOMAIN_COOLDOWN, domainCooldownMs - sinceDomainSend,
                            "Domain cooldown: " + domain + " (" + domainCooldownMs + "ms minimum between emails)");
                }
            }
        }

        return RateLimitDecision.allow();
    }

    /**
     * Checks every limit and, when all pass, reserves the slot: it is counted in each window and in the day counter,
     * and the domain cooldown starts now.
     */
    public synchronized SendPermit tryAcquire(String destinationDomain) {
        RateLimitDecision decision = checkAllowance(destinationDomain);
        if (!decision.allowed()) {
            return SendPermit.denied(decision);
        }
        long now = clock.millis();
        secondWindow.increment();
        minuteWindow.increment();
        hourWindow.increment();
        sentToday++;

        String domain = normalizeDomain(destinationDomain);
        Long previousStamp = domain == null ? null : domainLastSent.put(domain, now);
        return SendPermit.granted(domain, currentDay, secondWindow.windowStart(), minuteWindow.windowStart(),
                hourWindow.windowStart(), now, previousStamp);
    }

    /**
     * Confirms a delivered message. Its slot stays counted and the failure streak is cleared.
     */
    public synchronized void recordSuccess(SendPermit permit) {
        if (settle(permit)) {
            consecutiveFailures = 0;
        }
    }

    /**
     * Gives back the slot of a message that was not delivered. Counts from a window or day that has since rolled
     * are left alone.
     */
    public synchronized void release(SendPermit permit) {
        if (!settle(permit)) {
            return;
        }
        rollWindows(clock.millis());
        secondWindow.decrement(permit.secondWindowStart);
        minuteWindow.decrement(permit.minuteWindowStart);
        hourWindow.decrement(permit.hourWindowStart);
        if (permit.day.equals(currentDay) && sentToday > 0) {
            sentToday--;
        }
        if (permit.domain != null) {
            Long stamp = domainLastSent.get(permit.domain);
            if (stamp != null && stamp == permit.domainStampMillis) {
                if (permit.previousDomainStampMillis == null) {
                    domainLastSent.remove(permit.domain);
                } else {
                    domainLastSent.put(permit.domain, permit.previousDomainStampMillis);
                }
            }
        }
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        lastFailureMillis = clock.millis();
        if (adaptiveThrottling && consecutiveFailures == failureThreshold) {
            log.warn("event=adaptive_throttle_engaged, consecutiveFailures={}, backoffMs={}",
                    consecutiveFailures, computeBackoffMillis(consecutiveFailures));
        }
    }

    /**
     * Raises today's counter to at least {@code alreadySentToday}, used to resume after a restart.
     */
    public synchronized void restoreDailyCount(int alreadySentToday) {
        rollWindows(clock.millis());
        if (alreadySentToday > sentToday) {
            log.info("event=daily_count_restored, previous={}, restored={}", sentToday, alreadySentToday);
            sentToday = alreadySentToday;
        }
    }

    public synchronized int sentToday() {
        rollWindows(clock.millis());
        return sentToday;
    }

    public synchronized int remainingToday() {
        rollWindows(clock.millis());
        return Math.max(0, maxPerDay - sentToday);
    }

    public int dailyLimit() {
        return maxPerDay;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized RateLimitStatus status() {
        RateLimitDecision decision = checkAllowance(null);
        return new RateLimitStatus(decision.allowed(), secondWindow.count(), maxPerSecond, minuteWindow.count(), maxPerMinute,
                hourWindow.count(), maxPerHour, sentToday, maxPerDay, consecutiveFailures, decision.retryAfterMs());
    }

    /**
     * {@code base * 2^(failures - threshold)}, capped at the configured maximum.
     */
    long computeBackoffMillis(int failures) {
        int exponent = Math.max(0, failures - failureThreshold);
        if (exponent >= 31) {
            return backoffMaxMs;
        }
        long candidate = backoffBaseMs * (1L << exponent);
        if (candidate < 0L) {
            return backoffMaxMs;
        }
        return Math.min(candidate, backoffMaxMs);
    }

    private void rollWindows(long now) {
        secondWindow.roll(now);
        minuteWindow.roll(now);
        hourWindow.roll(now);

        LocalDate today = LocalDate.now(clock);
        if (!today.equals(currentDay)) {
            log.info("event=daily_counter_reset, day={}, previousCount={}", today, sentToday);
            currentDay = today;
            sentToday = 0;
            domainLastSent.clear();
        }
    }

    private static boolean settle(SendPermit permit) {
        Objects.requireNonNull(permit, "permit must not be null");
        if (permit.settled) {
            return false;
        }
        permit.settled = true;
        return true;
    }

    private long millisUntilMidnight() {
        long midnight = currentDay.plusDays(1).atStartOfDay(clock.getZone()).toInstant().toEpochMilli();
        return Math.max(0L, midnight - clock.millis());
    }

    private static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        return domain.trim().toLowerCase(Locale.ROOT);
    }
}
