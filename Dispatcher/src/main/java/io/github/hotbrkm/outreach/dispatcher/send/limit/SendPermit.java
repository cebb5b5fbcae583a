package io.github.hotbrkm.outreach.dispatcher.send.limit;

import java.time.LocalDate;

/**
 * A slot reserved by {@link RateLimiter#tryAcquire(String)}.
 * <p>
 * A granted permit is already counted in every window and in the day counter. It must be settled exactly once,
 * with {@link RateLimiter#recordSuccess(SendPermit)} or {@link RateLimiter#release(SendPermit)}.
 * Fields are read and written under the limiter's monitor.
 */
public final class SendPermit {

    private final RateLimitDecision decision;
    final String domain;
    final LocalDate day;
    final long secondWindowStart;
    final long minuteWindowStart;
    final long hourWindowStart;
    final long domainStampMillis;
    final Long previousDomainStampMillis;
    boolean settled;

    private SendPermit(RateLimitDecision decision, String domain, LocalDate day, long secondWindowStart,
                       long minuteWindowStart, long hourWindowStart, long domainStampMillis, Long previousDomainStampMillis) {
        this.decision = decision;
        this.domain = domain;
        this.day = day;
        this.secondWindowStart = secondWindowStart;
        this.minuteWindowStart = minuteWindowStart;
        this.hourWindowStart = hourWindowStart;
        this.domainStampMillis = domainStampMillis;
        this.previousDomainStampMillis = previousDomainStampMillis;
    }

    static SendPermit denied(RateLimitDecision decision) {
        SendPermit permit = new SendPermit(decision, null, null, 0L, 0L, 0L, 0L, null);
        permit.settled = true;
        return permit;
    }

    static SendPermit granted(String domain, LocalDate day, long secondWindowStart, long minuteWindowStart,
                              long hourWindowStart, long domainStampMillis, Long previousDomainStampMillis) {
        return new SendPermit(RateLimitDecision.allow(), domain, day, secondWindowStart, minuteWindowStart,
                hourWindowStart, domainStampMillis, previousDomainStampMillis);
    }

    public boolean granted() {
        return decision.allowed();
    }

    public RateLimitDecision decision() {
        return decision;
    }
}
