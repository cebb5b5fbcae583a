package io.github.hotbrkm.outreach.dispatcher.campaign.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Bounded read cache over Caffeine with a time-to-live per entry, timed by the injected clock.
 * <p>
 * Only the store's writer thread puts entries, so a cached campaign is never older than its snapshot file.
 */
class CampaignCache {

    private final boolean enabled;
    private final Cache<String, CampaignState> entries;

    CampaignCache(Duration ttl, int maxEntries, Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        Duration resolvedTtl = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;
        int resolvedMax = Math.max(0, maxEntries);
        this.enabled = !resolvedTtl.isZero() && resolvedMax > 0;
        this.entries = Caffeine.newBuilder()
                .maximumSize(resolvedMax)
                .expireAfterWrite(resolvedTtl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    CampaignState get(String id) {
        return entries.getIfPresent(id);
    }

    void put(CampaignState campaign) {
        if (enabled) {
            entries.put(campaign.getId(), campaign);
        }
    }

    void invalidate(String id) {
        entries.invalidate(id);
    }

    int evictExpired() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        return (int) Math.max(0, before - entries.estimatedSize());
    }

    int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }
}
