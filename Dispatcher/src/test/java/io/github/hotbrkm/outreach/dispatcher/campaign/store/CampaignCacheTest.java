package io.github.hotbrkm.outreach.dispatcher.campaign.store;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CampaignCache test")
class CampaignCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    private static CampaignState campaign(String id) {
        return CampaignState.builder().id(id).build();
    }

    @Test
    @DisplayName("Entries expire after the time-to-live")
    void entriesExpire() {
        CampaignCache cache = new CampaignCache(Duration.ofMinutes(5), 10, clock);
        cache.put(campaign("a"));

        clock.advance(Duration.ofMinutes(4));
        assertThat(cache.get("a")).isNotNull();

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("a")).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("The cache never holds more than its maximum entries")
    void sizeBounded() {
        CampaignCache cache = new CampaignCache(Duration.ofMinutes(5), 2, clock);
        cache.put(campaign("a"));
        cache.put(campaign("b"));
        cache.put(campaign("c"));

        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("An invalidated entry is gone")
    void invalidate() {
        CampaignCache cache = new CampaignCache(Duration.ofMinutes(5), 10, clock);
        cache.put(campaign("a"));

        cache.invalidate("a");

        assertThat(cache.get("a")).isNull();
    }

    @Test
    @DisplayName("Eviction removes only expired entries")
    void evictExpired() {
        CampaignCache cache = new CampaignCache(Duration.ofMinutes(5), 10, clock);
        cache.put(campaign("a"));
        clock.advance(Duration.ofMinutes(3));
        cache.put(campaign("b"));
        clock.advance(Duration.ofMinutes(3));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("A zero time-to-live disables caching")
    void disabledCache() {
        CampaignCache cache = new CampaignCache(Duration.ZERO, 10, clock);
        cache.put(campaign("a"));

        assertThat(cache.size()).isZero();
    }
}
