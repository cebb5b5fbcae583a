package io.github.hotbrkm.outreach.dispatcher.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DispatcherProperties test")
class DispatcherPropertiesTest {

    @Test
    @DisplayName("Batch size and delay are clamped and fall back to defaults")
    void batchClamping() {
        DispatcherProperties.Batch batch = new DispatcherProperties().getBatch();

        assertThat(batch.resolveBatchSize(0)).isEqualTo(25);
        assertThat(batch.resolveBatchSize(3)).isEqualTo(10);
        assertThat(batch.resolveBatchSize(500)).isEqualTo(50);
        assertThat(batch.resolveDelayMs(-1)).isEqualTo(10_000L);
        assertThat(batch.resolveDelayMs(1_000)).isEqualTo(5_000L);
        assertThat(batch.resolveDelayMs(60_000)).isEqualTo(30_000L);
    }

    @Test
    @DisplayName("Campaign daily limit uses the campaign value when set")
    void campaignDailyLimit() {
        DispatcherProperties.Limits limits = new DispatcherProperties().getLimits();

        assertThat(limits.resolveCampaignDailyLimit(0)).isEqualTo(50);
        assertThat(limits.resolveCampaignDailyLimit(120)).isEqualTo(120);
        limits.setGlobalDailyLimit(-5);
        assertThat(limits.resolveGlobalDailyLimit()).isEqualTo(300);
    }

    @Test
    @DisplayName("Backoff maximum never drops below the base")
    void backoffBounds() {
        DispatcherProperties.Rate rate = new DispatcherProperties().getRate();
        rate.setBackoffBaseMs(60_000);
        rate.setBackoffMaxMs(10_000);

        assertThat(rate.resolveBackoffMaxMs()).isEqualTo(60_000L);
    }

    @Test
    @DisplayName("Blank zone resolves to the system zone")
    void zoneResolution() {
        DispatcherProperties.Schedule schedule = new DispatcherProperties().getSchedule();
        assertThat(schedule.resolveZone()).isEqualTo(ZoneId.systemDefault());

        schedule.setZone(" Asia/Seoul ");
        assertThat(schedule.resolveZone()).isEqualTo(ZoneId.of("Asia/Seoul"));
    }
}
