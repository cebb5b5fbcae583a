package io.github.hotbrkm.outreach.dispatcher.event;

import io.github.hotbrkm.outreach.dispatcher.schedule.DailyReport;
import io.github.hotbrkm.outreach.dispatcher.support.MutableClock;
import io.github.hotbrkm.outreach.dispatcher.support.RecordingNotificationGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("DispatchEventChannel test")
class DispatchEventChannelTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Test
    @DisplayName("A failing gateway does not keep events from the others")
    void failingGatewayIsolated() {
        NotificationGateway broken = mock(NotificationGateway.class);
        doThrow(new IllegalStateException("down")).when(broken).onEvent(any());
        doThrow(new IllegalStateException("down")).when(broken).onReport(any());
        RecordingNotificationGateway recording = new RecordingNotificationGateway();
        DispatchEventChannel channel = new DispatchEventChannel(new MutableClock(NOW, ZoneOffset.UTC), List.of(broken));
        channel.register(recording);

        channel.publish(new EmailSentEvent("c-1", NOW, "a@one.com", "One", "m-1"));
        channel.publishReport(new DailyReport(LocalDate.of(2026, 3, 2), DailyReport.Kind.OPEN, 0, 0, 0, 0, 0, 0, 0,
                0, 300, 300, null));

        assertThat(recording.events()).hasSize(1);
        assertThat(recording.reports()).hasSize(1);
    }

    @Test
    @DisplayName("Server log events carry the channel clock's time")
    void serverLogTimestamp() {
        RecordingNotificationGateway recording = new RecordingNotificationGateway();
        DispatchEventChannel channel = new DispatchEventChannel(new MutableClock(NOW, ZoneOffset.UTC), List.of(recording));

        channel.serverLog("c-1", ServerLogEvent.Level.SUCCESS, "Campaign completed");

        assertThat(recording.serverLogs(ServerLogEvent.Level.SUCCESS)).singleElement().satisfies(event -> {
            assertThat(event.timestamp()).isEqualTo(NOW);
            assertThat(event.campaignId()).isEqualTo("c-1");
            assertThat(event.type()).isEqualTo("server-log");
        });
    }

    @Test
    @DisplayName("Logging gateway accepts every event kind")
    void loggingGateway() {
        LoggingNotificationGateway gateway = new LoggingNotificationGateway();

        gateway.onEvent(new ServerLogEvent("c-1", NOW, ServerLogEvent.Level.ERROR, "failure"));
        gateway.onEvent(new CampaignCompleteEvent("c-1", NOW, 10, 2));
        gateway.onReport(new DailyReport(LocalDate.of(2026, 3, 2), DailyReport.Kind.CLOSE, 1, 1, 0, 0, 5, 0, 5, 5,
                300, 295, List.of()));
    }
}
