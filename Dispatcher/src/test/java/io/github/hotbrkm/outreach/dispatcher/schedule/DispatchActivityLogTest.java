package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.event.CampaignProgressEvent;
import io.github.hotbrkm.outreach.dispatcher.event.EmailErrorEvent;
import io.github.hotbrkm.outreach.dispatcher.event.EmailSentEvent;
import io.github.hotbrkm.outreach.dispatcher.event.ServerLogEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DispatchActivityLog test")
class DispatchActivityLogTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Test
    @DisplayName("Progress events are not kept and other events are described")
    void keepsMeaningfulEvents() {
        DispatchActivityLog activityLog = new DispatchActivityLog(10);

        activityLog.onEvent(new CampaignProgressEvent("c-1", NOW, 1, 10, 1, 0));
        activityLog.onEvent(new EmailSentEvent("c-1", NOW, "a@one.com", "One", "m-1"));
        activityLog.onEvent(new EmailErrorEvent("c-1", NOW, "b@two.com", "Two", "Invalid email data."));
        activityLog.onEvent(new ServerLogEvent(null, NOW, ServerLogEvent.Level.WARNING, "Sending suspended"));

        assertThat(activityLog.size()).isEqualTo(3);
        assertThat(activityLog.recent(10)).extracting(DispatchActivityLog.Entry::message).containsExactly(
                "Sent to a@one.com", "Failed b@two.com: Invalid email data.", "WARNING: Sending suspended");
        assertThat(activityLog.recent(1)).extracting(DispatchActivityLog.Entry::type).containsExactly("server-log");
    }

    @Test
    @DisplayName("The hard limit drops the oldest entries")
    void hardLimit() {
        DispatchActivityLog activityLog = new DispatchActivityLog(2);
        for (int i = 0; i < 5; i++) {
            activityLog.onEvent(new EmailSentEvent("c-1", NOW.plusSeconds(i), "user" + i + "@example.com", "", "m"));
        }

        assertThat(activityLog.recent(10)).extracting(DispatchActivityLog.Entry::message)
                .containsExactly("Sent to user3@example.com", "Sent to user4@example.com");
    }

    @Test
    @DisplayName("Trim drops entries past retention and then keeps only the newest")
    void trim() {
        DispatchActivityLog activityLog = new DispatchActivityLog(100);
        activityLog.onEvent(new EmailSentEvent("c-1", NOW.minus(Duration.ofDays(40)), "old@example.com", "", "m"));
        for (int i = 0; i < 4; i++) {
            activityLog.onEvent(new EmailSentEvent("c-1", NOW.plusSeconds(i), "user" + i + "@example.com", "", "m"));
        }

        int removed = activityLog.trim(2, Duration.ofDays(30), NOW.plusSeconds(10));

        assertThat(removed).isEqualTo(3);
        assertThat(activityLog.recent(10)).extracting(DispatchActivityLog.Entry::message)
                .containsExactly("Sent to user2@example.com", "Sent to user3@example.com");
    }
}
