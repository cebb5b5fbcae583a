package io.github.hotbrkm.outreach.dispatcher.campaign;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CampaignState test")
class CampaignStateTest {

    private static final LocalDate DAY_ONE = LocalDate.of(2026, 3, 2);
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private static List<Contact> contacts(int count) {
        List<Contact> contacts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            contacts.add(new Contact("user" + i + "@example.com", "Company " + i));
        }
        return contacts;
    }

    private static CampaignState campaign(int contacts) {
        return CampaignState.builder()
                .id("c-1")
                .name("Spring outreach")
                .subject("Hello")
                .template("<p>Hi</p>")
                .contacts(contacts(contacts))
                .createdAt(NOW)
                .status(CampaignStatus.ACTIVE)
                .build();
    }

    @Test
    @DisplayName("Next batch returns unprocessed contacts in order")
    void nextBatchSkipsProcessed() {
        CampaignState campaign = campaign(5);
        List<Contact> first = campaign.nextBatch(2);
        campaign.recordOutcomes(DAY_ONE, List.of(
                RecipientRecord.sent(first.get(0), "id-0", NOW),
                RecipientRecord.failed(first.get(1), "Invalid email data.", NOW)), NOW);

        assertThat(campaign.nextBatch(10)).extracting(Contact::email)
                .containsExactly("user2@example.com", "user3@example.com", "user4@example.com");
        assertThat(campaign.nextBatch(0)).isEmpty();
    }

    @Test
    @DisplayName("Recording outcomes updates counts and the day's log")
    void recordOutcomesUpdatesCounts() {
        CampaignState campaign = campaign(4);
        List<Contact> batch = campaign.nextBatch(3);

        int applied = campaign.recordOutcomes(DAY_ONE, List.of(
                RecipientRecord.sent(batch.get(0), "id-0", NOW),
                RecipientRecord.failed(batch.get(1), "bounced", NOW),
                RecipientRecord.skipped(batch.get(2), "skip-listed", NOW)), NOW);

        assertThat(applied).isEqualTo(3);
        assertThat(campaign.getSentEmails()).isEqualTo(1);
        assertThat(campaign.getFailedEmails()).isEqualTo(2);
        assertThat(campaign.getRemainingEmails()).isEqualTo(1);
        assertThat(campaign.attemptedOn(DAY_ONE)).isEqualTo(2);
        assertThat(campaign.sentOn(DAY_ONE)).isEqualTo(1);
        assertThat(campaign.getDailyLogs()).hasSize(1);
        assertThat(campaign.getLastProcessedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("A recipient is never recorded twice, even with a different case")
    void duplicatesIgnored() {
        CampaignState campaign = campaign(2);
        Contact contact = campaign.getContacts().get(0);
        campaign.recordOutcomes(DAY_ONE, List.of(RecipientRecord.sent(contact, "id-0", NOW)), NOW);

        int applied = campaign.recordOutcomes(DAY_ONE.plusDays(1), List.of(
                RecipientRecord.sent(new Contact("USER0@example.com", "Company 0"), "id-1", NOW)), NOW);

        assertThat(applied).isZero();
        assertThat(campaign.getSentEmails()).isEqualTo(1);
    }

    @Test
    @DisplayName("Each day gets its own log and earlier days cannot be appended to")
    void dailyLogsPerDay() {
        CampaignState campaign = campaign(3);
        List<Contact> contacts = campaign.getContacts();
        campaign.recordOutcomes(DAY_ONE, List.of(RecipientRecord.sent(contacts.get(0), "a", NOW)), NOW);
        campaign.recordOutcomes(DAY_ONE.plusDays(1), List.of(RecipientRecord.sent(contacts.get(1), "b", NOW)), NOW);

        assertThat(campaign.getDailyLogs()).extracting(DailyLog::getDate).containsExactly(DAY_ONE, DAY_ONE.plusDays(1));
        assertThat(campaign.sentOn(DAY_ONE)).isEqualTo(1);
        assertThatThrownBy(() -> campaign.recordOutcomes(DAY_ONE,
                List.of(RecipientRecord.sent(contacts.get(2), "c", NOW)), NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Completion happens once and stamps the completion time")
    void completionHappensOnce() {
        CampaignState campaign = campaign(1);
        campaign.recordOutcomes(DAY_ONE, List.of(RecipientRecord.sent(campaign.getContacts().get(0), "a", NOW)), NOW);

        Instant later = NOW.plusSeconds(60);
        assertThat(campaign.completeIfFullyProcessed(NOW)).isTrue();
        assertThat(campaign.completeIfFullyProcessed(later)).isFalse();
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.COMPLETED);
        assertThat(campaign.getCompletedAt()).isEqualTo(NOW);
        assertThat(campaign.nextBatch(5)).isEmpty();
    }

    @Test
    @DisplayName("Paused campaigns are not completed automatically")
    void pausedNotCompleted() {
        CampaignState campaign = campaign(1);
        campaign.recordOutcomes(DAY_ONE, List.of(RecipientRecord.sent(campaign.getContacts().get(0), "a", NOW)), NOW);
        campaign.transitionTo(CampaignStatus.PAUSED, NOW);

        assertThat(campaign.completeIfFullyProcessed(NOW)).isFalse();
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.PAUSED);
    }

    @Test
    @DisplayName("Counts above the total are rejected at construction")
    void countsCannotExceedTotal() {
        assertThatThrownBy(() -> CampaignState.builder()
                .id("c-2")
                .contacts(contacts(2))
                .sentEmails(2)
                .failedEmails(1)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Copies are independent of the original")
    void copyIsIndependent() {
        CampaignState campaign = campaign(2);
        CampaignState copy = campaign.copy();

        copy.recordOutcomes(DAY_ONE, List.of(RecipientRecord.sent(copy.getContacts().get(0), "a", NOW)), NOW);

        assertThat(campaign.getSentEmails()).isZero();
        assertThat(campaign.getDailyLogs()).isEmpty();
        assertThat(copy.getSentEmails()).isEqualTo(1);
    }
}
