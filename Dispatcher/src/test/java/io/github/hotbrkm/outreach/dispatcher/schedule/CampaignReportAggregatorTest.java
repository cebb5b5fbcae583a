package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignStatus;
import io.github.hotbrkm.outreach.dispatcher.campaign.Contact;
import io.github.hotbrkm.outreach.dispatcher.campaign.RecipientRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CampaignReportAggregator test")
class CampaignReportAggregatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private static CampaignState campaign(String id, CampaignStatus status, int contacts, int sentToday) {
        List<Contact> list = new ArrayList<>();
        for (int i = 0; i < contacts; i++) {
            list.add(new Contact(id + i + "@example.com", "Company"));
        }
        CampaignState campaign = CampaignState.builder().id(id).name("Campaign " + id).contacts(list).build();
        List<RecipientRecord> records = new ArrayList<>();
        for (int i = 0; i < sentToday; i++) {
            records.add(RecipientRecord.sent(list.get(i), "m", NOW));
        }
        campaign.recordOutcomes(TODAY, records, NOW);
        if (status != CampaignStatus.ACTIVE) {
            campaign.transitionTo(status, NOW);
        }
        return campaign;
    }

    @Test
    @DisplayName("Report counts campaigns by status and lists today's activity of active ones")
    void aggregate() {
        List<CampaignState> campaigns = List.of(
                campaign("a", CampaignStatus.ACTIVE, 10, 4),
                campaign("p", CampaignStatus.PAUSED, 5, 1),
                campaign("c", CampaignStatus.COMPLETED, 3, 3),
                campaign("d", CampaignStatus.DELETED, 7, 2));

        DailyReport report = new CampaignReportAggregator().aggregate(DailyReport.Kind.CLOSE, TODAY, campaigns, 10, 300);

        assertThat(report.kind()).isEqualTo(DailyReport.Kind.CLOSE);
        assertThat(report.totalCampaigns()).isEqualTo(3);
        assertThat(report.activeCampaigns()).isEqualTo(1);
        assertThat(report.pausedCampaigns()).isEqualTo(1);
        assertThat(report.completedCampaigns()).isEqualTo(1);
        assertThat(report.totalSent()).isEqualTo(8);
        assertThat(report.totalPending()).isEqualTo(6 + 4);
        assertThat(report.remainingToday()).isEqualTo(290);
        assertThat(report.campaignActivity()).singleElement().satisfies(activity -> {
            assertThat(activity.campaignId()).isEqualTo("a");
            assertThat(activity.sentToday()).isEqualTo(4);
            assertThat(activity.remaining()).isEqualTo(6);
        });
    }

    @Test
    @DisplayName("An empty store yields an empty report")
    void emptyReport() {
        DailyReport report = new CampaignReportAggregator().aggregate(DailyReport.Kind.OPEN, TODAY, List.of(), 0, 300);

        assertThat(report.totalCampaigns()).isZero();
        assertThat(report.campaignActivity()).isEmpty();
        assertThat(report.remainingToday()).isEqualTo(300);
    }
}
