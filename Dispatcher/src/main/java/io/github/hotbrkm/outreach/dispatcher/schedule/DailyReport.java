package io.github.hotbrkm.outreach.dispatcher.schedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Cross-campaign summary handed to notification gateways when the active window opens and closes.
 */
public record DailyReport(LocalDate date, Kind kind, int totalCampaigns, int activeCampaigns, int pausedCampaigns,
                          int completedCampaigns, long totalSent, long totalFailed, long totalPending, int sentToday,
                          int dailyLimit, int remainingToday, List<CampaignActivity> campaignActivity) {

    public enum Kind {
        OPEN,
        CLOSE
    }

    public DailyReport {
        campaignActivity = campaignActivity == null ? List.of() : List.copyOf(campaignActivity);
    }

    /**
     * Today's numbers for one active campaign.
     */
    public record CampaignActivity(String campaignId, String name, int sentToday, int failedToday, int sentEmails,
                                   int failedEmails, int totalEmails) {

        public int remaining() {
            return Math.max(0, totalEmails - sentEmails - failedEmails);
        }
    }
}
