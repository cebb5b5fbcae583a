package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignStatus;
import io.github.hotbrkm.outreach.dispatcher.campaign.DailyLog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class CampaignReportAggregator {

    public DailyReport aggregate(DailyReport.Kind kind, LocalDate date, List<CampaignState> campaigns, int sentToday,
                                 int dailyLimit) {
        int active = 0;
        int paused = 0;
        int completed = 0;
        int total = 0;
        long sent = 0;
        long failed = 0;
        long pending = 0;
        List<DailyReport.CampaignActivity> activity = new ArrayList<>();

        for (CampaignState campaign : campaigns) {
            if (campaign.getStatus() == CampaignStatus.DELETED) {
                continue;
            }
            total++;
            sent += campaign.getSentEmails();
            failed += campaign.getFailedEmails();
            switch (campaign.getStatus()) {
                case ACTIVE -> {
                    active++;
                    pending += campaign.getRemainingEmails();
                    activity.add(activityOf(campaign, date));
                }
                case PAUSED -> {
                    paused++;
                    pending += campaign.getRemainingEmails();
                }
                case COMPLETED -> completed++;
                default -> {
                }
            }
        }

        return new DailyReport(date, kind, total, active, paused, completed, sent, failed, pending, sentToday,
                dailyLimit, Math.max(0, dailyLimit - sentToday), activity);
    }

    private static DailyReport.CampaignActivity activityOf(CampaignState campaign, LocalDate date) {
        int sentToday = 0;
        int failedToday = 0;
        for (DailyLog log : campaign.getDailyLogs()) {
            if (log.getDate().equals(date)) {
                sentToday = log.getTotalSent();
                failedToday = log.getTotalFailed();
            }
        }
        return new DailyReport.CampaignActivity(campaign.getId(), campaign.getName(), sentToday, failedToday,
                campaign.getSentEmails(), campaign.getFailedEmails(), campaign.getTotalEmails());
    }
}
