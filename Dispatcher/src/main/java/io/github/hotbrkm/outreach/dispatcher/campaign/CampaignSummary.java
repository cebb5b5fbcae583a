package io.github.hotbrkm.outreach.dispatcher.campaign;

public record CampaignSummary(int totalCampaigns, int activeCampaigns, int pausedCampaigns, int completedCampaigns,
                              long totalEmails, long sentEmails, long failedEmails) {

    public long pendingEmails() {
        return Math.max(0, totalEmails - sentEmails - failedEmails);
    }
}
