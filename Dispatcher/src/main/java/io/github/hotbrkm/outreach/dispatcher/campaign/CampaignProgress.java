package io.github.hotbrkm.outreach.dispatcher.campaign;

import java.time.Instant;

/**
 * Read-only progress view of one campaign.
 *
 * @param percentComplete        processed share of the total, 0-100 with one decimal
 * @param estimatedRemainingMillis remaining recipients times the campaign delay
 */
public record CampaignProgress(String campaignId, String name, CampaignStatus status, int totalEmails, int sentEmails,
                               int failedEmails, int remainingEmails, double percentComplete, int attemptedToday,
                               int dailyLimit, long estimatedRemainingMillis, Instant lastProcessedAt,
                               Instant completedAt) {
}
