package io.github.hotbrkm.outreach.dispatcher.campaign;

import lombok.Builder;

import java.util.List;

/**
 * Input for creating a campaign. {@code dailyLimit}, {@code batchSize} and {@code delayMs} of zero mean
 * "use the configured default".
 */
@Builder
public record CampaignRequest(String name, String subject, String template, String ownerEmail, List<Contact> contacts,
                              List<String> attachments, int dailyLimit, int batchSize, long delayMs) {
}
