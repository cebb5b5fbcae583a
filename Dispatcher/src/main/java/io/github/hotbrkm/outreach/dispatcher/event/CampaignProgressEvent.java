package io.github.hotbrkm.outreach.dispatcher.event;

import java.time.Instant;

public record CampaignProgressEvent(String campaignId, Instant timestamp, int sent, int total, int successCount,
                                    int failureCount) implements DispatchEvent {

    @Override
    public String type() {
        return "campaign-progress";
    }
}
