package io.github.hotbrkm.outreach.dispatcher.event;

import java.time.Instant;

public record CampaignCompleteEvent(String campaignId, Instant timestamp, int totalEmailsSent, long durationDays)
        implements DispatchEvent {

    @Override
    public String type() {
        return "campaign-complete";
    }
}
