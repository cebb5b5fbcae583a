package io.github.hotbrkm.outreach.dispatcher.campaign;

import lombok.Getter;

@Getter
public class IllegalStatusTransitionException extends RuntimeException {

    private final String campaignId;
    private final CampaignStatus from;
    private final CampaignStatus to;

    public IllegalStatusTransitionException(String campaignId, CampaignStatus from, CampaignStatus to) {
        super("Campaign " + campaignId + " cannot move from " + from + " to " + to);
        this.campaignId = campaignId;
        this.from = from;
        this.to = to;
    }
}
