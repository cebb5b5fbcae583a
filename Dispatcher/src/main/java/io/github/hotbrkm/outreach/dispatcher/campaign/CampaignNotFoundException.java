package io.github.hotbrkm.outreach.dispatcher.campaign;

import lombok.Getter;

@Getter
public class CampaignNotFoundException extends RuntimeException {

    private final String campaignId;

    public CampaignNotFoundException(String campaignId) {
        super("Campaign not found: " + campaignId);
        this.campaignId = campaignId;
    }
}
