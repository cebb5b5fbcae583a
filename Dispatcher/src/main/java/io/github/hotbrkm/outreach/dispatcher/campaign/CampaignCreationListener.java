package io.github.hotbrkm.outreach.dispatcher.campaign;

@FunctionalInterface
public interface CampaignCreationListener {

    CampaignCreationListener NOOP = campaignId -> {
    };

    void onCreated(String campaignId);
}
