package io.github.hotbrkm.outreach.dispatcher.campaign.store;

/**
 * Thrown when a campaign snapshot cannot be read or written.
 */
public class CampaignStoreException extends RuntimeException {

    public CampaignStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
