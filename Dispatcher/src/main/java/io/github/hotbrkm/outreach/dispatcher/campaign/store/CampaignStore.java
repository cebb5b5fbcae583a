package io.github.hotbrkm.outreach.dispatcher.campaign.store;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable campaign storage.
 * <p>
 * Writes are serialized: {@link #save} and {@link #update} never interleave. Returned instances are copies,
 * so mutating them has no effect until they are saved.
 */
public interface CampaignStore {

    /**
     * Inserts or replaces the campaign and returns the stored copy.
     */
    CampaignState save(CampaignState campaign);

    /**
     * Loads, modifies and saves a campaign as one serialized step.
     *
     * @throws io.github.hotbrkm.outreach.dispatcher.campaign.CampaignNotFoundException when no campaign has this id
     */
    CampaignState update(String campaignId, UnaryOperator<CampaignState> modifier);

    Optional<CampaignState> find(String campaignId);

    List<CampaignState> findAll();

    default List<CampaignState> findByStatus(CampaignStatus status) {
        return findAll().stream().filter(campaign -> campaign.getStatus() == status).toList();
    }

    /**
     * Drops expired read-cache entries.
     */
    default int evictExpired() {
        return 0;
    }

    default void close() {
    }
}
