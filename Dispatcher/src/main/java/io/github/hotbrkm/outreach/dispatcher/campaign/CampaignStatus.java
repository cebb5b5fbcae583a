package io.github.hotbrkm.outreach.dispatcher.campaign;

import java.util.EnumSet;
import java.util.Set;

/**
 * Campaign lifecycle.
 * <pre>
 * ACTIVE -> COMPLETED          (automatic, terminal)
 * ACTIVE <-> PAUSED            (explicit)
 * ACTIVE | PAUSED -> DELETED   (explicit, terminal, record retained)
 * </pre>
 */
public enum CampaignStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    DELETED;

    public Set<CampaignStatus> allowedTargets() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(PAUSED, COMPLETED, DELETED);
            case PAUSED -> EnumSet.of(ACTIVE, DELETED);
            case COMPLETED, DELETED -> EnumSet.noneOf(CampaignStatus.class);
        };
    }

    public boolean canTransitionTo(CampaignStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DELETED;
    }

    /**
     * Validates a transition and returns the target.
     *
     * @throws IllegalStatusTransitionException when the transition is not part of the lifecycle
     */
    public CampaignStatus transitionTo(CampaignStatus target, String campaignId) {
        if (!canTransitionTo(target)) {
            throw new IllegalStatusTransitionException(campaignId, this, target);
        }
        return target;
    }
}
