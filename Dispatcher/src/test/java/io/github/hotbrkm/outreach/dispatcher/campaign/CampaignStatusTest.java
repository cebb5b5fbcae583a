package io.github.hotbrkm.outreach.dispatcher.campaign;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CampaignStatus test")
class CampaignStatusTest {

    @Test
    @DisplayName("Active campaigns can pause, complete or be deleted")
    void activeTransitions() {
        assertThat(CampaignStatus.ACTIVE.allowedTargets())
                .containsExactlyInAnyOrder(CampaignStatus.PAUSED, CampaignStatus.COMPLETED, CampaignStatus.DELETED);
    }

    @Test
    @DisplayName("Paused campaigns can resume or be deleted but never complete")
    void pausedTransitions() {
        assertThat(CampaignStatus.PAUSED.canTransitionTo(CampaignStatus.ACTIVE)).isTrue();
        assertThat(CampaignStatus.PAUSED.canTransitionTo(CampaignStatus.DELETED)).isTrue();
        assertThat(CampaignStatus.PAUSED.canTransitionTo(CampaignStatus.COMPLETED)).isFalse();
    }

    @Test
    @DisplayName("Terminal states reject every transition")
    void terminalStates() {
        assertThat(CampaignStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(CampaignStatus.DELETED.isTerminal()).isTrue();
        assertThat(CampaignStatus.COMPLETED.allowedTargets()).isEmpty();

        assertThatThrownBy(() -> CampaignStatus.DELETED.transitionTo(CampaignStatus.ACTIVE, "c-9"))
                .isInstanceOf(IllegalStatusTransitionException.class)
                .hasMessageContaining("c-9")
                .hasMessageContaining("DELETED");
    }

    @Test
    @DisplayName("A null target is never allowed")
    void nullTarget() {
        assertThat(CampaignStatus.ACTIVE.canTransitionTo(null)).isFalse();
    }
}
