package io.github.hotbrkm.outreach.dispatcher.campaign;

public enum RecipientOutcome {
    SENT,
    FAILED,
    SKIPPED
}
