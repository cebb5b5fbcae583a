package io.github.hotbrkm.outreach.dispatcher.event;

import java.time.Instant;

public record EmailSentEvent(String campaignId, Instant timestamp, String recipient, String companyName,
                             String providerMessageId) implements DispatchEvent {

    @Override
    public String type() {
        return "email-sent";
    }
}
