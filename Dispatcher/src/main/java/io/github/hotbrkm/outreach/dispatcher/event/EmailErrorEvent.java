package io.github.hotbrkm.outreach.dispatcher.event;

import java.time.Instant;

/**
 * A recipient could not be reached. {@code errorMessage} is safe to display.
 */
public record EmailErrorEvent(String campaignId, Instant timestamp, String recipient, String companyName,
                              String errorMessage) implements DispatchEvent {

    @Override
    public String type() {
        return "email-error";
    }
}
