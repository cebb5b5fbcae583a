package io.github.hotbrkm.outreach.dispatcher.send.transport;

import io.github.hotbrkm.outreach.dispatcher.domain.EmailAddressUtil;

import java.util.List;
import java.util.Objects;

/**
 * Fully rendered message ready for delivery.
 *
 * @param campaignId  owning campaign
 * @param to          recipient address
 * @param companyName recipient company, used for display and events
 * @param subject     rendered subject
 * @param body        rendered HTML body
 * @param attachments file paths attached as-is
 */
public record OutreachMessage(String campaignId, String to, String companyName, String subject, String body,
                             List<String> attachments) {

    public OutreachMessage {
        Objects.requireNonNull(to, "to must not be null");
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public String destinationDomain() {
        return EmailAddressUtil.extractDomain(to);
    }
}
