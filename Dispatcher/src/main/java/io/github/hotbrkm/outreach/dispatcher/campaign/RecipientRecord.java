package io.github.hotbrkm.outreach.dispatcher.campaign;

import java.time.Instant;

/**
 * What happened to one recipient on one day. {@code error} is sanitized before it gets here.
 */
public record RecipientRecord(String email, String companyName, RecipientOutcome outcome, String providerMessageId,
                              String error, Instant processedAt) {

    public static RecipientRecord sent(Contact contact, String providerMessageId, Instant at) {
        return new RecipientRecord(contact.email(), contact.companyName(), RecipientOutcome.SENT, providerMessageId, null, at);
    }

    public static RecipientRecord failed(Contact contact, String error, Instant at) {
        return new RecipientRecord(contact.email(), contact.companyName(), RecipientOutcome.FAILED, null, error, at);
    }

    public static RecipientRecord skipped(Contact contact, String reason, Instant at) {
        return new RecipientRecord(contact.email(), contact.companyName(), RecipientOutcome.SKIPPED, null, reason, at);
    }
}
