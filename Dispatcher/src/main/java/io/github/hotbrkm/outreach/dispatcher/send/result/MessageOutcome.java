package io.github.hotbrkm.outreach.dispatcher.send.result;

import io.github.hotbrkm.outreach.dispatcher.send.transport.ErrorCategory;
import io.github.hotbrkm.outreach.dispatcher.send.transport.OutreachMessage;

/**
 * Final result for one message in a dispatch run. {@code errorMessage} is already sanitized.
 */
public record MessageOutcome(OutreachMessage message, MessageStatus status, ErrorCategory errorCategory,
                             String errorMessage, String providerMessageId, int attempts) {

    public static MessageOutcome sent(OutreachMessage message, String providerMessageId, int attempts) {
        return new MessageOutcome(message, MessageStatus.SENT, null, null, providerMessageId, attempts);
    }

    public static MessageOutcome failed(OutreachMessage message, ErrorCategory category, String errorMessage, int attempts) {
        return new MessageOutcome(message, MessageStatus.FAILED, category, errorMessage, null, attempts);
    }

    public static MessageOutcome skipped(OutreachMessage message) {
        return new MessageOutcome(message, MessageStatus.SKIPPED, null, "Recipient skip-listed after repeated failures", null, 0);
    }

    public static MessageOutcome deferred(OutreachMessage message, String reason) {
        return new MessageOutcome(message, MessageStatus.DEFERRED, null, reason, null, 0);
    }

    public String recipient() {
        return message.to();
    }

    public boolean isSent() {
        return status == MessageStatus.SENT;
    }
}
