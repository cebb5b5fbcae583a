package io.github.hotbrkm.outreach.dispatcher.send.transport;

/**
 * Delivers a single prepared message.
 * <p>
 * Implementations report provider errors through the receipt; an exception thrown from {@link #send}
 * is classified the same way as a failed receipt.
 */
public interface DeliveryTransport {

    DeliveryReceipt send(OutreachMessage message);
}
