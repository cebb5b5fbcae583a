package io.github.hotbrkm.outreach.dispatcher.send.transport;

/**
 * Outcome of one delivery attempt as reported by a {@link DeliveryTransport}.
 */
public record DeliveryReceipt(boolean success, String providerMessageId, String errorText, Throwable cause) {

    public static DeliveryReceipt success(String providerMessageId) {
        return new DeliveryReceipt(true, providerMessageId, null, null);
    }

    public static DeliveryReceipt failure(String errorText) {
        return new DeliveryReceipt(false, null, errorText, null);
    }

    public static DeliveryReceipt failure(String errorText, Throwable cause) {
        return new DeliveryReceipt(false, null, errorText, cause);
    }
}
