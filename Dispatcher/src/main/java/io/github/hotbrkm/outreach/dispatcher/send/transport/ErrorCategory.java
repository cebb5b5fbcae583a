package io.github.hotbrkm.outreach.dispatcher.send.transport;

/**
 * Delivery error taxonomy. Only {@link #NETWORK} and {@link #RATE_LIMIT} are retried.
 */
public enum ErrorCategory {
    AUTHENTICATION(false, "Authentication failed. Please check email credentials."),
    NETWORK(true, "Network connection failed. Please try again later."),
    RATE_LIMIT(true, "Rate limit exceeded. Please wait before sending more emails."),
    VALIDATION(false, null),
    UNKNOWN(false, "An unexpected error occurred while sending the email.");

    private final boolean retryable;
    private final String safeMessage;

    ErrorCategory(boolean retryable, String safeMessage) {
        this.retryable = retryable;
        this.safeMessage = safeMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * User-facing text for this category. Validation errors keep their (sanitized) original text.
     */
    public String safeMessage(String originalMessage) {
        if (safeMessage != null) {
            return safeMessage;
        }
        String sanitized = ErrorSanitizer.sanitize(originalMessage);
        return sanitized.isEmpty() ? "Invalid email data." : sanitized;
    }
}
