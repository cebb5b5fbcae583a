package io.github.hotbrkm.outreach.dispatcher.send.transport;

import jakarta.mail.AuthenticationFailedException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps delivery failures onto an {@link ErrorCategory}.
 * <p>
 * Exception types are checked first along the cause chain, then the error text is matched against keyword rules.
 */
public final class ErrorClassifier {

    private static final List<String> RATE_LIMIT_KEYWORDS = List.of("rate limit", "rate_limit");
    // a bare "auth" also matches recipient-level rejections such as "unauthorized sender domain"
    private static final List<String> AUTHENTICATION_KEYWORDS = List.of("authentication failed", "invalid credentials");
    private static final Pattern AUTHENTICATION_REPLY = Pattern.compile("^\\s*535\\b");
    private static final List<String> NETWORK_KEYWORDS =
            List.of("connection", "timeout", "timed out", "network", "econnrefused", "enotfound");
    private static final List<String> THROTTLE_KEYWORDS = List.of("too many", "quota", "429");
    private static final List<String> VALIDATION_KEYWORDS = List.of("invalid", "malformed", "recipient", "address");

    private ErrorClassifier() {}

    public static ErrorCategory classify(DeliveryReceipt receipt) {
        if (receipt == null || receipt.success()) {
            return ErrorCategory.UNKNOWN;
        }
        return classify(receipt.cause(), receipt.errorText());
    }

    public static ErrorCategory classify(Throwable error) {
        return classify(error, error == null ? null : error.getMessage());
    }

    public static ErrorCategory classify(Throwable error, String errorText) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof AuthenticationFailedException) {
                return ErrorCategory.AUTHENTICATION;
            }
            if (current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof NoRouteToHostException
                    || current instanceof UnknownHostException
                    || current instanceof TimeoutException) {
                return ErrorCategory.NETWORK;
            }
            current = current.getCause();
        }
        return classifyText(errorText);
    }

    /**
     * Keyword rules, evaluated in order: explicit rate limit, authentication, network, throttling, validation.
     * A network word wins over a throttling word, so "too many connections" is NETWORK.
     */
    public static ErrorCategory classifyText(String errorText) {
        if (errorText == null || errorText.isBlank()) {
            return ErrorCategory.UNKNOWN;
        }
        String text = errorText.toLowerCase(Locale.ROOT);
        if (containsAny(text, RATE_LIMIT_KEYWORDS)) {
            return ErrorCategory.RATE_LIMIT;
        }
        if (containsAny(text, AUTHENTICATION_KEYWORDS) || AUTHENTICATION_REPLY.matcher(text).find()) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (containsAny(text, NETWORK_KEYWORDS)) {
            return ErrorCategory.NETWORK;
        }
        if (containsAny(text, THROTTLE_KEYWORDS)) {
            return ErrorCategory.RATE_LIMIT;
        }
        if (containsAny(text, VALIDATION_KEYWORDS)) {
            return ErrorCategory.VALIDATION;
        }
        return ErrorCategory.UNKNOWN;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
