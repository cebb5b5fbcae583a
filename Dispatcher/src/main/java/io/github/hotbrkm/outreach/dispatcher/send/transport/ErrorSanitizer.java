package io.github.hotbrkm.outreach.dispatcher.send.transport;

import java.util.regex.Pattern;

/**
 * Removes credential values from error texts before they are logged or published.
 */
public final class ErrorSanitizer {

    private static final Pattern CREDENTIAL = Pattern.compile(
            "(?i)\\b(user|username|pass|password|token|apikey|api_key)\\s*[=:]\\s*[^\\s,;&]+");
    private static final String REDACTED = "$1=***";

    private ErrorSanitizer() {}

    public static String sanitize(String message) {
        if (message == null) {
            return "";
        }
        return CREDENTIAL.matcher(message).replaceAll(REDACTED);
    }
}
