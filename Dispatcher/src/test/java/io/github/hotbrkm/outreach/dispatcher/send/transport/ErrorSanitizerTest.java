package io.github.hotbrkm.outreach.dispatcher.send.transport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorSanitizer test")
class ErrorSanitizerTest {

    @Test
    @DisplayName("Credential values are redacted and the rest of the text is kept")
    void redactsCredentials() {
        String sanitized = ErrorSanitizer.sanitize("login failed user=alice, Password: hunter2; apiKey=XYZ host=smtp.example.com");

        assertThat(sanitized)
                .contains("user=***")
                .contains("Password=***")
                .contains("apiKey=***")
                .contains("host=smtp.example.com")
                .doesNotContain("alice", "hunter2", "XYZ");
    }

    @Test
    @DisplayName("Null becomes an empty string")
    void nullMessage() {
        assertThat(ErrorSanitizer.sanitize(null)).isEmpty();
    }
}
