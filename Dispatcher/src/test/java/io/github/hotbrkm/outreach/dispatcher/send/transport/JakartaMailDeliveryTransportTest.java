package io.github.hotbrkm.outreach.dispatcher.send.transport;

import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import jakarta.mail.Message;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JakartaMailDeliveryTransport test")
class JakartaMailDeliveryTransportTest {

    @TempDir
    Path tempDir;

    private JakartaMailDeliveryTransport newTransport() {
        DispatcherProperties.Mail mail = new DispatcherProperties.Mail();
        mail.setHost("localhost");
        mail.setPort(2525);
        mail.setUsername("sender@example.com");
        mail.setPassword("secret");
        mail.setFrom("Outreach Team <team@example.com>");
        return new JakartaMailDeliveryTransport(mail);
    }

    @Test
    @DisplayName("Message carries sender, recipient, subject, html body and existing attachments")
    void buildsMimeMessage() throws Exception {
        Path brochure = Files.writeString(tempDir.resolve("brochure.txt"), "brochure");
        OutreachMessage message = new OutreachMessage("c-1", "ceo@acme.io", "Acme", "Hello Acme", "<p>Hi</p>",
                List.of(brochure.toString(), tempDir.resolve("missing.pdf").toString()));

        MimeMessage mime = newTransport().buildMessage(message);

        assertThat(mime.getFrom()[0].toString()).contains("team@example.com");
        assertThat(mime.getRecipients(Message.RecipientType.TO)[0].toString()).isEqualTo("ceo@acme.io");
        assertThat(mime.getSubject()).isEqualTo("Hello Acme");
        MimeMultipart content = (MimeMultipart) mime.getContent();
        assertThat(content.getCount()).isEqualTo(2);
        assertThat(content.getBodyPart(0).getContentType()).startsWith("text/html");
        assertThat(content.getBodyPart(1).getFileName()).isEqualTo("brochure.txt");
    }

    @Test
    @DisplayName("A malformed recipient is returned as a failed receipt instead of an exception")
    void malformedRecipient() {
        OutreachMessage message = new OutreachMessage("c-1", "not an address@@", "", "s", "b", List.of());

        DeliveryReceipt receipt = newTransport().send(message);

        assertThat(receipt.success()).isFalse();
        assertThat(receipt.cause()).isNotNull();
    }
}
