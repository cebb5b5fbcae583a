package io.github.hotbrkm.outreach.dispatcher.send.transport;

import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Objects;
import java.util.Properties;

/**
 * SMTP delivery through Jakarta Mail using a single authenticated relay account.
 * <p>
 * Never throws: every failure is returned as a failed {@link DeliveryReceipt} carrying the cause.
 */
@Slf4j
public class JakartaMailDeliveryTransport implements DeliveryTransport {

    private final DispatcherProperties.Mail mail;
    private final Session session;

    public JakartaMailDeliveryTransport(DispatcherProperties.Mail mail) {
        this.mail = Objects.requireNonNull(mail, "mail must not be null");
        this.session = createSession(mail);
    }

    @Override
    public DeliveryReceipt send(OutreachMessage message) {
        try {
            MimeMessage mimeMessage = buildMessage(message);
            Transport.send(mimeMessage);
            String messageId = mimeMessage.getMessageID();
            log.debug("event=smtp_sent, to={}, messageId={}", message.to(), messageId);
            return DeliveryReceipt.success(messageId);
        } catch (MessagingException | IOException e) {
            log.debug("event=smtp_failed, to={}, error={}", message.to(), ErrorSanitizer.sanitize(e.getMessage()));
            return DeliveryReceipt.failure(e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("event=smtp_unexpected_error, to={}", message.to(), e);
            return DeliveryReceipt.failure(e.getMessage(), e);
        }
    }

    MimeMessage buildMessage(OutreachMessage message) throws MessagingException, IOException {
        MimeMessage mimeMessage = new MimeMessage(session);
        String sender = mail.getFrom() != null && !mail.getFrom().isBlank() ? mail.getFrom() : mail.getUsername();
        if (sender != null && !sender.isBlank()) {
            mimeMessage.setFrom(new InternetAddress(sender.trim()));
        }
        mimeMessage.setRecipients(Message.RecipientType.TO, InternetAddress.parse(message.to().trim(), true));
        mimeMessage.setSubject(message.subject(), StandardCharsets.UTF_8.name());
        mimeMessage.setSentDate(new Date());
        mimeMessage.setHeader("Precedence", "bulk");

        MimeMultipart mixed = new MimeMultipart("mixed");
        MimeBodyPart bodyPart = new MimeBodyPart();
        bodyPart.setText(message.body(), StandardCharsets.UTF_8.name(), "html");
        mixed.addBodyPart(bodyPart);

        for (String path : message.attachments()) {
            File file = new File(path);
            if (!file.isFile()) {
                log.warn("event=attachment_missing, campaignId={}, path={}", message.campaignId(), path);
                continue;
            }
            MimeBodyPart attachmentPart = new MimeBodyPart();
            attachmentPart.attachFile(file);
            mixed.addBodyPart(attachmentPart);
        }

        mimeMessage.setContent(mixed);
        mimeMessage.saveChanges();
        return mimeMessage;
    }

    private static Session createSession(DispatcherProperties.Mail mail) {
        Properties props = new Properties();
        if (mail.getHost() != null) {
            props.put("mail.smtp.host", mail.getHost());
        }
        props.put("mail.smtp.port", String.valueOf(mail.getPort()));
        props.put("mail.smtp.starttls.enable", String.valueOf(mail.isStartTls()));
        props.put("mail.smtp.connectiontimeout", String.valueOf(mail.getConnectionTimeoutMs()));
        props.put("mail.smtp.timeout", String.valueOf(mail.getConnectionTimeoutMs()));
        props.put("mail.smtp.writetimeout", String.valueOf(mail.getConnectionTimeoutMs()));

        boolean authenticated = mail.getUsername() != null && !mail.getUsername().isBlank();
        props.put("mail.smtp.auth", String.valueOf(authenticated));
        if (!authenticated) {
            return Session.getInstance(props);
        }
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(mail.getUsername(), mail.getPassword());
            }
        });
    }
}
