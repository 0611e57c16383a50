package com.cateringhub.backend.modules.notification.infrastructure;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.cateringhub.backend.modules.notification.application.InvitationMessage;
import com.cateringhub.backend.modules.notification.application.InvitationNotifier;
import com.cateringhub.backend.modules.notification.application.NotificationDeliveryException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Sends invitation notices as plain-text mail through the configured SMTP server.
 */
@Component
public class MailInvitationNotifier implements InvitationNotifier {

    private static final Logger log = LoggerFactory.getLogger(MailInvitationNotifier.class);

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public MailInvitationNotifier(
            JavaMailSender mailSender,
            @Value("${cateringhub.invitations.from-address}") String fromAddress
    ) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    public void sendInvitation(InvitationMessage message) {
        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(fromAddress);
        mail.setTo(message.recipientEmail());
        mail.setSubject(message.inviterName() + " invited you to join " + message.providerName());
        mail.setText(formatBody(message));
        try {
            mailSender.send(mail);
        } catch (MailException ex) {
            throw new NotificationDeliveryException("Invitation mail could not be sent", ex);
        }
        log.info("Invitation mail sent for provider {}", message.providerName());
    }

    String formatBody(InvitationMessage message) {
        return """
                Hello,

                %s has invited you to join %s on CateringHub as %s.

                Accept the invitation here:
                %s

                This link expires on %s. If you were not expecting this invitation you can ignore this email.
                """.formatted(
                message.inviterName(),
                message.providerName(),
                message.roleCode(),
                message.acceptUrl(),
                message.expiresAt().withOffsetSameInstant(ZoneOffset.UTC).format(EXPIRY_FORMAT)
        );
    }
}
