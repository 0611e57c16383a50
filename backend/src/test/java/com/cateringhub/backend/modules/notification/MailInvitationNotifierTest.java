package com.cateringhub.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.time.OffsetDateTime;

import com.cateringhub.backend.modules.notification.application.InvitationMessage;
import com.cateringhub.backend.modules.notification.application.NotificationDeliveryException;
import com.cateringhub.backend.modules.notification.infrastructure.MailInvitationNotifier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class MailInvitationNotifierTest {

    @Mock
    private JavaMailSender mailSender;

    private MailInvitationNotifier notifier;

    private final InvitationMessage message = new InvitationMessage(
            "new.hire@example.com",
            "Seoul Kitchen",
            "staff",
            "Mina Manager",
            "https://app.cateringhub.test/invitations/accept?token=abc123",
            OffsetDateTime.parse("2025-03-03T19:30:00+09:00")
    );

    @BeforeEach
    void setUp() {
        notifier = new MailInvitationNotifier(mailSender, "no-reply@cateringhub.test");
    }

    @Test
    void sendsPlainTextInvitation() {
        notifier.sendInvitation(message);

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage mail = captor.getValue();
        assertThat(mail.getFrom()).isEqualTo("no-reply@cateringhub.test");
        assertThat(mail.getTo()).containsExactly("new.hire@example.com");
        assertThat(mail.getSubject()).isEqualTo("Mina Manager invited you to join Seoul Kitchen");
        assertThat(mail.getText())
                .contains("as staff")
                .contains("https://app.cateringhub.test/invitations/accept?token=abc123")
                .contains("2025-03-03 10:30 UTC");
    }

    @Test
    void wrapsMailFailures() {
        doThrow(new MailSendException("smtp unavailable")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThatThrownBy(() -> notifier.sendInvitation(message))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasCauseInstanceOf(MailSendException.class);
    }

    @Test
    void messageToStringOmitsLink() {
        assertThat(message.toString()).doesNotContain("abc123");
    }
}
