package com.cateringhub.backend.modules.notification.application;

import java.time.OffsetDateTime;

/**
 * Content of an invitation notice. {@code acceptUrl} embeds the raw token and is left out of
 * {@link #toString()}.
 */
public record InvitationMessage(
        String recipientEmail,
        String providerName,
        String roleCode,
        String inviterName,
        String acceptUrl,
        OffsetDateTime expiresAt
) {

    @Override
    public String toString() {
        return "InvitationMessage[recipientEmail=" + recipientEmail + ", providerName=" + providerName
                + ", roleCode=" + roleCode + ", inviterName=" + inviterName + ", expiresAt=" + expiresAt + "]";
    }
}
