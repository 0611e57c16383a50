package com.cateringhub.backend.modules.invitation.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.cateringhub.backend.modules.invitation.domain.ProviderInvitation;

public record InvitationView(
        UUID id,
        UUID providerId,
        String email,
        String role,
        UUID invitedBy,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        OffsetDateTime acceptedAt
) {

    public static InvitationView from(ProviderInvitation invitation, OffsetDateTime now) {
        String status;
        if (invitation.isAccepted()) {
            status = "accepted";
        } else if (invitation.isExpiredAt(now)) {
            status = "expired";
        } else {
            status = "pending";
        }
        return new InvitationView(
                invitation.getId(),
                invitation.getProviderId(),
                invitation.getEmail(),
                invitation.getRole().code(),
                invitation.getInvitedBy(),
                status,
                invitation.getCreatedAt(),
                invitation.getExpiresAt(),
                invitation.getAcceptedAt()
        );
    }
}
