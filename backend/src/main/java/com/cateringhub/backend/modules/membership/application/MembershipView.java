package com.cateringhub.backend.modules.membership.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.cateringhub.backend.modules.membership.domain.ProviderMember;

public record MembershipView(
        UUID id,
        UUID providerId,
        UUID userId,
        String role,
        String status,
        UUID invitedBy,
        OffsetDateTime joinedAt
) {

    public static MembershipView from(ProviderMember member) {
        return new MembershipView(
                member.getId(),
                member.getProviderId(),
                member.getUserId(),
                member.getRole().code(),
                member.getStatus().code(),
                member.getInvitedBy(),
                member.getJoinedAt()
        );
    }
}
