package com.cateringhub.backend.modules.invitation.application;

import java.time.OffsetDateTime;

import com.cateringhub.backend.modules.invitation.domain.ProviderInvitation;

/**
 * A stored invitation plus the raw token that was just generated for it. The token only lives
 * in memory until the notice is sent.
 *
 * @param previousExpiresAt expiry before a reissue, {@code null} for a new invitation
 */
public record IssuedInvitation(
        ProviderInvitation invitation,
        String rawToken,
        OffsetDateTime previousExpiresAt
) {

    @Override
    public String toString() {
        return "IssuedInvitation[invitationId=" + invitation.getId() + ", expiresAt=" + invitation.getExpiresAt() + "]";
    }
}
