package com.cateringhub.backend.modules.invitation.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.cateringhub.backend.global.jpa.AbstractTimestampedEntity;
import com.cateringhub.backend.modules.membership.domain.MemberRole;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Invitation to join a provider. Only the SHA-256 digest of the bearer token is stored.
 */
@Entity
@Table(name = "provider_invitation")
public class ProviderInvitation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "email", nullable = false, updatable = false, length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private MemberRole role;

    @Column(name = "token_hash", nullable = false, length = 64)
    private String tokenHash;

    @Column(name = "invited_by", nullable = false, updatable = false)
    private UUID invitedBy;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "accepted_at")
    private OffsetDateTime acceptedAt;

    @Column(name = "accepted_by")
    private UUID acceptedBy;

    protected ProviderInvitation() {
    }

    public ProviderInvitation(UUID providerId, String email, MemberRole role, String tokenHash, UUID invitedBy,
                              OffsetDateTime expiresAt) {
        this.providerId = providerId;
        this.email = email;
        this.role = role;
        this.tokenHash = tokenHash;
        this.invitedBy = invitedBy;
        this.expiresAt = expiresAt;
    }

    public boolean isAccepted() {
        return acceptedAt != null;
    }

    /**
     * An invitation is expired once {@code now} is past its expiry instant; the instant itself is still valid.
     */
    public boolean isExpiredAt(OffsetDateTime now) {
        return now.isAfter(expiresAt);
    }

    public boolean isActiveAt(OffsetDateTime now) {
        return !isAccepted() && !isExpiredAt(now);
    }

    public void markAccepted(UUID userId, OffsetDateTime now) {
        this.acceptedAt = now;
        this.acceptedBy = userId;
    }

    public void reissue(String newTokenHash, OffsetDateTime newExpiresAt) {
        this.tokenHash = newTokenHash;
        this.expiresAt = newExpiresAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProviderId() {
        return providerId;
    }

    public String getEmail() {
        return email;
    }

    public MemberRole getRole() {
        return role;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public UUID getInvitedBy() {
        return invitedBy;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getAcceptedAt() {
        return acceptedAt;
    }

    public UUID getAcceptedBy() {
        return acceptedBy;
    }
}
