package com.cateringhub.backend.modules.membership.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.cateringhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Membership of a user in a provider. Rows are never deleted; leaving a team moves the
 * status to {@link MemberStatus#REMOVED}.
 */
@Entity
@Table(name = "provider_member")
public class ProviderMember extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private MemberRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MemberStatus status;

    @Column(name = "invited_by")
    private UUID invitedBy;

    @Column(name = "invited_at")
    private OffsetDateTime invitedAt;

    @Column(name = "joined_at")
    private OffsetDateTime joinedAt;

    protected ProviderMember() {
    }

    public ProviderMember(UUID providerId, UUID userId, MemberRole role, MemberStatus status) {
        this.providerId = providerId;
        this.userId = userId;
        this.role = role;
        this.status = status;
    }

    /**
     * Brings a pending or removed membership back to active with the role carried by an invitation.
     */
    public void activate(MemberRole invitedRole, UUID inviter, OffsetDateTime invitedOn, OffsetDateTime now) {
        this.role = invitedRole;
        this.status = MemberStatus.ACTIVE;
        this.invitedBy = inviter;
        this.invitedAt = invitedOn;
        this.joinedAt = now;
    }

    public boolean isActive() {
        return status == MemberStatus.ACTIVE;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProviderId() {
        return providerId;
    }

    public UUID getUserId() {
        return userId;
    }

    public MemberRole getRole() {
        return role;
    }

    public void setRole(MemberRole role) {
        this.role = role;
    }

    public MemberStatus getStatus() {
        return status;
    }

    public void setStatus(MemberStatus status) {
        this.status = status;
    }

    public UUID getInvitedBy() {
        return invitedBy;
    }

    public void setInvitedBy(UUID invitedBy) {
        this.invitedBy = invitedBy;
    }

    public OffsetDateTime getInvitedAt() {
        return invitedAt;
    }

    public void setInvitedAt(OffsetDateTime invitedAt) {
        this.invitedAt = invitedAt;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(OffsetDateTime joinedAt) {
        this.joinedAt = joinedAt;
    }
}
