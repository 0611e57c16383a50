package com.cateringhub.backend.modules.membership.application;

import java.util.Objects;
import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.membership.domain.RoleHierarchy;

/**
 * Proof that an actor passed the membership and role check for one provider.
 * <p>
 * Only {@link MembershipAuthorizer} can create instances. Privileged writes take a grant and
 * call {@link #requireProvider(UUID)} before touching rows of that provider, and
 * {@link #requireFloor(MemberRole, RoleHierarchy)} when the write needs more than the gate that
 * issued the grant may have checked.
 */
public final class AuthorizationGrant {

    private final UUID providerId;
    private final UUID actorId;
    private final UUID membershipId;
    private final MemberRole actorRole;
    private final MemberRole requiredFloor;

    AuthorizationGrant(UUID providerId, UUID actorId, UUID membershipId, MemberRole actorRole,
                       MemberRole requiredFloor) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.membershipId = membershipId;
        this.actorRole = Objects.requireNonNull(actorRole, "actorRole");
        this.requiredFloor = Objects.requireNonNull(requiredFloor, "requiredFloor");
    }

    public UUID providerId() {
        return providerId;
    }

    public UUID actorId() {
        return actorId;
    }

    public UUID membershipId() {
        return membershipId;
    }

    public MemberRole actorRole() {
        return actorRole;
    }

    public MemberRole requiredFloor() {
        return requiredFloor;
    }

    /**
     * @throws IllegalStateException when the grant was issued for another provider
     */
    public void requireProvider(UUID targetProviderId) {
        if (!providerId.equals(targetProviderId)) {
            throw new IllegalStateException("Authorization grant for provider " + providerId
                    + " used against provider " + targetProviderId);
        }
    }

    /**
     * Both the actor's role and the floor this grant was issued at must reach {@code floor}.
     *
     * @throws ProblemException {@link ErrorKind#FORBIDDEN} with {@code INSUFFICIENT_ROLE}
     */
    public void requireFloor(MemberRole floor, RoleHierarchy roleHierarchy) {
        if (!roleHierarchy.permits(actorRole, floor) || !roleHierarchy.permits(requiredFloor, floor)) {
            throw new ProblemException(ErrorKind.FORBIDDEN, "INSUFFICIENT_ROLE",
                    "This action requires the " + floor.code() + " role or higher");
        }
    }

    @Override
    public String toString() {
        return "AuthorizationGrant[providerId=" + providerId + ", actorId=" + actorId
                + ", actorRole=" + actorRole + ", requiredFloor=" + requiredFloor + "]";
    }
}
