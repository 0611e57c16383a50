package com.cateringhub.backend.modules.membership.application;

import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.membership.domain.ProviderMember;
import com.cateringhub.backend.modules.membership.domain.RoleHierarchy;
import com.cateringhub.backend.modules.membership.infrastructure.persistence.ProviderMemberRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class MembershipAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(MembershipAuthorizer.class);

    private final ProviderMemberRepository providerMemberRepository;
    private final RoleHierarchy roleHierarchy;

    public MembershipAuthorizer(ProviderMemberRepository providerMemberRepository, RoleHierarchy roleHierarchy) {
        this.providerMemberRepository = providerMemberRepository;
        this.roleHierarchy = roleHierarchy;
    }

    /**
     * Checks that {@code actorId} is an active member of {@code providerId} whose role is at least
     * {@code requiredFloor}.
     *
     * @throws ProblemException {@link ErrorKind#FORBIDDEN} with {@code NOT_ACTIVE_MEMBER} or
     *                          {@code INSUFFICIENT_ROLE}
     */
    @Transactional(readOnly = true)
    public AuthorizationGrant authorize(UUID actorId, UUID providerId, MemberRole requiredFloor) {
        ProviderMember membership = providerMemberRepository.findByProviderIdAndUserId(providerId, actorId)
                .filter(ProviderMember::isActive)
                .orElse(null);
        if (membership == null) {
            log.info("Rejected actor {} on provider {}: no active membership", actorId, providerId);
            throw new ProblemException(ErrorKind.FORBIDDEN, "NOT_ACTIVE_MEMBER",
                    "You are not an active member of this provider");
        }
        if (!roleHierarchy.permits(membership.getRole(), requiredFloor)) {
            log.info("Rejected actor {} on provider {}: role {} below {}",
                    actorId, providerId, membership.getRole().code(), requiredFloor.code());
            throw new ProblemException(ErrorKind.FORBIDDEN, "INSUFFICIENT_ROLE",
                    "This action requires the " + requiredFloor.code() + " role or higher");
        }
        return new AuthorizationGrant(providerId, actorId, membership.getId(), membership.getRole(), requiredFloor);
    }
}
