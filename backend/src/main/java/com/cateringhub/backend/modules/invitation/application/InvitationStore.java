package com.cateringhub.backend.modules.invitation.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.modules.invitation.domain.ProviderInvitation;
import com.cateringhub.backend.modules.invitation.infrastructure.persistence.ProviderInvitationRepository;
import com.cateringhub.backend.modules.membership.application.AuthorizationGrant;
import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.membership.domain.MemberStatus;
import com.cateringhub.backend.modules.membership.domain.RoleHierarchy;
import com.cateringhub.backend.modules.membership.domain.ProviderMember;
import com.cateringhub.backend.modules.membership.infrastructure.persistence.ProviderMemberRepository;
import com.cateringhub.backend.modules.provider.infrastructure.persistence.ProviderRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistence of invitations. Every write except {@link #accept} needs an
 * {@link AuthorizationGrant} for the invitation's provider issued at the manager floor or above.
 */
@Component
public class InvitationStore {

    private static final Logger log = LoggerFactory.getLogger(InvitationStore.class);

    private static final String PENDING_EMAIL_CONSTRAINT = "uq_provider_invitation_pending_email";

    private final ProviderInvitationRepository invitationRepository;
    private final ProviderMemberRepository providerMemberRepository;
    private final ProviderRepository providerRepository;
    private final InvitationTokenGenerator tokenGenerator;
    private final InvitationProperties properties;
    private final RoleHierarchy roleHierarchy;

    public InvitationStore(
            ProviderInvitationRepository invitationRepository,
            ProviderMemberRepository providerMemberRepository,
            ProviderRepository providerRepository,
            InvitationTokenGenerator tokenGenerator,
            InvitationProperties properties,
            RoleHierarchy roleHierarchy
    ) {
        this.invitationRepository = invitationRepository;
        this.providerMemberRepository = providerMemberRepository;
        this.providerRepository = providerRepository;
        this.tokenGenerator = tokenGenerator;
        this.properties = properties;
        this.roleHierarchy = roleHierarchy;
    }

    @Transactional(readOnly = true)
    public Optional<ProviderInvitation> findActive(UUID providerId, String email, OffsetDateTime now) {
        return findPending(providerId, email).filter(invitation -> !invitation.isExpiredAt(now));
    }

    @Transactional(readOnly = true)
    public Optional<ProviderInvitation> findPending(UUID providerId, String email) {
        return invitationRepository.findPending(providerId, normalizeEmail(email));
    }

    @Transactional(readOnly = true)
    public List<ProviderInvitation> listPending(AuthorizationGrant grant) {
        return invitationRepository.findAllPending(grant.providerId());
    }

    /**
     * Takes the provider row lock that serializes invitation creation for one provider.
     * Must run inside the caller's transaction.
     */
    @Transactional
    public void lockProvider(AuthorizationGrant grant) {
        providerRepository.findByIdForUpdate(grant.providerId())
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "PROVIDER_NOT_FOUND",
                        "Provider not found"));
    }

    @Transactional
    public IssuedInvitation create(AuthorizationGrant grant, String email, MemberRole role, OffsetDateTime now) {
        grant.requireFloor(MemberRole.MANAGER, roleHierarchy);
        if (role == MemberRole.OWNER) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "OWNER_INVITATION_NOT_ALLOWED",
                    "The owner role cannot be granted by invitation");
        }
        String normalized = normalizeEmail(email);
        if (findActive(grant.providerId(), normalized, now).isPresent()) {
            throw alreadyPending();
        }
        String rawToken = tokenGenerator.newToken();
        ProviderInvitation invitation = new ProviderInvitation(
                grant.providerId(),
                normalized,
                role,
                tokenGenerator.hash(rawToken),
                grant.actorId(),
                now.plus(properties.ttl())
        );
        try {
            ProviderInvitation saved = invitationRepository.saveAndFlush(invitation);
            return new IssuedInvitation(saved, rawToken, null);
        } catch (DataIntegrityViolationException ex) {
            if (isPendingEmailViolation(ex)) {
                throw alreadyPending();
            }
            throw ex;
        }
    }

    /**
     * Deletes an expired, unaccepted invitation so a new one can take its place.
     */
    @Transactional
    public void supersede(AuthorizationGrant grant, UUID invitationId, OffsetDateTime now) {
        ProviderInvitation invitation = loadForUpdate(grant, invitationId);
        if (invitation.isAccepted()) {
            throw alreadyAccepted();
        }
        if (!invitation.isExpiredAt(now)) {
            throw alreadyPending();
        }
        invitationRepository.delete(invitation);
        // deletes are flushed after inserts, so push this one out before the replacement row
        invitationRepository.flush();
        log.info("Superseded expired invitation {} of provider {}", invitationId, grant.providerId());
    }

    @Transactional
    public ProviderInvitation revoke(AuthorizationGrant grant, UUID invitationId) {
        ProviderInvitation invitation = loadForUpdate(grant, invitationId);
        if (invitation.isAccepted()) {
            throw alreadyAccepted();
        }
        invitationRepository.delete(invitation);
        invitationRepository.flush();
        return invitation;
    }

    @Transactional
    public IssuedInvitation reissue(AuthorizationGrant grant, UUID invitationId, OffsetDateTime now) {
        ProviderInvitation invitation = loadForUpdate(grant, invitationId);
        if (invitation.isAccepted()) {
            throw alreadyAccepted();
        }
        OffsetDateTime previousExpiresAt = invitation.getExpiresAt();
        String rawToken = tokenGenerator.newToken();
        invitation.reissue(tokenGenerator.hash(rawToken), now.plus(properties.ttl()));
        ProviderInvitation saved = invitationRepository.saveAndFlush(invitation);
        return new IssuedInvitation(saved, rawToken, previousExpiresAt);
    }

    /**
     * Consumes an invitation and creates or reactivates the membership it grants. The invitation
     * row stays locked until commit, so concurrent accepts of one token are serialized.
     * <p>
     * An invitee who is already an active member gets {@code ALREADY_MEMBER}, and the invitation
     * is still marked accepted.
     */
    @Transactional(noRollbackFor = ProblemException.class)
    public AcceptedInvitation accept(String rawToken, UUID userId, String email, OffsetDateTime now) {
        ProviderInvitation invitation = invitationRepository.findByTokenHashForUpdate(tokenGenerator.hash(rawToken))
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "INVITATION_NOT_FOUND",
                        "Invitation not found"));
        if (invitation.isAccepted()) {
            throw alreadyAccepted();
        }
        if (invitation.isExpiredAt(now)) {
            throw new ProblemException(ErrorKind.EXPIRED, "INVITATION_EXPIRED", "Invitation has expired");
        }
        if (email == null || !invitation.getEmail().equals(normalizeEmail(email))) {
            log.info("Rejected acceptance of invitation {} by user {}: email mismatch", invitation.getId(), userId);
            throw new ProblemException(ErrorKind.FORBIDDEN, "INVITATION_EMAIL_MISMATCH",
                    "This invitation was sent to a different email address");
        }

        ProviderMember membership = providerMemberRepository
                .findByProviderIdAndUserId(invitation.getProviderId(), userId)
                .orElse(null);
        if (membership != null) {
            switch (membership.getStatus()) {
                case ACTIVE -> {
                    invitation.markAccepted(userId, now);
                    invitationRepository.save(invitation);
                    throw new ProblemException(ErrorKind.CONFLICT, "ALREADY_MEMBER",
                            "You are already a member of this provider");
                }
                case SUSPENDED -> throw new ProblemException(ErrorKind.FORBIDDEN, "MEMBERSHIP_SUSPENDED",
                        "Your membership in this provider is suspended");
                case PENDING, REMOVED -> membership.activate(invitation.getRole(), invitation.getInvitedBy(),
                        invitation.getCreatedAt(), now);
                default -> throw new IllegalStateException("Unhandled member status " + membership.getStatus());
            }
        } else {
            membership = new ProviderMember(invitation.getProviderId(), userId, invitation.getRole(), MemberStatus.ACTIVE);
            membership.setInvitedBy(invitation.getInvitedBy());
            membership.setInvitedAt(invitation.getCreatedAt());
            membership.setJoinedAt(now);
        }

        invitation.markAccepted(userId, now);
        ProviderMember savedMembership = providerMemberRepository.save(membership);
        ProviderInvitation savedInvitation = invitationRepository.save(invitation);
        return new AcceptedInvitation(savedInvitation, savedMembership);
    }

    private ProviderInvitation loadForUpdate(AuthorizationGrant grant, UUID invitationId) {
        grant.requireFloor(MemberRole.MANAGER, roleHierarchy);
        ProviderInvitation invitation = invitationRepository.findByIdAndProviderIdForUpdate(invitationId, grant.providerId())
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "INVITATION_NOT_FOUND",
                        "Invitation not found"));
        grant.requireProvider(invitation.getProviderId());
        return invitation;
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static ProblemException alreadyPending() {
        return new ProblemException(ErrorKind.CONFLICT, "INVITATION_ALREADY_PENDING",
                "An invitation for this email is already pending");
    }

    private static ProblemException alreadyAccepted() {
        return new ProblemException(ErrorKind.ALREADY_ACCEPTED, "INVITATION_ALREADY_ACCEPTED",
                "Invitation has already been accepted");
    }

    private static boolean isPendingEmailViolation(DataIntegrityViolationException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause != null ? cause.getMessage() : null;
        return message != null && message.contains(PENDING_EMAIL_CONSTRAINT);
    }
}
