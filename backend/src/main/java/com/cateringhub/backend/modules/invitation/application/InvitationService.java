package com.cateringhub.backend.modules.invitation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.global.error.RetryableProblemException;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.audit.application.AuditLogService;
import com.cateringhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cateringhub.backend.modules.audit.domain.AuditAction;
import com.cateringhub.backend.modules.auth.domain.UserAccount;
import com.cateringhub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.cateringhub.backend.modules.invitation.domain.ProviderInvitation;
import com.cateringhub.backend.modules.membership.application.AuthorizationGrant;
import com.cateringhub.backend.modules.membership.application.MembershipAuthorizer;
import com.cateringhub.backend.modules.membership.application.MembershipView;
import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.notification.application.InvitationMessage;
import com.cateringhub.backend.modules.notification.application.InvitationNotifier;
import com.cateringhub.backend.modules.provider.infrastructure.persistence.ProviderRepository;
import com.cateringhub.backend.modules.ratelimit.application.RateLimitAction;
import com.cateringhub.backend.modules.ratelimit.application.RateLimitDecision;
import com.cateringhub.backend.modules.ratelimit.application.RateLimiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class InvitationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

    static final String FALLBACK_PROVIDER_NAME = "the team";
    static final String FALLBACK_INVITER_NAME = "A team member";

    private static final String RESOURCE_TYPE = "provider_invitation";
    private static final int EMAIL_MAX_LENGTH = 320;
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final MembershipAuthorizer membershipAuthorizer;
    private final RateLimiter rateLimiter;
    private final InvitationStore invitationStore;
    private final ProviderRepository providerRepository;
    private final UserAccountRepository userAccountRepository;
    private final InvitationNotifier invitationNotifier;
    private final AuditLogService auditLogService;
    private final InvitationProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public InvitationService(
            MembershipAuthorizer membershipAuthorizer,
            RateLimiter rateLimiter,
            InvitationStore invitationStore,
            ProviderRepository providerRepository,
            UserAccountRepository userAccountRepository,
            InvitationNotifier invitationNotifier,
            AuditLogService auditLogService,
            InvitationProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.membershipAuthorizer = membershipAuthorizer;
        this.rateLimiter = rateLimiter;
        this.invitationStore = invitationStore;
        this.providerRepository = providerRepository;
        this.userAccountRepository = userAccountRepository;
        this.invitationNotifier = invitationNotifier;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Issues an invitation and mails the acceptance link. Permission and quota are checked before
     * anything is written. The returned view carries no token material.
     */
    public InvitationView issueInvitation(IssueInvitationCommand command) {
        AuthorizationGrant grant = membershipAuthorizer.authorize(command.actorId(), command.providerId(),
                MemberRole.MANAGER);

        RateLimitDecision decision = rateLimiter.check(command.actorId().toString(), RateLimitAction.INVITE);
        if (!decision.allowed()) {
            throw rateLimited(decision, "Too many invitations sent");
        }

        MemberRole role = parseRole(command.role());
        if (role == MemberRole.OWNER) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "OWNER_INVITATION_NOT_ALLOWED",
                    "The owner role cannot be granted by invitation");
        }

        String email = validateEmail(command.email());
        ActorProfile actor = resolveActor(command.actorId(), command.actorEmail());
        if (actor.email() != null && actor.email().equalsIgnoreCase(email)) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "SELF_INVITATION_NOT_ALLOWED",
                    "You cannot invite yourself");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        IssuedInvitation issued = createInCriticalSection(grant, email, role, now);
        ProviderInvitation invitation = issued.invitation();
        log.info("Invitation {} issued for provider {} by {}", invitation.getId(), grant.providerId(), grant.actorId());

        deliver(issued, actor);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("invitationId", invitation.getId().toString());
        metadata.put("email", invitation.getEmail());
        metadata.put("role", invitation.getRole().code());
        metadata.put("expiresAt", invitation.getExpiresAt().toString());
        auditLogService.record(new AuditLogCommand(grant.providerId(), grant.actorId(), AuditAction.INVITATION_SENT,
                RESOURCE_TYPE, invitation.getId().toString(), metadata, command.origin()));

        return InvitationView.from(invitation, now);
    }

    public MembershipView acceptInvitation(AcceptInvitationCommand command) {
        if (!StringUtils.hasText(command.token())) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "TOKEN_REQUIRED", "Invitation token is required");
        }
        String email = userAccountRepository.findById(command.userId())
                .map(UserAccount::getEmail)
                .filter(StringUtils::hasText)
                .orElse(command.email());
        OffsetDateTime now = OffsetDateTime.now(clock);
        AcceptedInvitation accepted = invitationStore.accept(command.token().trim(), command.userId(), email, now);
        ProviderInvitation invitation = accepted.invitation();
        log.info("Invitation {} accepted by {}", invitation.getId(), command.userId());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("invitationId", invitation.getId().toString());
        metadata.put("email", invitation.getEmail());
        metadata.put("role", invitation.getRole().code());
        metadata.put("membershipId", accepted.membership().getId().toString());
        auditLogService.record(new AuditLogCommand(invitation.getProviderId(), command.userId(),
                AuditAction.INVITATION_ACCEPTED, RESOURCE_TYPE, invitation.getId().toString(), metadata,
                command.origin()));

        return MembershipView.from(accepted.membership());
    }

    public void revokeInvitation(UUID actorId, UUID providerId, UUID invitationId, RequestOrigin origin) {
        AuthorizationGrant grant = membershipAuthorizer.authorize(actorId, providerId, MemberRole.MANAGER);
        ProviderInvitation revoked = invitationStore.revoke(grant, invitationId);
        log.info("Invitation {} of provider {} revoked by {}", invitationId, providerId, actorId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("invitationId", invitationId.toString());
        metadata.put("email", revoked.getEmail());
        metadata.put("role", revoked.getRole().code());
        auditLogService.record(new AuditLogCommand(providerId, actorId, AuditAction.INVITATION_REVOKED,
                RESOURCE_TYPE, invitationId.toString(), metadata, origin));
    }

    /**
     * Sends a fresh link for an unaccepted invitation. The old token stops working. Needs the admin role.
     */
    public InvitationView resendInvitation(UUID actorId, UUID providerId, UUID invitationId, RequestOrigin origin) {
        AuthorizationGrant grant = membershipAuthorizer.authorize(actorId, providerId, MemberRole.ADMIN);

        RateLimitDecision decision = rateLimiter.check(invitationId.toString(), RateLimitAction.INVITE_RESEND);
        if (!decision.allowed()) {
            throw rateLimited(decision, "This invitation was resent too many times");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        IssuedInvitation issued = invitationStore.reissue(grant, invitationId, now);
        ProviderInvitation invitation = issued.invitation();
        log.info("Invitation {} of provider {} reissued by {}", invitationId, providerId, actorId);

        deliver(issued, resolveActor(actorId, null));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("invitationId", invitationId.toString());
        metadata.put("email", invitation.getEmail());
        metadata.put("previousExpiresAt", String.valueOf(issued.previousExpiresAt()));
        metadata.put("expiresAt", invitation.getExpiresAt().toString());
        auditLogService.record(new AuditLogCommand(providerId, actorId, AuditAction.INVITATION_RESENT,
                RESOURCE_TYPE, invitationId.toString(), metadata, origin));

        return InvitationView.from(invitation, now);
    }

    @Transactional(readOnly = true)
    public List<InvitationView> listPendingInvitations(UUID actorId, UUID providerId) {
        AuthorizationGrant grant = membershipAuthorizer.authorize(actorId, providerId, MemberRole.MANAGER);
        OffsetDateTime now = OffsetDateTime.now(clock);
        return invitationStore.listPending(grant).stream()
                .map(invitation -> InvitationView.from(invitation, now))
                .toList();
    }

    /**
     * Supersede-then-create under the provider row lock. A transient lock or serialization failure
     * is retried once.
     */
    private IssuedInvitation createInCriticalSection(AuthorizationGrant grant, String email, MemberRole role,
                                                     OffsetDateTime now) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return transactionTemplate.execute(status -> {
                    invitationStore.lockProvider(grant);
                    invitationStore.findPending(grant.providerId(), email).ifPresent(existing -> {
                        if (!existing.isExpiredAt(now)) {
                            throw new ProblemException(ErrorKind.CONFLICT, "INVITATION_ALREADY_PENDING",
                                    "An invitation for this email is already pending");
                        }
                        invitationStore.supersede(grant, existing.getId(), now);
                    });
                    return invitationStore.create(grant, email, role, now);
                });
            } catch (TransientDataAccessException ex) {
                if (attempt >= 2) {
                    throw new ProblemException(ErrorKind.INTERNAL_ERROR, "INVITATION_STORE_UNAVAILABLE",
                            "Invitation could not be stored, please retry", ex);
                }
                log.warn("Transient failure creating invitation for provider {}, retrying once: {}",
                        grant.providerId(), ex.getMessage());
                backoff();
            }
        }
    }

    private void backoff() {
        try {
            Thread.sleep(properties.retryBackoff().toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProblemException(ErrorKind.INTERNAL_ERROR, "INVITATION_STORE_UNAVAILABLE",
                    "Invitation could not be stored, please retry", ie);
        }
    }

    private void deliver(IssuedInvitation issued, ActorProfile actor) {
        ProviderInvitation invitation = issued.invitation();
        String providerName = providerRepository.findNameById(invitation.getProviderId())
                .filter(StringUtils::hasText)
                .orElse(FALLBACK_PROVIDER_NAME);
        String acceptUrl = UriComponentsBuilder.fromUriString(properties.acceptUrlBase())
                .queryParam("token", issued.rawToken())
                .build()
                .toUriString();
        InvitationMessage message = new InvitationMessage(invitation.getEmail(), providerName,
                invitation.getRole().code(), actor.displayName(), acceptUrl, invitation.getExpiresAt());
        try {
            invitationNotifier.sendInvitation(message);
        } catch (RuntimeException ex) {
            log.error("Failed to deliver invitation {} of provider {}", invitation.getId(),
                    invitation.getProviderId(), ex);
            throw new ProblemException(ErrorKind.INTERNAL_ERROR, "INVITATION_DELIVERY_FAILED",
                    "Invitation was saved but the email could not be sent", ex);
        }
    }

    private ActorProfile resolveActor(UUID actorId, String fallbackEmail) {
        UserAccount account = userAccountRepository.findById(actorId).orElse(null);
        String email = account != null && StringUtils.hasText(account.getEmail()) ? account.getEmail() : fallbackEmail;
        String displayName;
        if (account != null && StringUtils.hasText(account.getFullName())) {
            displayName = account.getFullName();
        } else if (StringUtils.hasText(email)) {
            displayName = email;
        } else {
            displayName = FALLBACK_INVITER_NAME;
        }
        return new ActorProfile(email, displayName);
    }

    private static RetryableProblemException rateLimited(RateLimitDecision decision, String detail) {
        return new RetryableProblemException(ErrorKind.RATE_LIMITED, "RATE_LIMIT_EXCEEDED",
                detail + ". Try again in " + decision.retryAfterSeconds() + " seconds.",
                decision.retryAfterSeconds(), decision.remaining(), decision.resetAt());
    }

    private static MemberRole parseRole(String roleCode) {
        try {
            return MemberRole.fromCode(roleCode);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_ROLE",
                    "Role must be one of admin, manager, staff, viewer");
        }
    }

    private static String validateEmail(String email) {
        String normalized = InvitationStore.normalizeEmail(email);
        if (!StringUtils.hasText(normalized) || normalized.length() > EMAIL_MAX_LENGTH
                || !EMAIL_PATTERN.matcher(normalized).matches()) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_EMAIL", "A valid email address is required");
        }
        return normalized;
    }

    private record ActorProfile(String email, String displayName) {
    }

    public record IssueInvitationCommand(
            UUID actorId,
            String actorEmail,
            UUID providerId,
            String email,
            String role,
            RequestOrigin origin
    ) {
    }

    public record AcceptInvitationCommand(
            String token,
            UUID userId,
            String email,
            RequestOrigin origin
    ) {
    }
}
