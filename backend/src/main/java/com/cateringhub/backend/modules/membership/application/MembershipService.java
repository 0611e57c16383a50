package com.cateringhub.backend.modules.membership.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cateringhub.backend.modules.audit.application.AuditLogService;
import com.cateringhub.backend.modules.audit.domain.AuditAction;
import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.membership.domain.MemberStatus;
import com.cateringhub.backend.modules.membership.domain.ProviderMember;
import com.cateringhub.backend.modules.membership.infrastructure.persistence.ProviderMemberRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private static final String RESOURCE_TYPE = "provider_member";

    private final ProviderMemberRepository providerMemberRepository;
    private final MembershipAuthorizer membershipAuthorizer;
    private final AuditLogService auditLogService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public MembershipService(
            ProviderMemberRepository providerMemberRepository,
            MembershipAuthorizer membershipAuthorizer,
            AuditLogService auditLogService,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.providerMemberRepository = providerMemberRepository;
        this.membershipAuthorizer = membershipAuthorizer;
        this.auditLogService = auditLogService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Registers the first owner of a freshly created provider. Joins the caller's transaction.
     */
    @Transactional
    public ProviderMember provisionOwner(UUID providerId, UUID userId) {
        if (providerMemberRepository.existsOwner(providerId)) {
            throw new ProblemException(ErrorKind.CONFLICT, "OWNER_ALREADY_EXISTS",
                    "This provider already has an owner");
        }
        if (providerMemberRepository.findByProviderIdAndUserId(providerId, userId).isPresent()) {
            throw new ProblemException(ErrorKind.CONFLICT, "ALREADY_MEMBER",
                    "User is already a member of this provider");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        ProviderMember owner = new ProviderMember(providerId, userId, MemberRole.OWNER, MemberStatus.ACTIVE);
        owner.setJoinedAt(now);
        try {
            return providerMemberRepository.saveAndFlush(owner);
        } catch (DataIntegrityViolationException ex) {
            if (isOwnerConstraintViolation(ex)) {
                throw new ProblemException(ErrorKind.CONFLICT, "OWNER_ALREADY_EXISTS",
                        "This provider already has an owner");
            }
            throw ex;
        }
    }

    @Transactional(readOnly = true)
    public List<MembershipView> listMembers(UUID actorId, UUID providerId) {
        membershipAuthorizer.authorize(actorId, providerId, MemberRole.VIEWER);
        return providerMemberRepository.findAllByProviderIdOrdered(providerId).stream()
                .map(MembershipView::from)
                .toList();
    }

    public MembershipView changeRole(UUID actorId, UUID providerId, UUID memberId, String roleCode,
                                     RequestOrigin origin) {
        AuthorizationGrant grant = membershipAuthorizer.authorize(actorId, providerId, MemberRole.ADMIN);
        MemberRole newRole = parseRole(roleCode);
        if (newRole == MemberRole.OWNER) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "OWNERSHIP_TRANSFER_UNSUPPORTED",
                    "The owner role cannot be assigned");
        }

        RoleChange change = transactionTemplate.execute(status -> {
            ProviderMember target = loadTarget(grant, memberId);
            if (target.getRole() == MemberRole.OWNER) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "OWNER_ROLE_IMMUTABLE",
                        "The owner's role cannot be changed");
            }
            if (target.getUserId().equals(actorId)) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "SELF_ROLE_CHANGE",
                        "You cannot change your own role");
            }
            if (target.getStatus() == MemberStatus.REMOVED) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "MEMBER_REMOVED",
                        "Removed members must be invited again");
            }
            MemberRole previous = target.getRole();
            if (previous == newRole) {
                return new RoleChange(target, previous, false);
            }
            target.setRole(newRole);
            return new RoleChange(providerMemberRepository.save(target), previous, true);
        });

        if (change.changed()) {
            log.info("Member {} of provider {} changed from {} to {} by {}",
                    memberId, providerId, change.previous().code(), newRole.code(), actorId);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("memberId", memberId.toString());
            metadata.put("targetUserId", change.member().getUserId().toString());
            metadata.put("previousRole", change.previous().code());
            metadata.put("newRole", newRole.code());
            auditLogService.record(new AuditLogCommand(providerId, actorId, AuditAction.MEMBER_ROLE_UPDATED,
                    RESOURCE_TYPE, memberId.toString(), metadata, origin));
        }
        return MembershipView.from(change.member());
    }

    public MembershipView changeStatus(UUID actorId, UUID providerId, UUID memberId, String statusCode,
                                       RequestOrigin origin) {
        AuthorizationGrant grant = membershipAuthorizer.authorize(actorId, providerId, MemberRole.ADMIN);
        MemberStatus newStatus = parseStatus(statusCode);
        if (newStatus == MemberStatus.PENDING) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_STATUS",
                    "Status must be one of active, suspended, removed");
        }

        StatusChange change = transactionTemplate.execute(status -> {
            ProviderMember target = loadTarget(grant, memberId);
            if (target.getRole() == MemberRole.OWNER) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "OWNER_STATUS_IMMUTABLE",
                        "The owner's status cannot be changed");
            }
            if (target.getUserId().equals(actorId)) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "SELF_STATUS_CHANGE",
                        "You cannot change your own status");
            }
            MemberStatus previous = target.getStatus();
            if (previous == newStatus) {
                return new StatusChange(target, previous, false);
            }
            if (previous == MemberStatus.REMOVED) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "MEMBER_REMOVED",
                        "Removed members must be invited again");
            }
            if (previous == MemberStatus.PENDING && newStatus != MemberStatus.REMOVED) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_STATUS_TRANSITION",
                        "Pending members can only be removed");
            }
            target.setStatus(newStatus);
            return new StatusChange(providerMemberRepository.save(target), previous, true);
        });

        if (change.changed()) {
            log.info("Member {} of provider {} moved from {} to {} by {}",
                    memberId, providerId, change.previous().code(), newStatus.code(), actorId);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("memberId", memberId.toString());
            metadata.put("targetUserId", change.member().getUserId().toString());
            metadata.put("previousStatus", change.previous().code());
            metadata.put("newStatus", newStatus.code());
            auditLogService.record(new AuditLogCommand(providerId, actorId, statusAction(newStatus),
                    RESOURCE_TYPE, memberId.toString(), metadata, origin));
        }
        return MembershipView.from(change.member());
    }

    private ProviderMember loadTarget(AuthorizationGrant grant, UUID memberId) {
        return providerMemberRepository.findByIdAndProviderId(memberId, grant.providerId())
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "MEMBER_NOT_FOUND",
                        "Member not found"));
    }

    private static AuditAction statusAction(MemberStatus status) {
        return switch (status) {
            case ACTIVE -> AuditAction.MEMBER_ACTIVATED;
            case SUSPENDED -> AuditAction.MEMBER_SUSPENDED;
            case REMOVED -> AuditAction.MEMBER_REMOVED;
            case PENDING -> throw new IllegalArgumentException("No audit action for pending status");
        };
    }

    private static MemberRole parseRole(String roleCode) {
        try {
            return MemberRole.fromCode(roleCode);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_ROLE",
                    "Role must be one of owner, admin, manager, staff, viewer");
        }
    }

    private static MemberStatus parseStatus(String statusCode) {
        try {
            return MemberStatus.fromCode(statusCode);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_STATUS",
                    "Status must be one of active, suspended, removed");
        }
    }

    private static boolean isOwnerConstraintViolation(DataIntegrityViolationException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause != null ? cause.getMessage() : null;
        return message != null && message.contains("uq_provider_member_owner");
    }

    private record RoleChange(ProviderMember member, MemberRole previous, boolean changed) {
    }

    private record StatusChange(ProviderMember member, MemberStatus previous, boolean changed) {
    }
}
