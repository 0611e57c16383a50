package com.cateringhub.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.audit.domain.AuditAction;
import com.cateringhub.backend.modules.audit.domain.AuditLog;
import com.cateringhub.backend.modules.audit.infrastructure.AuditLogRepository;
import com.cateringhub.backend.modules.membership.application.MembershipAuthorizer;
import com.cateringhub.backend.modules.membership.domain.MemberRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private static final int MAX_PAGE_SIZE = 100;

    private final AuditLogRepository auditLogRepository;
    private final MembershipAuthorizer membershipAuthorizer;
    private final TransactionTemplate requiresNewTemplate;
    private final Clock clock;

    public AuditLogService(
            AuditLogRepository auditLogRepository,
            MembershipAuthorizer membershipAuthorizer,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.auditLogRepository = auditLogRepository;
        this.membershipAuthorizer = membershipAuthorizer;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Appends an audit record in its own transaction. Failures are logged and never reach the
     * caller: the action being audited has already happened.
     */
    public void record(AuditLogCommand command) {
        try {
            Objects.requireNonNull(command.providerId(), "providerId is required");
            Objects.requireNonNull(command.actorUserId(), "actorUserId is required");
            Objects.requireNonNull(command.action(), "action is required");
            Objects.requireNonNull(command.resourceType(), "resourceType is required");
            Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

            RequestOrigin origin = command.origin() != null ? command.origin() : RequestOrigin.UNKNOWN;
            Map<String, Object> metadata = command.metadata() != null && !command.metadata().isEmpty()
                    ? new LinkedHashMap<>(command.metadata())
                    : null;
            AuditLog auditLog = new AuditLog(
                    command.providerId(),
                    command.actorUserId(),
                    command.action(),
                    command.resourceType(),
                    command.resourceKey(),
                    metadata,
                    origin.ipAddress(),
                    origin.userAgent(),
                    OffsetDateTime.now(clock)
            );
            requiresNewTemplate.executeWithoutResult(status -> auditLogRepository.save(auditLog));
        } catch (RuntimeException ex) {
            log.error("Failed to write audit record {} for provider {} resource {}:{}",
                    command.action(), command.providerId(), command.resourceType(), command.resourceKey(), ex);
        }
    }

    @Transactional(readOnly = true)
    public AuditLogPage search(UUID actorId, UUID providerId, AuditLogFilter filter, int page, int size) {
        membershipAuthorizer.authorize(actorId, providerId, MemberRole.ADMIN);
        if (page < 0) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_PAGE", "page must be >= 0");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_PAGE_SIZE",
                    "size must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (filter.from() != null && filter.to() != null && filter.from().isAfter(filter.to())) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_RANGE", "from must not be after to");
        }
        String action = null;
        if (filter.action() != null && !filter.action().isBlank()) {
            try {
                action = AuditAction.fromCode(filter.action()).code();
            } catch (IllegalArgumentException ex) {
                throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_ACTION",
                        "Unknown audit action " + filter.action());
            }
        }
        Page<AuditLog> result = auditLogRepository.search(
                providerId, filter.actorUserId(), action, filter.from(), filter.to(), PageRequest.of(page, size));
        return new AuditLogPage(
                result.getContent().stream().map(AuditLogEntry::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements()
        );
    }

    public record AuditLogCommand(
            UUID providerId,
            UUID actorUserId,
            AuditAction action,
            String resourceType,
            String resourceKey,
            Map<String, Object> metadata,
            RequestOrigin origin
    ) {
    }

    public record AuditLogFilter(
            UUID actorUserId,
            String action,
            OffsetDateTime from,
            OffsetDateTime to
    ) {
    }
}
