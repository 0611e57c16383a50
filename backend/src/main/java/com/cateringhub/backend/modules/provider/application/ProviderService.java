package com.cateringhub.backend.modules.provider.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.audit.application.AuditLogService;
import com.cateringhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cateringhub.backend.modules.audit.domain.AuditAction;
import com.cateringhub.backend.modules.membership.application.MembershipService;
import com.cateringhub.backend.modules.membership.application.MembershipView;
import com.cateringhub.backend.modules.membership.domain.ProviderMember;
import com.cateringhub.backend.modules.provider.domain.Provider;
import com.cateringhub.backend.modules.provider.infrastructure.persistence.ProviderRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class ProviderService {

    private static final Logger log = LoggerFactory.getLogger(ProviderService.class);

    private static final int NAME_MAX_LENGTH = 150;

    private final ProviderRepository providerRepository;
    private final MembershipService membershipService;
    private final AuditLogService auditLogService;
    private final TransactionTemplate transactionTemplate;

    public ProviderService(
            ProviderRepository providerRepository,
            MembershipService membershipService,
            AuditLogService auditLogService,
            PlatformTransactionManager transactionManager
    ) {
        this.providerRepository = providerRepository;
        this.membershipService = membershipService;
        this.auditLogService = auditLogService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Creates a provider and makes the caller its owner in one transaction.
     */
    public ProviderView createProvider(UUID actorId, String name, RequestOrigin origin) {
        String trimmed = name != null ? name.trim() : "";
        if (trimmed.isEmpty() || trimmed.length() > NAME_MAX_LENGTH) {
            throw new ProblemException(ErrorKind.INVALID_INPUT, "INVALID_PROVIDER_NAME",
                    "Provider name must be 1-" + NAME_MAX_LENGTH + " characters");
        }

        ProviderView view = transactionTemplate.execute(status -> {
            Provider provider = new Provider();
            provider.setName(trimmed);
            provider.setCreatedBy(actorId);
            Provider saved = providerRepository.saveAndFlush(provider);
            ProviderMember owner = membershipService.provisionOwner(saved.getId(), actorId);
            return new ProviderView(saved.getId(), saved.getName(), saved.getCreatedAt(), MembershipView.from(owner));
        });

        log.info("Provider {} created by {}", view.id(), actorId);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("providerName", view.name());
        metadata.put("ownerMembershipId", view.owner().id().toString());
        auditLogService.record(new AuditLogCommand(view.id(), actorId, AuditAction.OWNER_PROVISIONED,
                "provider", view.id().toString(), metadata, origin));
        return view;
    }
}
