package com.cateringhub.backend.modules.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.audit.application.AuditLogService;
import com.cateringhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cateringhub.backend.modules.audit.domain.AuditAction;
import com.cateringhub.backend.modules.membership.application.MembershipService;
import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.membership.domain.MemberStatus;
import com.cateringhub.backend.modules.membership.domain.ProviderMember;
import com.cateringhub.backend.modules.provider.application.ProviderService;
import com.cateringhub.backend.modules.provider.application.ProviderView;
import com.cateringhub.backend.modules.provider.domain.Provider;
import com.cateringhub.backend.modules.provider.infrastructure.persistence.ProviderRepository;
import com.cateringhub.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class ProviderServiceTest {

    private static final UUID ACTOR_ID = UUID.randomUUID();

    @Mock
    private ProviderRepository providerRepository;

    @Mock
    private MembershipService membershipService;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private ProviderService providerService;

    @BeforeEach
    void setUp() {
        providerService = new ProviderService(providerRepository, membershipService, auditLogService,
                transactionManager);
    }

    @Test
    void createProviderProvisionsCallerAsOwner() {
        UUID providerId = UUID.randomUUID();
        when(providerRepository.saveAndFlush(any(Provider.class))).thenAnswer(invocation -> {
            Provider provider = invocation.getArgument(0);
            ReflectionTestUtils.setField(provider, "id", providerId);
            return provider;
        });
        ProviderMember owner = TestEntities.member(providerId, ACTOR_ID, MemberRole.OWNER, MemberStatus.ACTIVE);
        when(membershipService.provisionOwner(providerId, ACTOR_ID)).thenReturn(owner);

        ProviderView view = providerService.createProvider(ACTOR_ID, "  Seoul Kitchen  ", RequestOrigin.UNKNOWN);

        assertThat(view.id()).isEqualTo(providerId);
        assertThat(view.name()).isEqualTo("Seoul Kitchen");
        assertThat(view.owner().role()).isEqualTo("owner");
        assertThat(view.owner().userId()).isEqualTo(ACTOR_ID);

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().action()).isEqualTo(AuditAction.OWNER_PROVISIONED);
        assertThat(audit.getValue().providerId()).isEqualTo(providerId);
        assertThat(audit.getValue().resourceType()).isEqualTo("provider");
    }

    @Test
    void blankOrOversizedNameIsRejected() {
        assertThatThrownBy(() -> providerService.createProvider(ACTOR_ID, "   ", RequestOrigin.UNKNOWN))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_INPUT);
                    assertThat(ex.getCode()).isEqualTo("INVALID_PROVIDER_NAME");
                });
        assertThatThrownBy(() -> providerService.createProvider(ACTOR_ID, "x".repeat(151), RequestOrigin.UNKNOWN))
                .isInstanceOf(ProblemException.class);
        verifyNoInteractions(providerRepository, membershipService, auditLogService);
    }
}
