package com.cateringhub.backend.modules.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.audit.application.AuditLogPage;
import com.cateringhub.backend.modules.audit.application.AuditLogService;
import com.cateringhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cateringhub.backend.modules.audit.application.AuditLogService.AuditLogFilter;
import com.cateringhub.backend.modules.audit.domain.AuditAction;
import com.cateringhub.backend.modules.audit.domain.AuditLog;
import com.cateringhub.backend.modules.audit.infrastructure.AuditLogRepository;
import com.cateringhub.backend.modules.membership.application.MembershipAuthorizer;
import com.cateringhub.backend.modules.membership.domain.MemberRole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class AuditLogServiceTest {

    private static final UUID PROVIDER_ID = UUID.randomUUID();
    private static final UUID ACTOR_ID = UUID.randomUUID();
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private MembershipAuthorizer membershipAuthorizer;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AuditLogService auditLogService;

    @BeforeEach
    void setUp() {
        auditLogService = new AuditLogService(auditLogRepository, membershipAuthorizer, transactionManager,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    void recordPersistsEntryWithOriginAndTimestamp() {
        auditLogService.record(new AuditLogCommand(PROVIDER_ID, ACTOR_ID, AuditAction.MEMBER_SUSPENDED,
                "provider_member", "m-1", Map.of("previousStatus", "active"),
                new RequestOrigin("10.0.0.9", "curl/8")));

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog saved = captor.getValue();
        assertThat(saved.getProviderId()).isEqualTo(PROVIDER_ID);
        assertThat(saved.getActorUserId()).isEqualTo(ACTOR_ID);
        assertThat(saved.getAction()).isEqualTo("member_suspended");
        assertThat(saved.getMetadata()).containsEntry("previousStatus", "active");
        assertThat(saved.getIpAddress()).isEqualTo("10.0.0.9");
        assertThat(saved.getUserAgent()).isEqualTo("curl/8");
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void recordToleratesMissingOriginAndMetadata() {
        auditLogService.record(new AuditLogCommand(PROVIDER_ID, ACTOR_ID, AuditAction.INVITATION_REVOKED,
                "provider_invitation", "i-1", null, null));

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertThat(captor.getValue().getMetadata()).isNull();
        assertThat(captor.getValue().getIpAddress()).isEqualTo(RequestOrigin.UNKNOWN.ipAddress());
    }

    @Test
    void recordSwallowsStorageFailure() {
        when(auditLogRepository.save(any(AuditLog.class)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatCode(() -> auditLogService.record(new AuditLogCommand(PROVIDER_ID, ACTOR_ID,
                AuditAction.INVITATION_SENT, "provider_invitation", "i-1", Map.of(), RequestOrigin.UNKNOWN)))
                .doesNotThrowAnyException();
    }

    @Test
    void recordSkipsIncompleteCommand() {
        assertThatCode(() -> auditLogService.record(new AuditLogCommand(PROVIDER_ID, null,
                AuditAction.INVITATION_SENT, "provider_invitation", "i-1", Map.of(), RequestOrigin.UNKNOWN)))
                .doesNotThrowAnyException();
        verify(auditLogRepository, never()).save(any());
    }

    @Test
    void searchRequiresAdminAndMapsFilters() {
        OffsetDateTime from = NOW.minusDays(1);
        AuditLog entry = new AuditLog(PROVIDER_ID, ACTOR_ID, AuditAction.INVITATION_SENT, "provider_invitation",
                "i-1", Map.of("email", "a@example.com"), null, null, NOW);
        when(auditLogRepository.search(eq(PROVIDER_ID), eq(ACTOR_ID), eq("invitation_sent"), eq(from), isNull(),
                any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(entry), PageRequest.of(1, 10), 11));

        AuditLogPage page = auditLogService.search(ACTOR_ID, PROVIDER_ID,
                new AuditLogFilter(ACTOR_ID, "INVITATION_SENT", from, null), 1, 10);

        verify(membershipAuthorizer).authorize(ACTOR_ID, PROVIDER_ID, MemberRole.ADMIN);
        assertThat(page.items()).singleElement()
                .satisfies(item -> {
                    assertThat(item.action()).isEqualTo("invitation_sent");
                    assertThat(item.metadata()).containsEntry("email", "a@example.com");
                });
        assertThat(page.page()).isEqualTo(1);
        assertThat(page.size()).isEqualTo(10);
        assertThat(page.totalElements()).isEqualTo(11);
    }

    @Test
    void searchRejectsBadPagingAndRanges() {
        AuditLogFilter none = new AuditLogFilter(null, null, null, null);
        assertThatThrownBy(() -> auditLogService.search(ACTOR_ID, PROVIDER_ID, none, -1, 20))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("INVALID_PAGE"));
        assertThatThrownBy(() -> auditLogService.search(ACTOR_ID, PROVIDER_ID, none, 0, 101))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_PAGE_SIZE"));
        assertThatThrownBy(() -> auditLogService.search(ACTOR_ID, PROVIDER_ID,
                new AuditLogFilter(null, null, NOW, NOW.minusSeconds(1)), 0, 20))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_INPUT);
                    assertThat(ex.getCode()).isEqualTo("INVALID_RANGE");
                });
        assertThatThrownBy(() -> auditLogService.search(ACTOR_ID, PROVIDER_ID,
                new AuditLogFilter(null, "deleted_everything", null, null), 0, 20))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_ACTION"));
        verify(auditLogRepository, never()).search(any(), any(), any(), any(), any(), any());
    }
}
