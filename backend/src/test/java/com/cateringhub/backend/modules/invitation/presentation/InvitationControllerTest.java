package com.cateringhub.backend.modules.invitation.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.global.error.RestExceptionHandler;
import com.cateringhub.backend.global.error.RetryableProblemException;
import com.cateringhub.backend.global.security.JwtAuthenticationPrincipal;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.invitation.application.InvitationService;
import com.cateringhub.backend.modules.invitation.application.InvitationView;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class InvitationControllerTest {

    private static final UUID PROVIDER_ID = UUID.randomUUID();
    private static final UUID USER_ID = UUID.randomUUID();
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    @Mock
    private InvitationService invitationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new InvitationController(invitationService),
                        new InvitationAcceptController(invitationService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                new JwtAuthenticationPrincipal(USER_ID, "manager@example.com"), null, List.of()));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void issueReturnsCreatedWithLocation() throws Exception {
        UUID invitationId = UUID.randomUUID();
        when(invitationService.issueInvitation(any())).thenReturn(new InvitationView(invitationId, PROVIDER_ID,
                "new.hire@example.com", "staff", USER_ID, "pending", NOW, NOW.plusHours(48), null));

        mockMvc.perform(post("/providers/{providerId}/invitations", PROVIDER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("User-Agent", "JUnit")
                        .content("""
                                {"email":"new.hire@example.com","role":"staff"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location",
                        "/providers/" + PROVIDER_ID + "/invitations/" + invitationId))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.token").doesNotExist());

        verify(invitationService).issueInvitation(new InvitationService.IssueInvitationCommand(USER_ID,
                "manager@example.com", PROVIDER_ID, "new.hire@example.com", "staff",
                new RequestOrigin("127.0.0.1", "JUnit")));
    }

    @Test
    void rateLimitedIssueCarriesRetryHeaders() throws Exception {
        when(invitationService.issueInvitation(any())).thenThrow(new RetryableProblemException(
                ErrorKind.RATE_LIMITED, "RATE_LIMIT_EXCEEDED", "Too many invitations sent", 120, 0,
                NOW.plusMinutes(2)));

        mockMvc.perform(post("/providers/{providerId}/invitations", PROVIDER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"new.hire@example.com\",\"role\":\"staff\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "120"))
                .andExpect(header().string(RestExceptionHandler.RATE_LIMIT_REMAINING_HEADER, "0"))
                .andExpect(header().string(RestExceptionHandler.RATE_LIMIT_RESET_HEADER,
                        Long.toString(NOW.plusMinutes(2).toEpochSecond())))
                .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    void invalidBodyIsUnprocessable() throws Exception {
        mockMvc.perform(post("/providers/{providerId}/invitations", PROVIDER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\",\"role\":\"\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));

        verifyNoInteractions(invitationService);
    }

    @Test
    void malformedProviderIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/providers/{providerId}/invitations", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_parameter"));
    }

    @Test
    void forbiddenListMapsTo403() throws Exception {
        when(invitationService.listPendingInvitations(USER_ID, PROVIDER_ID))
                .thenThrow(new ProblemException(ErrorKind.FORBIDDEN, "INSUFFICIENT_ROLE"));

        mockMvc.perform(get("/providers/{providerId}/invitations", PROVIDER_ID))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_ROLE"));
    }

    @Test
    void revokeReturnsNoContent() throws Exception {
        UUID invitationId = UUID.randomUUID();

        mockMvc.perform(delete("/providers/{providerId}/invitations/{invitationId}", PROVIDER_ID, invitationId))
                .andExpect(status().isNoContent());

        verify(invitationService).revokeInvitation(eq(USER_ID), eq(PROVIDER_ID), eq(invitationId), any());
    }

    @Test
    void expiredAcceptIsGone() throws Exception {
        when(invitationService.acceptInvitation(any()))
                .thenThrow(new ProblemException(ErrorKind.EXPIRED, "INVITATION_EXPIRED", "Invitation has expired"));

        mockMvc.perform(post("/invitations/accept")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + "a".repeat(64) + "\"}"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("INVITATION_EXPIRED"))
                .andExpect(jsonPath("$.instance").value("/invitations/accept"));
    }

    @Test
    void unauthenticatedAcceptIsRejected() throws Exception {
        SecurityContextHolder.clearContext();

        mockMvc.perform(post("/invitations/accept")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"abc\"}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(invitationService);
    }
}
