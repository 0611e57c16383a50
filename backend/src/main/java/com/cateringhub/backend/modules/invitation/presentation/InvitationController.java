package com.cateringhub.backend.modules.invitation.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.cateringhub.backend.global.security.JwtAuthenticationPrincipal;
import com.cateringhub.backend.global.security.SecurityUtils;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.invitation.application.InvitationService;
import com.cateringhub.backend.modules.invitation.application.InvitationService.IssueInvitationCommand;
import com.cateringhub.backend.modules.invitation.application.InvitationView;
import com.cateringhub.backend.modules.invitation.presentation.dto.IssueInvitationRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/providers/{providerId}/invitations")
public class InvitationController {

    private final InvitationService invitationService;

    public InvitationController(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    @Operation(summary = "List pending invitations", description = "Managers and above see unaccepted invitations, including expired ones.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Invitations returned"),
            @ApiResponse(responseCode = "403", description = "Manager role required")
    })
    @GetMapping
    public ResponseEntity<List<InvitationView>> listPending(@PathVariable("providerId") UUID providerId) {
        return ResponseEntity.ok(invitationService.listPendingInvitations(SecurityUtils.getCurrentUserId(), providerId));
    }

    @Operation(summary = "Invite a member", description = "Creates an invitation and emails the acceptance link.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Invitation sent"),
            @ApiResponse(responseCode = "400", description = "Owner role, self invitation or bad email"),
            @ApiResponse(responseCode = "403", description = "Manager role required"),
            @ApiResponse(responseCode = "409", description = "An invitation is already pending"),
            @ApiResponse(responseCode = "429", description = "Invitation quota exhausted"),
            @ApiResponse(responseCode = "500", description = "Invitation stored but email delivery failed")
    })
    @PostMapping
    public ResponseEntity<InvitationView> issue(
            @PathVariable("providerId") UUID providerId,
            @Valid @RequestBody IssueInvitationRequest request,
            HttpServletRequest httpRequest
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        InvitationView view = invitationService.issueInvitation(new IssueInvitationCommand(
                principal.userId(),
                principal.email(),
                providerId,
                request.email(),
                request.role(),
                RequestOrigin.from(httpRequest)
        ));
        URI location = URI.create("/providers/" + providerId + "/invitations/" + view.id());
        return ResponseEntity.created(location).body(view);
    }

    @Operation(summary = "Resend an invitation", description = "Issues a fresh link and expiry. The previous link stops working.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Invitation resent"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "Invitation not found"),
            @ApiResponse(responseCode = "409", description = "Invitation already accepted"),
            @ApiResponse(responseCode = "429", description = "Resend quota exhausted")
    })
    @PostMapping("/{invitationId}/resend")
    public ResponseEntity<InvitationView> resend(
            @PathVariable("providerId") UUID providerId,
            @PathVariable("invitationId") UUID invitationId,
            HttpServletRequest httpRequest
    ) {
        InvitationView view = invitationService.resendInvitation(SecurityUtils.getCurrentUserId(), providerId,
                invitationId, RequestOrigin.from(httpRequest));
        return ResponseEntity.ok(view);
    }

    @Operation(summary = "Revoke an invitation")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Invitation revoked"),
            @ApiResponse(responseCode = "403", description = "Manager role required"),
            @ApiResponse(responseCode = "404", description = "Invitation not found"),
            @ApiResponse(responseCode = "409", description = "Invitation already accepted")
    })
    @DeleteMapping("/{invitationId}")
    public ResponseEntity<Void> revoke(
            @PathVariable("providerId") UUID providerId,
            @PathVariable("invitationId") UUID invitationId,
            HttpServletRequest httpRequest
    ) {
        invitationService.revokeInvitation(SecurityUtils.getCurrentUserId(), providerId, invitationId,
                RequestOrigin.from(httpRequest));
        return ResponseEntity.noContent().build();
    }
}
