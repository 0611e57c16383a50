package com.cateringhub.backend.modules.invitation.presentation;

import com.cateringhub.backend.global.security.JwtAuthenticationPrincipal;
import com.cateringhub.backend.global.security.SecurityUtils;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.invitation.application.InvitationService;
import com.cateringhub.backend.modules.invitation.application.InvitationService.AcceptInvitationCommand;
import com.cateringhub.backend.modules.invitation.presentation.dto.AcceptInvitationRequest;
import com.cateringhub.backend.modules.membership.application.MembershipView;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InvitationAcceptController {

    private final InvitationService invitationService;

    public InvitationAcceptController(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    @Operation(summary = "Accept an invitation", description = "The signed-in user joins the provider with the invited role.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Membership active"),
            @ApiResponse(responseCode = "403", description = "Email mismatch or suspended membership"),
            @ApiResponse(responseCode = "404", description = "Unknown token"),
            @ApiResponse(responseCode = "409", description = "Already accepted or already a member"),
            @ApiResponse(responseCode = "410", description = "Invitation expired")
    })
    @PostMapping("/invitations/accept")
    public ResponseEntity<MembershipView> accept(
            @Valid @RequestBody AcceptInvitationRequest request,
            HttpServletRequest httpRequest
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        MembershipView view = invitationService.acceptInvitation(new AcceptInvitationCommand(
                request.token(),
                principal.userId(),
                principal.email(),
                RequestOrigin.from(httpRequest)
        ));
        return ResponseEntity.ok(view);
    }
}
