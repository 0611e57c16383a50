package com.cateringhub.backend.modules.membership.presentation;

import java.util.List;
import java.util.UUID;

import com.cateringhub.backend.global.security.SecurityUtils;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.membership.application.MembershipService;
import com.cateringhub.backend.modules.membership.application.MembershipView;
import com.cateringhub.backend.modules.membership.presentation.dto.UpdateMemberRoleRequest;
import com.cateringhub.backend.modules.membership.presentation.dto.UpdateMemberStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/providers/{providerId}/members")
public class MembershipController {

    private final MembershipService membershipService;

    public MembershipController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @Operation(summary = "List members", description = "Any active member can see the team roster.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Roster returned"),
            @ApiResponse(responseCode = "403", description = "Not an active member")
    })
    @GetMapping
    public ResponseEntity<List<MembershipView>> listMembers(@PathVariable("providerId") UUID providerId) {
        return ResponseEntity.ok(membershipService.listMembers(SecurityUtils.getCurrentUserId(), providerId));
    }

    @Operation(summary = "Change member role", description = "Admins change another member's role. The owner role is fixed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Role updated or unchanged"),
            @ApiResponse(responseCode = "400", description = "Invalid role, owner target or self change"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "Member not found")
    })
    @PatchMapping("/{memberId}/role")
    public ResponseEntity<MembershipView> changeRole(
            @PathVariable("providerId") UUID providerId,
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody UpdateMemberRoleRequest request,
            HttpServletRequest httpRequest
    ) {
        MembershipView view = membershipService.changeRole(SecurityUtils.getCurrentUserId(), providerId, memberId,
                request.role(), RequestOrigin.from(httpRequest));
        return ResponseEntity.ok(view);
    }

    @Operation(summary = "Change member status", description = "Admins suspend, reactivate or remove another member.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status updated or unchanged"),
            @ApiResponse(responseCode = "400", description = "Invalid status or transition"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "Member not found")
    })
    @PatchMapping("/{memberId}/status")
    public ResponseEntity<MembershipView> changeStatus(
            @PathVariable("providerId") UUID providerId,
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody UpdateMemberStatusRequest request,
            HttpServletRequest httpRequest
    ) {
        MembershipView view = membershipService.changeStatus(SecurityUtils.getCurrentUserId(), providerId, memberId,
                request.status(), RequestOrigin.from(httpRequest));
        return ResponseEntity.ok(view);
    }
}
