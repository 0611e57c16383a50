package com.cateringhub.backend.modules.invitation.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record IssueInvitationRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @NotBlank String role
) {
}
