package com.cateringhub.backend.modules.membership.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateMemberRoleRequest(
        @NotBlank String role
) {
}
