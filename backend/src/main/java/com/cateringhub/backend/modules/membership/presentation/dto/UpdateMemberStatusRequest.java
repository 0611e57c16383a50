package com.cateringhub.backend.modules.membership.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateMemberStatusRequest(
        @NotBlank String status
) {
}
