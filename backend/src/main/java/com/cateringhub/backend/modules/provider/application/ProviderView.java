package com.cateringhub.backend.modules.provider.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.cateringhub.backend.modules.membership.application.MembershipView;

public record ProviderView(
        UUID id,
        String name,
        OffsetDateTime createdAt,
        MembershipView owner
) {
}
