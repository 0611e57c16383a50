package com.cateringhub.backend.modules.invitation.application;

import com.cateringhub.backend.modules.invitation.domain.ProviderInvitation;
import com.cateringhub.backend.modules.membership.domain.ProviderMember;

public record AcceptedInvitation(
        ProviderInvitation invitation,
        ProviderMember membership
) {
}
