package com.cateringhub.backend.modules.membership;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import com.cateringhub.backend.global.error.ErrorKind;
import com.cateringhub.backend.global.error.ProblemException;
import com.cateringhub.backend.modules.membership.application.AuthorizationGrant;
import com.cateringhub.backend.modules.membership.application.TestGrants;
import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.membership.domain.RoleHierarchy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AuthorizationGrantTest {

    private static final UUID PROVIDER_ID = UUID.randomUUID();
    private static final UUID ACTOR_ID = UUID.randomUUID();

    private final RoleHierarchy hierarchy = RoleHierarchy.standard();

    @ParameterizedTest(name = "{0} actor with {1} grant passes manager floor")
    @CsvSource({
            "MANAGER, MANAGER",
            "ADMIN, MANAGER",
            "ADMIN, ADMIN",
            "OWNER, OWNER"
    })
    void grantAtOrAboveFloorPasses(MemberRole actorRole, MemberRole grantFloor) {
        AuthorizationGrant grant = TestGrants.grant(PROVIDER_ID, ACTOR_ID, actorRole, grantFloor);

        assertThatCode(() -> grant.requireFloor(MemberRole.MANAGER, hierarchy)).doesNotThrowAnyException();
    }

    @ParameterizedTest(name = "{0} actor with {1} grant fails manager floor")
    @CsvSource({
            "VIEWER, VIEWER",
            "STAFF, STAFF",
            "OWNER, VIEWER",
            "ADMIN, STAFF"
    })
    void grantBelowFloorIsForbidden(MemberRole actorRole, MemberRole grantFloor) {
        AuthorizationGrant grant = TestGrants.grant(PROVIDER_ID, ACTOR_ID, actorRole, grantFloor);

        assertThatThrownBy(() -> grant.requireFloor(MemberRole.MANAGER, hierarchy))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("INSUFFICIENT_ROLE");
                });
    }
}
