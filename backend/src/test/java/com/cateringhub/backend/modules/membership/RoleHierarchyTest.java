package com.cateringhub.backend.modules.membership;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.Map;

import com.cateringhub.backend.modules.membership.domain.MemberRole;
import com.cateringhub.backend.modules.membership.domain.RoleHierarchy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RoleHierarchyTest {

    private final RoleHierarchy hierarchy = RoleHierarchy.standard();

    @Test
    void ranksOwnerHighestAndViewerLowest() {
        assertThat(hierarchy.rank(MemberRole.OWNER)).isEqualTo(1);
        assertThat(hierarchy.rank(MemberRole.ADMIN)).isEqualTo(2);
        assertThat(hierarchy.rank(MemberRole.MANAGER)).isEqualTo(3);
        assertThat(hierarchy.rank(MemberRole.STAFF)).isEqualTo(4);
        assertThat(hierarchy.rank(MemberRole.VIEWER)).isEqualTo(5);
    }

    @ParameterizedTest(name = "{0} meets {1} floor: {2}")
    @CsvSource({
            "OWNER, MANAGER, true",
            "ADMIN, MANAGER, true",
            "MANAGER, MANAGER, true",
            "STAFF, MANAGER, false",
            "VIEWER, MANAGER, false",
            "ADMIN, ADMIN, true",
            "MANAGER, ADMIN, false",
            "VIEWER, VIEWER, true",
            "MANAGER, OWNER, false"
    })
    void permitsOnlyRolesAtOrAboveTheFloor(MemberRole actor, MemberRole floor, boolean expected) {
        assertThat(hierarchy.permits(actor, floor)).isEqualTo(expected);
    }

    @Test
    @DisplayName("null roles fail instead of defaulting to a rank")
    void nullRoleFailsFast() {
        assertThatThrownBy(() -> hierarchy.rank(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> hierarchy.permits(null, MemberRole.VIEWER)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> hierarchy.permits(MemberRole.OWNER, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void rejectsIncompleteTable() {
        Map<MemberRole, Integer> ranks = new EnumMap<>(MemberRole.class);
        ranks.put(MemberRole.OWNER, 1);
        ranks.put(MemberRole.ADMIN, 2);

        assertThatThrownBy(() -> new RoleHierarchy(ranks))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MANAGER");
    }

    @Test
    void rejectsDuplicateRanks() {
        Map<MemberRole, Integer> ranks = new EnumMap<>(MemberRole.class);
        ranks.put(MemberRole.OWNER, 1);
        ranks.put(MemberRole.ADMIN, 2);
        ranks.put(MemberRole.MANAGER, 2);
        ranks.put(MemberRole.STAFF, 4);
        ranks.put(MemberRole.VIEWER, 5);

        assertThatThrownBy(() -> new RoleHierarchy(ranks))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate rank");
    }

    @Test
    void parsesRoleCodesCaseInsensitively() {
        assertThat(MemberRole.fromCode(" Staff ")).isEqualTo(MemberRole.STAFF);
        assertThatThrownBy(() -> MemberRole.fromCode("superuser")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MemberRole.fromCode(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
