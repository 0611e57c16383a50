package com.cateringhub.backend.modules.membership.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable rank table over {@link MemberRole}. Rank 1 is the most privileged.
 * <p>
 * The table must cover every role with a distinct positive rank; construction fails otherwise,
 * so a lookup can never fall through to a permissive default.
 */
public final class RoleHierarchy {

    private final Map<MemberRole, Integer> ranks;

    public RoleHierarchy(Map<MemberRole, Integer> ranks) {
        Objects.requireNonNull(ranks, "ranks");
        EnumMap<MemberRole, Integer> copy = new EnumMap<>(MemberRole.class);
        Set<Integer> seen = new HashSet<>();
        for (MemberRole role : MemberRole.values()) {
            Integer rank = ranks.get(role);
            if (rank == null || rank < 1) {
                throw new IllegalArgumentException("Missing or invalid rank for role " + role);
            }
            if (!seen.add(rank)) {
                throw new IllegalArgumentException("Duplicate rank " + rank + " for role " + role);
            }
            copy.put(role, rank);
        }
        this.ranks = Collections.unmodifiableMap(copy);
    }

    public static RoleHierarchy standard() {
        return new RoleHierarchy(Map.of(
                MemberRole.OWNER, 1,
                MemberRole.ADMIN, 2,
                MemberRole.MANAGER, 3,
                MemberRole.STAFF, 4,
                MemberRole.VIEWER, 5
        ));
    }

    public int rank(MemberRole role) {
        Objects.requireNonNull(role, "role");
        return ranks.get(role);
    }

    /**
     * @return {@code true} iff {@code actorRole} is at least as privileged as {@code requiredFloor}
     */
    public boolean permits(MemberRole actorRole, MemberRole requiredFloor) {
        return rank(actorRole) <= rank(requiredFloor);
    }
}
