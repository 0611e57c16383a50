package com.cateringhub.backend.modules.membership.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.cateringhub.backend.modules.membership.domain.ProviderMember;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProviderMemberRepository extends JpaRepository<ProviderMember, UUID> {

    Optional<ProviderMember> findByProviderIdAndUserId(UUID providerId, UUID userId);

    Optional<ProviderMember> findByIdAndProviderId(UUID id, UUID providerId);

    @Query("""
            select pm
              from ProviderMember pm
             where pm.providerId = :providerId
             order by case pm.role
                        when com.cateringhub.backend.modules.membership.domain.MemberRole.OWNER then 1
                        when com.cateringhub.backend.modules.membership.domain.MemberRole.ADMIN then 2
                        when com.cateringhub.backend.modules.membership.domain.MemberRole.MANAGER then 3
                        when com.cateringhub.backend.modules.membership.domain.MemberRole.STAFF then 4
                        else 5
                      end,
                      pm.createdAt
            """)
    List<ProviderMember> findAllByProviderIdOrdered(@Param("providerId") UUID providerId);

    @Query("""
            select case when count(pm) > 0 then true else false end
              from ProviderMember pm
             where pm.providerId = :providerId
               and pm.role = com.cateringhub.backend.modules.membership.domain.MemberRole.OWNER
               and pm.status <> com.cateringhub.backend.modules.membership.domain.MemberStatus.REMOVED
            """)
    boolean existsOwner(@Param("providerId") UUID providerId);
}
