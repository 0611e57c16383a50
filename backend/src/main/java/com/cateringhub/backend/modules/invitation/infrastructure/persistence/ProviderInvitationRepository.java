package com.cateringhub.backend.modules.invitation.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.cateringhub.backend.modules.invitation.domain.ProviderInvitation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProviderInvitationRepository extends JpaRepository<ProviderInvitation, UUID> {

    @Query("""
            select pi
              from ProviderInvitation pi
             where pi.providerId = :providerId
               and pi.email = :email
               and pi.acceptedAt is null
            """)
    Optional<ProviderInvitation> findPending(@Param("providerId") UUID providerId, @Param("email") String email);

    @Query("""
            select pi
              from ProviderInvitation pi
             where pi.providerId = :providerId
               and pi.acceptedAt is null
             order by pi.createdAt desc
            """)
    List<ProviderInvitation> findAllPending(@Param("providerId") UUID providerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select pi from ProviderInvitation pi where pi.tokenHash = :tokenHash")
    Optional<ProviderInvitation> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select pi from ProviderInvitation pi where pi.id = :id and pi.providerId = :providerId")
    Optional<ProviderInvitation> findByIdAndProviderIdForUpdate(@Param("id") UUID id,
                                                               @Param("providerId") UUID providerId);
}
