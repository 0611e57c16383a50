package com.cateringhub.backend.modules.audit.infrastructure;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.cateringhub.backend.modules.audit.domain.AuditLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Insert and read access only; the audit trail has no update or delete path.
 * Optional filters are passed as {@code null} and collapse to the column itself.
 */
public interface AuditLogRepository extends Repository<AuditLog, UUID> {

    AuditLog save(AuditLog auditLog);

    @Query(value = """
            select a
              from AuditLog a
             where a.providerId = :providerId
               and a.actorUserId = coalesce(:actorUserId, a.actorUserId)
               and a.action = coalesce(:action, a.action)
               and a.createdAt >= coalesce(:from, a.createdAt)
               and a.createdAt <= coalesce(:to, a.createdAt)
             order by a.createdAt desc
            """,
            countQuery = """
            select count(a)
              from AuditLog a
             where a.providerId = :providerId
               and a.actorUserId = coalesce(:actorUserId, a.actorUserId)
               and a.action = coalesce(:action, a.action)
               and a.createdAt >= coalesce(:from, a.createdAt)
               and a.createdAt <= coalesce(:to, a.createdAt)
            """)
    Page<AuditLog> search(
            @Param("providerId") UUID providerId,
            @Param("actorUserId") UUID actorUserId,
            @Param("action") String action,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to,
            Pageable pageable
    );
}
