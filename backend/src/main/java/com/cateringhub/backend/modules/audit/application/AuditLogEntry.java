package com.cateringhub.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.cateringhub.backend.modules.audit.domain.AuditLog;

public record AuditLogEntry(
        UUID id,
        UUID providerId,
        UUID actorUserId,
        String action,
        String resourceType,
        String resourceKey,
        Map<String, Object> metadata,
        String ipAddress,
        String userAgent,
        OffsetDateTime createdAt
) {

    public static AuditLogEntry from(AuditLog log) {
        return new AuditLogEntry(
                log.getId(),
                log.getProviderId(),
                log.getActorUserId(),
                log.getAction(),
                log.getResourceType(),
                log.getResourceKey(),
                log.getMetadata() != null ? log.getMetadata() : Map.of(),
                log.getIpAddress(),
                log.getUserAgent(),
                log.getCreatedAt()
        );
    }
}
