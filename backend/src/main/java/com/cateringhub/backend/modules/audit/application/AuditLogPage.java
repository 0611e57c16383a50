package com.cateringhub.backend.modules.audit.application;

import java.util.List;

public record AuditLogPage(
        List<AuditLogEntry> items,
        int page,
        int size,
        long totalElements
) {
}
