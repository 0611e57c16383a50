package com.cateringhub.backend.modules.audit.presentation;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.cateringhub.backend.global.security.SecurityUtils;
import com.cateringhub.backend.modules.audit.application.AuditLogPage;
import com.cateringhub.backend.modules.audit.application.AuditLogService;
import com.cateringhub.backend.modules.audit.application.AuditLogService.AuditLogFilter;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/providers/{providerId}/audit-logs")
public class AuditLogController {

    private final AuditLogService auditLogService;

    public AuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Operation(summary = "Search audit logs", description = "Admins browse the provider's membership audit trail, newest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page returned"),
            @ApiResponse(responseCode = "400", description = "Invalid filter or paging"),
            @ApiResponse(responseCode = "403", description = "Admin role required")
    })
    @GetMapping
    public ResponseEntity<AuditLogPage> search(
            @PathVariable("providerId") UUID providerId,
            @RequestParam(name = "actorId", required = false) UUID actorId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        AuditLogFilter filter = new AuditLogFilter(actorId, action, from, to);
        return ResponseEntity.ok(auditLogService.search(SecurityUtils.getCurrentUserId(), providerId, filter, page, size));
    }
}
