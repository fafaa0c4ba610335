package com.tasklens.controller;

import com.tasklens.audit.AuditLog;
import com.tasklens.audit.AuditService;
import com.tasklens.exception.ApiException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping
    @PreAuthorize("@rbacService.isAdmin(authentication)")
    public AuditPage list(@RequestParam(defaultValue = "0") int page,
                          @RequestParam(defaultValue = "50") int size) {
        if (page < 0 || size < 1 || size > 500) {
            throw ApiException.badRequest("INVALID_PARAMETER", "page must be >= 0 and size between 1 and 500");
        }
        Page<AuditLog> result = auditService.findRecent(PageRequest.of(page, size));
        return new AuditPage(
                result.getContent().stream().map(AuditEntry::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements());
    }

    public record AuditPage(List<AuditEntry> items, int page, int size, long total) {}

    public record AuditEntry(
            Long id,
            Long userId,
            String action,
            String resourceType,
            String resourceId,
            String details,
            String ipAddress,
            String userAgent,
            String requestId,
            Instant createdAt
    ) {
        static AuditEntry from(AuditLog log) {
            return new AuditEntry(log.getId(), log.getUserId(), log.getAction(), log.getResourceType(),
                    log.getResourceId(), log.getDetails(), log.getIpAddress(), log.getUserAgent(),
                    log.getRequestId(), log.getCreatedAt());
        }
    }
}
