package com.tasklens.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklens.observability.EventLog;
import com.tasklens.observability.RequestContext;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Writes audit rows. Calls join the caller's transaction, so an audit row is committed
 * together with the change it describes or not at all.
 */
@Service
public class AuditService {

    private static final EventLog events = EventLog.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public AuditService(AuditLogRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Stamps the entry with the request's correlation id and client details, then saves it.
     */
    @Transactional
    public AuditLog record(RequestContext context, AuditLog entry) {
        entry.withRequestId(context.correlationId())
                .withClient(context.clientAddress(), context.userAgent());
        AuditLog saved = auditLogRepository.save(entry);
        events.debug(context, "Audit entry written",
                "action", saved.getAction(),
                "resource_type", saved.getResourceType(),
                "resource_id", saved.getResourceId());
        return saved;
    }

    @Transactional
    public AuditLog record(RequestContext context, String action, Long userId,
                           String resourceType, Object resourceId, Map<String, ?> details) {
        return record(context, AuditLog.of(action)
                .withUser(userId)
                .withResource(resourceType, resourceId)
                .withDetails(toJson(details)));
    }

    @Transactional
    public AuditLog recordAuthFailure(RequestContext context, String action, int status) {
        return record(context, AuditLog.of(action)
                .withUser(context.userId().orElse(null))
                .withResource("endpoint", context.method() + " " + context.path())
                .withDetails(toJson(Map.of("status_code", status))));
    }

    @Transactional(readOnly = true)
    public Page<AuditLog> findRecent(Pageable pageable) {
        return auditLogRepository.findAllByOrderByCreatedAtDescIdDesc(pageable);
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit details are not serializable", e);
        }
    }
}
