package com.tasklens.audit;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_logs_user_id", columnList = "user_id"),
        @Index(name = "idx_audit_logs_created_at", columnList = "created_at")
})
public class AuditLog {

    public static final String ACTION_USER_REGISTRATION = "user_registration";
    public static final String ACTION_USER_LOGIN = "user_login";
    public static final String ACTION_TASK_CREATED = "task_created";
    public static final String ACTION_TASK_UPDATED = "task_updated";
    public static final String ACTION_TASK_DELETED = "task_deleted";
    public static final String ACTION_AUTH_FAILED = "auth_failed";
    public static final String ACTION_AUTH_DENIED = "auth_denied";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private Long userId;

    @Column(nullable = false, length = 100)
    private String action;

    @Column(name = "resource_type", length = 50)
    private String resourceType;

    @Column(name = "resource_id", length = 100)
    private String resourceId;

    @Column(columnDefinition = "text")
    private String details;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "request_id", length = 64)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected AuditLog() {}

    public static AuditLog of(String action) {
        AuditLog entry = new AuditLog();
        entry.action = action;
        return entry;
    }

    public AuditLog withUser(Long userId) { this.userId = userId; return this; }
    public AuditLog withResource(String type, Object id) {
        this.resourceType = type;
        this.resourceId = id != null ? String.valueOf(id) : null;
        return this;
    }
    public AuditLog withDetails(String details) { this.details = details; return this; }
    public AuditLog withClient(String ipAddress, String userAgent) {
        this.ipAddress = ipAddress;
        this.userAgent = userAgent != null && userAgent.length() > 500 ? userAgent.substring(0, 500) : userAgent;
        return this;
    }
    public AuditLog withRequestId(String requestId) { this.requestId = requestId; return this; }

    public Long getId() { return id; }
    public Long getUserId() { return userId; }
    public String getAction() { return action; }
    public String getResourceType() { return resourceType; }
    public String getResourceId() { return resourceId; }
    public String getDetails() { return details; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public String getRequestId() { return requestId; }
    public Instant getCreatedAt() { return createdAt; }
}
