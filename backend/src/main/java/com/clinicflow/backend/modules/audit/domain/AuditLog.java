package com.clinicflow.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Append-only audit entry. Rows are never updated once written.
 */
@Entity
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "action_type", nullable = false, updatable = false, length = 64)
    private String actionType;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_key", nullable = false, updatable = false, length = 128)
    private String resourceKey;

    @Column(name = "actor_user_id", updatable = false, columnDefinition = "uuid")
    private UUID actorUserId;

    @Column(name = "correlation_id", updatable = false, columnDefinition = "uuid")
    private UUID correlationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detail", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    private AuditLog(UUID tenantId, String actionType, String resourceType, String resourceKey, UUID actorUserId,
                     UUID correlationId, Map<String, Object> detail, OffsetDateTime createdAt) {
        this.tenantId = tenantId;
        this.actionType = actionType;
        this.resourceType = resourceType;
        this.resourceKey = resourceKey;
        this.actorUserId = actorUserId;
        this.correlationId = correlationId;
        this.detail = detail == null || detail.isEmpty() ? null : new HashMap<>(detail);
        this.createdAt = createdAt;
    }

    public static AuditLog entry(UUID tenantId, String actionType, String resourceType, String resourceKey,
                                 UUID actorUserId, UUID correlationId, Map<String, Object> detail,
                                 OffsetDateTime createdAt) {
        return new AuditLog(tenantId, actionType, resourceType, resourceKey, actorUserId, correlationId, detail,
                createdAt);
    }

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public String getActionType() {
        return actionType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public UUID getActorUserId() {
        return actorUserId;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
