package com.clinicflow.backend.modules.queue.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "queue_sync_failure")
public class QueueSyncFailure {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "visit_id", nullable = false, columnDefinition = "uuid")
    private UUID visitId;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "failed_at", nullable = false)
    private OffsetDateTime failedAt;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    protected QueueSyncFailure() {
    }

    public QueueSyncFailure(UUID tenantId, UUID visitId, String errorMessage, OffsetDateTime failedAt) {
        this.tenantId = tenantId;
        this.visitId = visitId;
        this.errorMessage = errorMessage == null || errorMessage.length() <= 1000
                ? errorMessage
                : errorMessage.substring(0, 1000);
        this.failedAt = failedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getVisitId() {
        return visitId;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public OffsetDateTime getResolvedAt() {
        return resolvedAt;
    }
}
