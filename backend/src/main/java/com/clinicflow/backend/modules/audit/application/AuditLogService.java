package com.clinicflow.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.clinicflow.backend.global.web.RequestIdFilter;
import com.clinicflow.backend.modules.audit.domain.AuditLog;
import com.clinicflow.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Audit trail of state-changing operations. Audit writes never fail the business operation.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Writes the entry once the surrounding transaction commits, so rolled-back operations leave
     * no trace. Without an active transaction the entry is written immediately.
     */
    public void recordAfterCommit(AuditLogCommand command) {
        AuditLogCommand resolved = command.correlationId() != null
                ? command
                : command.withCorrelationId(RequestIdFilter.currentRequestUuid().orElse(null));
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            persistQuietly(resolved);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                persistQuietly(resolved);
            }
        });
    }

    private void persistQuietly(AuditLogCommand command) {
        try {
            requiresNew.executeWithoutResult(status -> auditLogRepository.save(toEntity(command)));
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Audit] failed to record {} {}:{}", command.actionType(), command.resourceType(),
                    command.resourceKey(), ex);
        }
    }

    private AuditLog toEntity(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        return AuditLog.entry(
                command.tenantId(),
                command.actionType(),
                command.resourceType(),
                command.resourceKey(),
                command.actorUserId(),
                command.correlationId(),
                command.detail(),
                OffsetDateTime.now(clock)
        );
    }

    public record AuditLogCommand(
            UUID tenantId,
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            UUID correlationId,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand of(UUID tenantId, String actionType, String resourceType, UUID resourceId,
                                         UUID actorUserId, Map<String, Object> detail) {
            return new AuditLogCommand(tenantId, actionType, resourceType, resourceId.toString(), actorUserId, null,
                    detail);
        }

        AuditLogCommand withCorrelationId(UUID correlationId) {
            return new AuditLogCommand(tenantId, actionType, resourceType, resourceKey, actorUserId, correlationId,
                    detail);
        }
    }
}
