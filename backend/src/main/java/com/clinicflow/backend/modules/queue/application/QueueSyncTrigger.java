package com.clinicflow.backend.modules.queue.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.clinicflow.backend.modules.queue.domain.QueueSyncFailure;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.QueueSyncFailureRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs the queue sync for a visit once the business transaction has committed. A failed sync
 * never rolls back the committed change; it is logged, recorded, and repaired by reconciliation.
 */
@Component
public class QueueSyncTrigger {

    private static final Logger log = LoggerFactory.getLogger(QueueSyncTrigger.class);
    private static final String PENDING_KEY = QueueSyncTrigger.class.getName() + ".pending";

    private final OpdQueueSynchronizer synchronizer;
    private final QueueSyncFailureRepository failureRepository;
    private final TransactionTemplate failureTransaction;
    private final Clock clock;

    public QueueSyncTrigger(
            OpdQueueSynchronizer synchronizer,
            QueueSyncFailureRepository failureRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.synchronizer = synchronizer;
        this.failureRepository = failureRepository;
        this.failureTransaction = new TransactionTemplate(transactionManager);
        this.failureTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void requestSync(UUID tenantId, UUID visitId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            runSync(tenantId, visitId);
            return;
        }
        Map<UUID, UUID> pending = pendingForTransaction();
        if (pending.putIfAbsent(visitId, tenantId) != null) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                runSync(tenantId, visitId);
            }
        });
    }

    void runSync(UUID tenantId, UUID visitId) {
        try {
            synchronizer.syncSnapshot(visitId);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][QueueSync] tenant={} visit={} detail={}", tenantId, visitId, ex.getMessage(), ex);
            recordFailure(tenantId, visitId, ex);
        }
    }

    private void recordFailure(UUID tenantId, UUID visitId, RuntimeException cause) {
        try {
            failureTransaction.executeWithoutResult(status -> failureRepository.save(
                    new QueueSyncFailure(tenantId, visitId, cause.getMessage(), OffsetDateTime.now(clock))));
        } catch (RuntimeException ex) {
            log.error("[ALERT][QueueSync] failed to record sync failure visit={}", visitId, ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<UUID, UUID> pendingForTransaction() {
        Map<UUID, UUID> pending = (Map<UUID, UUID>) TransactionSynchronizationManager.getResource(PENDING_KEY);
        if (pending == null) {
            pending = new LinkedHashMap<>();
            TransactionSynchronizationManager.bindResource(PENDING_KEY, pending);
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    TransactionSynchronizationManager.unbindResourceIfPossible(PENDING_KEY);
                }
            });
        }
        return pending;
    }
}
