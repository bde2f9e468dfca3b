package com.clinicflow.backend.modules.queue.application;

import java.time.Duration;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class QueueReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(QueueReconciliationScheduler.class);

    private final QueueReconciliationService reconciliationService;
    private final Duration cleanupRetention;

    public QueueReconciliationScheduler(
            QueueReconciliationService reconciliationService,
            @Value("${app.queue.cleanup-retention:PT24H}") Duration cleanupRetention
    ) {
        this.reconciliationService = reconciliationService;
        this.cleanupRetention = cleanupRetention;
    }

    @Scheduled(fixedDelayString = "${app.queue.reconcile-interval:PT15M}",
            initialDelayString = "${app.queue.reconcile-initial-delay:PT1M}")
    public void reconcile() {
        for (UUID tenantId : reconciliationService.tenantsToReconcile()) {
            try {
                reconciliationService.rebuildForTenant(tenantId);
                reconciliationService.cleanup(tenantId, cleanupRetention);
            } catch (RuntimeException ex) {
                log.warn("[ALERT][QueueReconcile] tenant={} detail={}", tenantId, ex.getMessage(), ex);
            }
        }
    }
}
