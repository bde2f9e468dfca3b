package com.clinicflow.backend.modules.queue.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.modules.queue.domain.SyncOutcome;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.OpdQueueSnapshotRepository;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.QueueSyncFailureRepository;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;
import com.clinicflow.backend.modules.visit.domain.VisitType;
import com.clinicflow.backend.modules.visit.infrastructure.persistence.VisitRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Repairs drift between visits and the queue snapshot table. Every visit is re-synced in its
 * own transaction so one bad row does not abort the tenant.
 */
@Service
public class QueueReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(QueueReconciliationService.class);
    private static final Set<VisitStatus> QUEUED_STATUSES = Set.of(VisitStatus.WAITING, VisitStatus.IN_PROGRESS);

    private final OpdQueueSynchronizer synchronizer;
    private final VisitRepository visitRepository;
    private final OpdQueueSnapshotRepository snapshotRepository;
    private final QueueSyncFailureRepository failureRepository;
    private final Clock clock;

    public QueueReconciliationService(
            OpdQueueSynchronizer synchronizer,
            VisitRepository visitRepository,
            OpdQueueSnapshotRepository snapshotRepository,
            QueueSyncFailureRepository failureRepository,
            Clock clock
    ) {
        this.synchronizer = synchronizer;
        this.visitRepository = visitRepository;
        this.snapshotRepository = snapshotRepository;
        this.failureRepository = failureRepository;
        this.clock = clock;
    }

    public RebuildResult rebuildForTenant(UUID tenantId) {
        Set<UUID> visitIds = new LinkedHashSet<>();
        visitIds.addAll(visitRepository.findIdsByTenantAndTypeAndStatusIn(tenantId, VisitType.OPD, QUEUED_STATUSES));
        visitIds.addAll(snapshotRepository.findVisitIdsByTenantId(tenantId));
        visitIds.addAll(failureRepository.findUnresolvedVisitIds(tenantId));

        int upserted = 0;
        int removed = 0;
        int failed = 0;
        for (UUID visitId : visitIds) {
            try {
                SyncOutcome outcome = synchronizer.syncSnapshot(visitId);
                if (outcome == SyncOutcome.UPSERTED) {
                    upserted++;
                } else if (outcome == SyncOutcome.REMOVED) {
                    removed++;
                }
            } catch (RuntimeException ex) {
                failed++;
                log.warn("[ALERT][QueueRebuild] tenant={} visit={} detail={}", tenantId, visitId, ex.getMessage(), ex);
            }
        }
        log.info("Queue rebuilt tenant={} upserted={} removed={} failed={}", tenantId, upserted, removed, failed);
        return new RebuildResult(upserted, removed, failed);
    }

    @Transactional
    public int cleanup(UUID tenantId, Duration retention) {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(retention);
        int deleted = snapshotRepository.deleteFinishedBefore(tenantId, cutoff)
                + snapshotRepository.deleteOrphansBefore(tenantId, cutoff);
        if (deleted > 0) {
            log.info("Queue cleanup tenant={} cutoff={} deleted={}", tenantId, cutoff, deleted);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<UUID> tenantsToReconcile() {
        Set<UUID> tenants = new LinkedHashSet<>();
        tenants.addAll(visitRepository.findTenantIdsWithVisits(VisitType.OPD, QUEUED_STATUSES));
        tenants.addAll(snapshotRepository.findDistinctTenantIds());
        tenants.addAll(failureRepository.findTenantIdsWithUnresolved());
        return List.copyOf(tenants);
    }

    public record RebuildResult(int upserted, int removed, int failed) {
    }
}
