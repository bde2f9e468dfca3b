package com.clinicflow.backend.modules.queue.presentation;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.global.pagination.CursorPage;
import com.clinicflow.backend.global.security.SecurityUtils;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.queue.application.OpdQueueQueryService;
import com.clinicflow.backend.modules.queue.application.OpdQueueQueryService.QueueQuery;
import com.clinicflow.backend.modules.queue.application.QueueReconciliationService;
import com.clinicflow.backend.modules.queue.application.QueueReconciliationService.RebuildResult;
import com.clinicflow.backend.modules.queue.domain.QueueCounts;
import com.clinicflow.backend.modules.queue.presentation.dto.QueueCountsResponse;
import com.clinicflow.backend.modules.queue.presentation.dto.QueueEntryResponse;
import com.clinicflow.backend.modules.queue.presentation.dto.QueuePageResponse;
import com.clinicflow.backend.modules.queue.presentation.dto.RebuildResponse;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/queue")
public class QueueController {

    private static final Set<VisitStatus> DEFAULT_STATUSES = EnumSet.of(VisitStatus.WAITING, VisitStatus.IN_PROGRESS);

    private final OpdQueueQueryService queryService;
    private final QueueReconciliationService reconciliationService;
    private final AccessGuard accessGuard;
    private final Duration defaultRetention;

    public QueueController(
            OpdQueueQueryService queryService,
            QueueReconciliationService reconciliationService,
            AccessGuard accessGuard,
            @Value("${app.queue.cleanup-retention:PT24H}") Duration defaultRetention
    ) {
        this.queryService = queryService;
        this.reconciliationService = reconciliationService;
        this.accessGuard = accessGuard;
        this.defaultRetention = defaultRetention;
    }

    @Operation(
            summary = "Live OPD queue",
            description = "Ordered by priority (EMERGENCY first), then check-in time. Reads the queue snapshot only."
    )
    @GetMapping
    public ResponseEntity<QueuePageResponse> getQueue(
            @RequestParam(name = "departmentId", required = false) List<UUID> departmentIds,
            @RequestParam(name = "practitionerId", required = false) UUID practitionerId,
            @RequestParam(name = "status", required = false) Set<VisitStatus> statuses,
            @RequestParam(name = "cursor", required = false) String cursor,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        Set<VisitStatus> effectiveStatuses = statuses == null || statuses.isEmpty() ? DEFAULT_STATUSES : statuses;
        CursorPage<QueueEntryResponse> page = queryService.getQueue(SecurityUtils.getCurrentSession(),
                        new QueueQuery(departmentIds, practitionerId, effectiveStatuses, cursor, limit))
                .map(QueueEntryResponse::from);
        return ResponseEntity.ok(new QueuePageResponse(page.items(), page.nextCursor(), page.hasMore()));
    }

    @GetMapping("/counts")
    public ResponseEntity<QueueCountsResponse> getCounts(
            @RequestParam(name = "departmentId", required = false) List<UUID> departmentIds,
            @RequestParam(name = "practitionerId", required = false) UUID practitionerId
    ) {
        QueueCounts counts = queryService.getQueueCounts(SecurityUtils.getCurrentSession(), departmentIds, practitionerId);
        return ResponseEntity.ok(new QueueCountsResponse(counts.waiting(), counts.inProgress(), counts.total()));
    }

    @Operation(summary = "Rebuild the queue snapshot of the caller's tenant")
    @PostMapping("/rebuild")
    public ResponseEntity<RebuildResponse> rebuild() {
        SessionContext session = SecurityUtils.getCurrentSession();
        accessGuard.require(session, Permission.QUEUE_MANAGE);
        RebuildResult result = reconciliationService.rebuildForTenant(session.tenantId());
        return ResponseEntity.ok(new RebuildResponse(result.upserted(), result.removed(), result.failed()));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Integer>> cleanup(
            @RequestParam(name = "retention", required = false) String retention
    ) {
        SessionContext session = SecurityUtils.getCurrentSession();
        accessGuard.require(session, Permission.QUEUE_MANAGE);
        int deleted = reconciliationService.cleanup(session.tenantId(), parseRetention(retention));
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    private Duration parseRetention(String retention) {
        if (!StringUtils.hasText(retention)) {
            return defaultRetention;
        }
        try {
            Duration parsed = Duration.parse(retention);
            if (parsed.isNegative()) {
                throw new ProblemException(ErrorCode.VALIDATION_ERROR, "retention must not be negative");
            }
            return parsed;
        } catch (DateTimeParseException ex) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "retention must be an ISO-8601 duration");
        }
    }
}
