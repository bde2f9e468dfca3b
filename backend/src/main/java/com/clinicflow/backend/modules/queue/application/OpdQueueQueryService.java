package com.clinicflow.backend.modules.queue.application;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.global.pagination.Cursor;
import com.clinicflow.backend.global.pagination.CursorCodec;
import com.clinicflow.backend.global.pagination.CursorPage;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.queue.domain.OpdQueueSnapshot;
import com.clinicflow.backend.modules.queue.domain.QueueCounts;
import com.clinicflow.backend.modules.queue.domain.QueueCursor;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.OpdQueueSnapshotRepository;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.QueueSearchCondition;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class OpdQueueQueryService {

    private final OpdQueueSnapshotRepository snapshotRepository;
    private final AccessGuard accessGuard;
    private final CursorCodec cursorCodec;

    public OpdQueueQueryService(
            OpdQueueSnapshotRepository snapshotRepository,
            AccessGuard accessGuard,
            CursorCodec cursorCodec
    ) {
        this.snapshotRepository = snapshotRepository;
        this.accessGuard = accessGuard;
        this.cursorCodec = cursorCodec;
    }

    public CursorPage<OpdQueueSnapshot> getQueue(SessionContext session, QueueQuery query) {
        accessGuard.require(session, Permission.VISIT_VIEW);
        DepartmentFilter filter = accessGuard.buildFilter(session, query.departmentIds());
        if (filter.matchesNothing()) {
            return CursorPage.empty();
        }

        int limit = CursorPage.clampLimit(query.limit());
        Optional<Cursor> cursor = cursorCodec.decodeRequired(query.cursor());
        QueueCursor position = cursor
                .map(c -> QueueCursor.parse(c.sortValue())
                        .orElseThrow(() -> new ProblemException(ErrorCode.VALIDATION_ERROR, "INVALID_CURSOR")))
                .orElse(null);

        QueueSearchCondition condition = new QueueSearchCondition(
                session.tenantId(),
                filter,
                query.practitionerId(),
                query.statuses(),
                position,
                cursor.map(Cursor::id).orElse(null),
                limit
        );
        return CursorPage.fromOverfetch(snapshotRepository.searchQueue(condition), limit,
                entry -> cursorCodec.encode(QueueCursor.of(entry).toSortValue(), entry.getId()));
    }

    public QueueCounts getQueueCounts(SessionContext session, Collection<UUID> departmentIds, UUID practitionerId) {
        accessGuard.require(session, Permission.VISIT_VIEW);
        DepartmentFilter filter = accessGuard.buildFilter(session, departmentIds);
        Map<VisitStatus, Long> counts = snapshotRepository.countByStatus(session.tenantId(), filter, practitionerId);
        return new QueueCounts(
                counts.getOrDefault(VisitStatus.WAITING, 0L),
                counts.getOrDefault(VisitStatus.IN_PROGRESS, 0L)
        );
    }

    public record QueueQuery(
            Collection<UUID> departmentIds,
            UUID practitionerId,
            Set<VisitStatus> statuses,
            String cursor,
            Integer limit
    ) {
    }
}
