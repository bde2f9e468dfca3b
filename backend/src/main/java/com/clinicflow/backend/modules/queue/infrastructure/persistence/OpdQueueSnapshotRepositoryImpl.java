package com.clinicflow.backend.modules.queue.infrastructure.persistence;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.clinicflow.backend.global.pagination.KeysetPredicate;
import com.clinicflow.backend.global.pagination.KeysetPredicate.Direction;
import com.clinicflow.backend.global.pagination.KeysetPredicate.SortKey;
import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.queue.domain.OpdQueueSnapshot;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;

import org.springframework.stereotype.Repository;
import org.springframework.util.CollectionUtils;

@Repository
public class OpdQueueSnapshotRepositoryImpl implements OpdQueueSnapshotRepositoryCustom {

    private static final List<SortKey> QUEUE_ORDER = List.of(
            new SortKey("s.priority_rank", Direction.DESC, "cursorRank"),
            new SortKey("s.check_in_time", Direction.ASC, "cursorCheckIn"),
            new SortKey("s.id", Direction.ASC, "cursorId")
    );

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<OpdQueueSnapshot> searchQueue(QueueSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        if (condition.departmentFilter().matchesNothing()) {
            return List.of();
        }

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        applyScope(whereClauses, params, condition.tenantId(), condition.departmentFilter(), condition.practitionerId());

        if (!CollectionUtils.isEmpty(condition.statuses())) {
            whereClauses.add("s.status in (:statuses)");
            params.put("statuses", condition.statuses().stream().map(Enum::name).toList());
        }
        if (condition.afterPosition() != null && condition.afterId() != null) {
            whereClauses.add(KeysetPredicate.after(QUEUE_ORDER));
            params.put("cursorRank", condition.afterPosition().priorityRank());
            params.put("cursorCheckIn", condition.afterPosition().checkInTime());
            params.put("cursorId", condition.afterId());
        }

        String sql = "SELECT s.* FROM opd_queue_snapshot s WHERE " + String.join(" AND ", whereClauses)
                + KeysetPredicate.orderBy(QUEUE_ORDER) + " LIMIT :limit";

        Query query = entityManager.createNativeQuery(sql, OpdQueueSnapshot.class);
        params.forEach(query::setParameter);
        query.setParameter("limit", condition.limit() + 1);

        @SuppressWarnings("unchecked")
        List<OpdQueueSnapshot> rows = query.getResultList();
        return rows;
    }

    @Override
    public Map<VisitStatus, Long> countByStatus(UUID tenantId, DepartmentFilter departmentFilter, UUID practitionerId) {
        Map<VisitStatus, Long> counts = new EnumMap<>(VisitStatus.class);
        if (departmentFilter.matchesNothing()) {
            return counts;
        }
        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        applyScope(whereClauses, params, tenantId, departmentFilter, practitionerId);

        String sql = "SELECT s.status, COUNT(*) FROM opd_queue_snapshot s WHERE "
                + String.join(" AND ", whereClauses) + " GROUP BY s.status";
        Query query = entityManager.createNativeQuery(sql);
        params.forEach(query::setParameter);

        @SuppressWarnings("unchecked")
        List<Object[]> rows = query.getResultList();
        for (Object[] row : rows) {
            counts.put(VisitStatus.valueOf(row[0].toString()), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private static void applyScope(List<String> whereClauses, Map<String, Object> params, UUID tenantId,
                                   DepartmentFilter departmentFilter, UUID practitionerId) {
        whereClauses.add("s.tenant_id = :tenantId");
        params.put("tenantId", tenantId);
        departmentFilter.appendTo(whereClauses, params, "s.department_id", "departmentIds");
        if (practitionerId != null) {
            whereClauses.add("s.practitioner_id = :practitionerId");
            params.put("practitionerId", practitionerId);
        }
    }
}
