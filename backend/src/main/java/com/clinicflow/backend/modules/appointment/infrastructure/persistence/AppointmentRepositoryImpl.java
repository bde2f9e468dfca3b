package com.clinicflow.backend.modules.appointment.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.clinicflow.backend.global.pagination.KeysetPredicate;
import com.clinicflow.backend.global.pagination.KeysetPredicate.Direction;
import com.clinicflow.backend.global.pagination.KeysetPredicate.SortKey;
import com.clinicflow.backend.modules.appointment.domain.Appointment;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;

import org.springframework.stereotype.Repository;
import org.springframework.util.CollectionUtils;

@Repository
public class AppointmentRepositoryImpl implements AppointmentRepositoryCustom {

    private static final List<SortKey> ORDER = List.of(
            new SortKey("a.created_at", Direction.DESC, "cursorCreatedAt"),
            new SortKey("a.id", Direction.DESC, "cursorId")
    );

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Appointment> searchAppointments(AppointmentSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        if (condition.departmentFilter().matchesNothing()) {
            return List.of();
        }

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        whereClauses.add("a.tenant_id = :tenantId");
        params.put("tenantId", condition.tenantId());
        condition.departmentFilter().appendTo(whereClauses, params, "a.department_id", "departmentIds");

        if (condition.practitionerId() != null) {
            whereClauses.add("a.practitioner_id = :practitionerId");
            params.put("practitionerId", condition.practitionerId());
        }
        if (condition.patientId() != null) {
            whereClauses.add("a.patient_id = :patientId");
            params.put("patientId", condition.patientId());
        }
        if (condition.appointmentDate() != null) {
            whereClauses.add("a.appointment_date = :appointmentDate");
            params.put("appointmentDate", condition.appointmentDate());
        }
        if (!CollectionUtils.isEmpty(condition.statuses())) {
            whereClauses.add("a.status in (:statuses)");
            params.put("statuses", condition.statuses().stream().map(Enum::name).toList());
        }
        if (condition.after() != null) {
            whereClauses.add(KeysetPredicate.after(ORDER));
            params.put("cursorCreatedAt", OffsetDateTime.parse(condition.after().sortValue()));
            params.put("cursorId", condition.after().id());
        }

        String sql = "SELECT a.* FROM appointment a WHERE " + String.join(" AND ", whereClauses)
                + KeysetPredicate.orderBy(ORDER) + " LIMIT :limit";

        Query query = entityManager.createNativeQuery(sql, Appointment.class);
        params.forEach(query::setParameter);
        query.setParameter("limit", condition.limit() + 1);

        @SuppressWarnings("unchecked")
        List<Appointment> rows = query.getResultList();
        return rows;
    }
}
