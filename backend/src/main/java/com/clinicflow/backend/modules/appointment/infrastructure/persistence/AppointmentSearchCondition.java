package com.clinicflow.backend.modules.appointment.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.global.pagination.Cursor;
import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;

public record AppointmentSearchCondition(
        UUID tenantId,
        DepartmentFilter departmentFilter,
        UUID practitionerId,
        UUID patientId,
        LocalDate appointmentDate,
        Set<AppointmentStatus> statuses,
        Cursor after,
        int limit
) {
}
