package com.clinicflow.backend.modules.queue.infrastructure.persistence;

import java.util.Set;
import java.util.UUID;

import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.queue.domain.QueueCursor;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;

public record QueueSearchCondition(
        UUID tenantId,
        DepartmentFilter departmentFilter,
        UUID practitionerId,
        Set<VisitStatus> statuses,
        QueueCursor afterPosition,
        UUID afterId,
        int limit
) {
}
