package com.clinicflow.backend.modules.queue.infrastructure.persistence;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.clinicflow.backend.modules.access.domain.DepartmentFilter;
import com.clinicflow.backend.modules.queue.domain.OpdQueueSnapshot;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;

public interface OpdQueueSnapshotRepositoryCustom {

    /**
     * Queue page ordered by {@code priority_rank DESC, check_in_time ASC, id ASC};
     * returns up to {@code limit + 1} rows.
     */
    List<OpdQueueSnapshot> searchQueue(QueueSearchCondition condition);

    Map<VisitStatus, Long> countByStatus(UUID tenantId, DepartmentFilter departmentFilter, UUID practitionerId);
}
