package com.clinicflow.backend.modules.availability.infrastructure.persistence;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.global.common.ResourceStatus;
import com.clinicflow.backend.modules.availability.domain.AvailabilityTemplate;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AvailabilityTemplateRepository extends JpaRepository<AvailabilityTemplate, UUID> {

    Optional<AvailabilityTemplate> findByIdAndTenantId(UUID id, UUID tenantId);

    List<AvailabilityTemplate> findByPractitionerIdAndTenantId(UUID practitionerId, UUID tenantId);

    List<AvailabilityTemplate> findByPractitionerIdAndStatus(UUID practitionerId, ResourceStatus status);

    List<AvailabilityTemplate> findByPractitionerIdAndDayOfWeekAndStatus(
            UUID practitionerId,
            DayOfWeek dayOfWeek,
            ResourceStatus status
    );

    List<AvailabilityTemplate> findByPractitionerIdAndDepartmentIdAndDayOfWeekAndStatus(
            UUID practitionerId,
            UUID departmentId,
            DayOfWeek dayOfWeek,
            ResourceStatus status
    );
}
