package com.clinicflow.backend.modules.availability.presentation.dto;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.clinicflow.backend.global.common.ResourceStatus;
import com.clinicflow.backend.modules.availability.domain.AvailabilityTemplate;

public record AvailabilityTemplateResponse(
        UUID id,
        UUID practitionerId,
        UUID departmentId,
        DayOfWeek dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        int slotDurationMinutes,
        boolean allowWalkIn,
        LocalDate effectiveFrom,
        LocalDate effectiveTo,
        ResourceStatus status,
        long version
) {

    public static AvailabilityTemplateResponse from(AvailabilityTemplate template) {
        return new AvailabilityTemplateResponse(
                template.getId(),
                template.getPractitionerId(),
                template.getDepartmentId(),
                template.getDayOfWeek(),
                template.getStartTime(),
                template.getEndTime(),
                template.getSlotDurationMinutes(),
                template.isAllowWalkIn(),
                template.getEffectiveFrom(),
                template.getEffectiveTo(),
                template.getStatus(),
                template.getVersion()
        );
    }
}
