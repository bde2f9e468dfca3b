package com.clinicflow.backend.modules.availability.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import com.clinicflow.backend.global.common.ResourceStatus;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Partial update; null fields keep their current value. {@code expectedVersion} is the
 * version the caller last read.
 */
public record UpdateAvailabilityRequest(
        @NotNull Long expectedVersion,
        LocalTime startTime,
        LocalTime endTime,
        @Min(5) @Max(240) Integer slotDurationMinutes,
        Boolean allowWalkIn,
        LocalDate effectiveTo,
        ResourceStatus status
) {
}
