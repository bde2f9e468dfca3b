package com.clinicflow.backend.modules.availability.presentation.dto;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record CreateAvailabilityRequest(
        @NotNull UUID departmentId,
        @NotEmpty List<@NotNull DayOfWeek> daysOfWeek,
        @NotNull LocalTime startTime,
        @NotNull LocalTime endTime,
        @NotNull @Min(5) @Max(240) Integer slotDurationMinutes,
        Boolean allowWalkIn,
        LocalDate effectiveFrom,
        LocalDate effectiveTo
) {
}
