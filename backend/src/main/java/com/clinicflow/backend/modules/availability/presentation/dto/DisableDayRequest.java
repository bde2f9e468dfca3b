package com.clinicflow.backend.modules.availability.presentation.dto;

import java.time.DayOfWeek;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record DisableDayRequest(
        @NotNull UUID departmentId,
        @NotNull DayOfWeek dayOfWeek
) {
}
