package com.clinicflow.backend.modules.visit.presentation.dto;

import com.clinicflow.backend.modules.visit.domain.VisitPriority;

import jakarta.validation.constraints.NotNull;

public record UpdateVisitPriorityRequest(
        @NotNull VisitPriority priority
) {
}
