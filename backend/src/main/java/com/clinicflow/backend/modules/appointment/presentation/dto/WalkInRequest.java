package com.clinicflow.backend.modules.appointment.presentation.dto;

import java.util.UUID;

import com.clinicflow.backend.modules.visit.domain.VisitPriority;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record WalkInRequest(
        @NotNull UUID patientId,
        @NotNull UUID practitionerId,
        @NotNull UUID departmentId,
        VisitPriority priority,
        @Size(max = 500) String chiefComplaint
) {
}
