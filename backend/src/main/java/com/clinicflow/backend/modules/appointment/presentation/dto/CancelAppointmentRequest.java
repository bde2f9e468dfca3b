package com.clinicflow.backend.modules.appointment.presentation.dto;

import jakarta.validation.constraints.Size;

public record CancelAppointmentRequest(
        @Size(max = 500) String reason
) {
}
