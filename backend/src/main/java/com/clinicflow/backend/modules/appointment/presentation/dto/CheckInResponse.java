package com.clinicflow.backend.modules.appointment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;

public record CheckInResponse(
        UUID appointmentId,
        UUID visitId,
        int tokenNumber,
        AppointmentStatus status,
        OffsetDateTime checkedInAt
) {
}
