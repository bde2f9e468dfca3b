package com.clinicflow.backend.modules.appointment.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record RescheduleAppointmentRequest(
        @NotNull LocalDate newDate,
        @NotNull LocalTime newTime,
        UUID newPractitionerId
) {
}
