package com.clinicflow.backend.modules.appointment.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.clinicflow.backend.modules.appointment.domain.BookingSource;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateAppointmentRequest(
        @NotNull UUID patientId,
        @NotNull UUID practitionerId,
        @NotNull UUID departmentId,
        @NotNull LocalDate appointmentDate,
        @NotNull LocalTime appointmentTime,
        VisitPriority priority,
        BookingSource bookingSource,
        @Size(max = 500) String chiefComplaint
) {
}
