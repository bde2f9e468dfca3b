package com.clinicflow.backend.modules.appointment.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.clinicflow.backend.modules.appointment.domain.Appointment;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;

public record BookingResponse(
        UUID appointmentId,
        int tokenNumber,
        AppointmentStatus status,
        LocalDate appointmentDate,
        LocalTime appointmentTime,
        UUID visitId
) {

    public static BookingResponse from(Appointment appointment) {
        return new BookingResponse(
                appointment.getId(),
                appointment.getTokenNumber(),
                appointment.getStatus(),
                appointment.getAppointmentDate(),
                appointment.getAppointmentTime(),
                appointment.getVisitId()
        );
    }
}
