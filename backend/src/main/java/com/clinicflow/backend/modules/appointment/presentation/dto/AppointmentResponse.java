package com.clinicflow.backend.modules.appointment.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicflow.backend.modules.appointment.domain.Appointment;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;
import com.clinicflow.backend.modules.appointment.domain.BookingSource;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;

public record AppointmentResponse(
        UUID id,
        UUID patientId,
        UUID practitionerId,
        UUID departmentId,
        LocalDate appointmentDate,
        LocalTime appointmentTime,
        LocalTime slotEndTime,
        AppointmentStatus status,
        VisitPriority priority,
        BookingSource bookingSource,
        int tokenNumber,
        String chiefComplaint,
        String cancelReason,
        OffsetDateTime cancelledAt,
        OffsetDateTime checkedInAt,
        UUID rescheduledFromId,
        UUID visitId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AppointmentResponse from(Appointment appointment) {
        return new AppointmentResponse(
                appointment.getId(),
                appointment.getPatientId(),
                appointment.getPractitionerId(),
                appointment.getDepartmentId(),
                appointment.getAppointmentDate(),
                appointment.getAppointmentTime(),
                appointment.getSlotEndTime(),
                appointment.getStatus(),
                appointment.getPriority(),
                appointment.getBookingSource(),
                appointment.getTokenNumber(),
                appointment.getChiefComplaint(),
                appointment.getCancelReason(),
                appointment.getCancelledAt(),
                appointment.getCheckedInAt(),
                appointment.getRescheduledFromId(),
                appointment.getVisitId(),
                appointment.getCreatedAt(),
                appointment.getUpdatedAt()
        );
    }
}
