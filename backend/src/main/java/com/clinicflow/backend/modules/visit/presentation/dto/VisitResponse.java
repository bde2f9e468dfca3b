package com.clinicflow.backend.modules.visit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicflow.backend.modules.visit.domain.Visit;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;
import com.clinicflow.backend.modules.visit.domain.VisitType;

public record VisitResponse(
        UUID id,
        UUID patientId,
        UUID practitionerId,
        UUID departmentId,
        UUID appointmentId,
        VisitType visitType,
        VisitStatus status,
        VisitPriority priority,
        Integer tokenNumber,
        OffsetDateTime checkInTime,
        OffsetDateTime startTime,
        OffsetDateTime endTime
) {

    public static VisitResponse from(Visit visit) {
        return new VisitResponse(
                visit.getId(),
                visit.getPatientId(),
                visit.getPractitionerId(),
                visit.getDepartmentId(),
                visit.getAppointmentId(),
                visit.getVisitType(),
                visit.getStatus(),
                visit.getPriority(),
                visit.getTokenNumber(),
                visit.getCheckInTime(),
                visit.getStartTime(),
                visit.getEndTime()
        );
    }
}
