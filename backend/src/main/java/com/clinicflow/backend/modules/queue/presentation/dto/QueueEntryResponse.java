package com.clinicflow.backend.modules.queue.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicflow.backend.modules.queue.domain.OpdQueueSnapshot;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;

public record QueueEntryResponse(
        UUID visitId,
        Integer tokenNumber,
        UUID patientId,
        String patientName,
        String patientMrn,
        String patientPhone,
        String patientGender,
        LocalDate patientDateOfBirth,
        UUID practitionerId,
        String practitionerName,
        UUID departmentId,
        String departmentName,
        VisitPriority priority,
        VisitStatus status,
        OffsetDateTime checkInTime,
        OffsetDateTime startTime
) {

    public static QueueEntryResponse from(OpdQueueSnapshot entry) {
        return new QueueEntryResponse(
                entry.getVisitId(),
                entry.getTokenNumber(),
                entry.getPatientId(),
                entry.getPatientName(),
                entry.getPatientMrn(),
                entry.getPatientPhone(),
                entry.getPatientGender(),
                entry.getPatientDateOfBirth(),
                entry.getPractitionerId(),
                entry.getPractitionerName(),
                entry.getDepartmentId(),
                entry.getDepartmentName(),
                entry.getPriority(),
                entry.getStatus(),
                entry.getCheckInTime(),
                entry.getStartTime()
        );
    }
}
