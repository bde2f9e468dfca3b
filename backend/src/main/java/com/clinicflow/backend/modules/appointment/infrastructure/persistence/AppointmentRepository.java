package com.clinicflow.backend.modules.appointment.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.modules.appointment.domain.Appointment;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;
import com.clinicflow.backend.modules.availability.domain.TimeWindow;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppointmentRepository extends JpaRepository<Appointment, UUID>, AppointmentRepositoryCustom {

    String ACTIVE_SLOT_CONSTRAINT = "uq_appointment_active_slot";

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Appointment a where a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") UUID id);

    Optional<Appointment> findByVisitId(UUID visitId);

    boolean existsByRescheduledFromId(UUID rescheduledFromId);

    boolean existsByPatientIdAndPractitionerIdAndAppointmentDateAndStatusIn(
            UUID patientId,
            UUID practitionerId,
            LocalDate appointmentDate,
            Collection<AppointmentStatus> statuses
    );

    @Query("""
            select new com.clinicflow.backend.modules.availability.domain.TimeWindow(a.appointmentTime, a.slotEndTime)
              from Appointment a
             where a.practitionerId = :practitionerId
               and a.appointmentDate = :date
               and a.status in :statuses
            """)
    List<TimeWindow> findBookedWindows(@Param("practitionerId") UUID practitionerId,
                                       @Param("date") LocalDate date,
                                       @Param("statuses") Collection<AppointmentStatus> statuses);
}
