package com.clinicflow.backend.modules.appointment.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.clinicflow.backend.global.common.time.ClinicCalendar;
import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.appointment.domain.Appointment;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;
import com.clinicflow.backend.modules.appointment.domain.BookingSource;
import com.clinicflow.backend.modules.appointment.infrastructure.persistence.AppointmentRepository;
import com.clinicflow.backend.modules.appointment.presentation.dto.BookingResponse;
import com.clinicflow.backend.modules.appointment.presentation.dto.CancelAppointmentRequest;
import com.clinicflow.backend.modules.appointment.presentation.dto.CheckInResponse;
import com.clinicflow.backend.modules.appointment.presentation.dto.CreateAppointmentRequest;
import com.clinicflow.backend.modules.appointment.presentation.dto.RescheduleAppointmentRequest;
import com.clinicflow.backend.modules.appointment.presentation.dto.WalkInRequest;
import com.clinicflow.backend.modules.audit.application.AuditLogService;
import com.clinicflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.clinicflow.backend.modules.availability.application.AvailabilityService;
import com.clinicflow.backend.modules.availability.domain.Slot;
import com.clinicflow.backend.modules.master.infrastructure.persistence.PatientRepository;
import com.clinicflow.backend.modules.master.infrastructure.persistence.PractitionerDepartmentRepository;
import com.clinicflow.backend.modules.queue.application.QueueSyncTrigger;
import com.clinicflow.backend.modules.visit.domain.Visit;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;
import com.clinicflow.backend.modules.visit.domain.VisitType;
import com.clinicflow.backend.modules.visit.infrastructure.persistence.VisitRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AppointmentBookingService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentBookingService.class);
    private static final String RESOURCE_TYPE = "APPOINTMENT";

    private final AppointmentRepository appointmentRepository;
    private final VisitRepository visitRepository;
    private final PatientRepository patientRepository;
    private final PractitionerDepartmentRepository practitionerDepartmentRepository;
    private final AvailabilityService availabilityService;
    private final DailyTokenAllocator tokenAllocator;
    private final AccessGuard accessGuard;
    private final QueueSyncTrigger queueSyncTrigger;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final ClinicCalendar clinicCalendar;

    public AppointmentBookingService(
            AppointmentRepository appointmentRepository,
            VisitRepository visitRepository,
            PatientRepository patientRepository,
            PractitionerDepartmentRepository practitionerDepartmentRepository,
            AvailabilityService availabilityService,
            DailyTokenAllocator tokenAllocator,
            AccessGuard accessGuard,
            QueueSyncTrigger queueSyncTrigger,
            AuditLogService auditLogService,
            Clock clock,
            ClinicCalendar clinicCalendar
    ) {
        this.appointmentRepository = appointmentRepository;
        this.visitRepository = visitRepository;
        this.patientRepository = patientRepository;
        this.practitionerDepartmentRepository = practitionerDepartmentRepository;
        this.availabilityService = availabilityService;
        this.tokenAllocator = tokenAllocator;
        this.accessGuard = accessGuard;
        this.queueSyncTrigger = queueSyncTrigger;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.clinicCalendar = clinicCalendar;
    }

    public BookingResponse create(SessionContext session, CreateAppointmentRequest request) {
        accessGuard.require(session, Permission.APPOINTMENT_CREATE, request.departmentId());
        if (request.appointmentDate().isBefore(clinicCalendar.today())) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "DATE_IN_PAST");
        }
        ensurePatientExists(session.tenantId(), request.patientId());
        ensurePractitionerInDepartment(request.practitionerId(), request.departmentId());

        BookingSource source = request.bookingSource() != null ? request.bookingSource() : BookingSource.RECEPTION;
        Slot slot = availabilityService.validateSlotBooking(session.tenantId(), request.practitionerId(),
                request.departmentId(), request.appointmentDate(), request.appointmentTime(),
                source == BookingSource.WALK_IN);
        ensureNoDuplicateBooking(request.patientId(), request.practitionerId(), request.appointmentDate());

        Appointment appointment = newAppointment(session, request.patientId(), request.practitionerId(),
                request.departmentId(), request.appointmentDate(), slot);
        appointment.setPriority(request.priority() != null ? request.priority() : VisitPriority.NORMAL);
        appointment.setBookingSource(source);
        appointment.setChiefComplaint(request.chiefComplaint());
        Appointment saved = reserve(appointment);

        log.debug("Appointment booked id={} practitioner={} slot={} {} token={}",
                saved.getId(), saved.getPractitionerId(), saved.getAppointmentDate(), slot.window(),
                saved.getTokenNumber());
        audit(session, "APPOINTMENT_CREATE", saved, null);
        return BookingResponse.from(saved);
    }

    /**
     * Books the next free walk-in slot of today and opens a WAITING visit right away.
     */
    public BookingResponse walkIn(SessionContext session, WalkInRequest request) {
        accessGuard.require(session, Permission.APPOINTMENT_CREATE, request.departmentId());
        ensurePatientExists(session.tenantId(), request.patientId());
        ensurePractitionerInDepartment(request.practitionerId(), request.departmentId());

        LocalDateTime now = clinicCalendar.now();
        Slot slot = availabilityService.nextWalkInSlot(session.tenantId(), request.practitionerId(),
                        request.departmentId(), now)
                .orElseThrow(() -> new ProblemException(ErrorCode.VALIDATION_ERROR, "NO_WALK_IN_SLOT"));
        ensureNoDuplicateBooking(request.patientId(), request.practitionerId(), now.toLocalDate());

        Appointment appointment = newAppointment(session, request.patientId(), request.practitionerId(),
                request.departmentId(), now.toLocalDate(), slot);
        appointment.setPriority(request.priority() != null ? request.priority() : VisitPriority.NORMAL);
        appointment.setBookingSource(BookingSource.WALK_IN);
        appointment.setChiefComplaint(request.chiefComplaint());
        Appointment saved = reserve(appointment);

        Visit visit = openVisit(saved);
        saved.setVisitId(visit.getId());
        queueSyncTrigger.requestSync(session.tenantId(), visit.getId());

        log.debug("Walk-in booked id={} visit={} slot={} token={}",
                saved.getId(), visit.getId(), slot.window(), saved.getTokenNumber());
        audit(session, "APPOINTMENT_WALK_IN", saved, Map.of("visitId", visit.getId()));
        return BookingResponse.from(saved);
    }

    /**
     * Moves a booking to a new slot in one transaction: the old row becomes RESCHEDULED and a
     * BOOKED successor points back at it. A conflict on the new slot rolls back both.
     */
    public BookingResponse reschedule(SessionContext session, UUID appointmentId,
                                      RescheduleAppointmentRequest request) {
        Appointment original = lockAppointment(appointmentId);
        accessGuard.require(session, Permission.APPOINTMENT_EDIT, original);
        if (!original.getStatus().canTransitionTo(AppointmentStatus.RESCHEDULED) || original.getVisitId() != null) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "Appointment cannot be rescheduled from " + original.getStatus());
        }
        if (request.newDate().isBefore(clinicCalendar.today())) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "DATE_IN_PAST");
        }
        UUID practitionerId = request.newPractitionerId() != null
                ? request.newPractitionerId()
                : original.getPractitionerId();
        if (practitionerId.equals(original.getPractitionerId())
                && request.newDate().equals(original.getAppointmentDate())
                && request.newTime().equals(original.getAppointmentTime())) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "SAME_SLOT");
        }
        ensurePractitionerInDepartment(practitionerId, original.getDepartmentId());

        original.transitionTo(AppointmentStatus.RESCHEDULED);
        appointmentRepository.flush();

        Slot slot = availabilityService.validateSlotBooking(session.tenantId(), practitionerId,
                original.getDepartmentId(), request.newDate(), request.newTime(), false);
        ensureNoDuplicateBooking(original.getPatientId(), practitionerId, request.newDate());

        Appointment successor = newAppointment(session, original.getPatientId(), practitionerId,
                original.getDepartmentId(), request.newDate(), slot);
        successor.setPriority(original.getPriority());
        successor.setBookingSource(original.getBookingSource());
        successor.setChiefComplaint(original.getChiefComplaint());
        successor.setRescheduledFromId(original.getId());
        Appointment saved = reserve(successor);

        log.debug("Appointment rescheduled from={} to={} slot={} {}",
                original.getId(), saved.getId(), saved.getAppointmentDate(), slot.window());
        audit(session, "APPOINTMENT_RESCHEDULE", original, Map.of("successorId", saved.getId()));
        audit(session, "APPOINTMENT_CREATE", saved, Map.of("rescheduledFromId", original.getId()));
        return BookingResponse.from(saved);
    }

    public BookingResponse cancel(SessionContext session, UUID appointmentId, CancelAppointmentRequest request) {
        Appointment appointment = lockAppointment(appointmentId);
        accessGuard.require(session, Permission.APPOINTMENT_EDIT, appointment);
        rejectIfSuperseded(appointment, "cancel its successor instead");
        OffsetDateTime now = now();
        appointment.cancel(request != null ? request.reason() : null, now);
        closeLinkedVisit(appointment, now);
        log.debug("Appointment cancelled id={}", appointment.getId());
        Map<String, Object> detail = new LinkedHashMap<>();
        if (appointment.getCancelReason() != null) {
            detail.put("reason", appointment.getCancelReason());
        }
        audit(session, "APPOINTMENT_CANCEL", appointment, detail);
        return BookingResponse.from(appointment);
    }

    public BookingResponse confirm(SessionContext session, UUID appointmentId) {
        Appointment appointment = lockAppointment(appointmentId);
        accessGuard.require(session, Permission.APPOINTMENT_EDIT, appointment);
        appointment.transitionTo(AppointmentStatus.CONFIRMED);
        log.debug("Appointment confirmed id={}", appointment.getId());
        audit(session, "APPOINTMENT_CONFIRM", appointment, null);
        return BookingResponse.from(appointment);
    }

    public BookingResponse markNoShow(SessionContext session, UUID appointmentId) {
        Appointment appointment = lockAppointment(appointmentId);
        accessGuard.require(session, Permission.APPOINTMENT_EDIT, appointment);
        appointment.transitionTo(AppointmentStatus.NO_SHOW);
        closeLinkedVisit(appointment, now());
        log.debug("Appointment marked no-show id={}", appointment.getId());
        audit(session, "APPOINTMENT_NO_SHOW", appointment, null);
        return BookingResponse.from(appointment);
    }

    /**
     * Opens the OPD visit for a booked appointment. A RESCHEDULED row that already has a successor
     * is rejected so the same booking cannot be checked in twice.
     */
    public CheckInResponse checkIn(SessionContext session, UUID appointmentId) {
        Appointment appointment = lockAppointment(appointmentId);
        accessGuard.require(session, Permission.APPOINTMENT_EDIT, appointment);
        if (appointment.getVisitId() != null) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION, "Appointment already has an open visit");
        }
        rejectIfSuperseded(appointment, "check in its successor instead");
        if (!appointment.getStatus().canTransitionTo(AppointmentStatus.CHECKED_IN)) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "Appointment cannot be checked in from " + appointment.getStatus());
        }

        Visit visit = openVisit(appointment);
        appointment.checkIn(visit.getId(), visit.getCheckInTime());
        queueSyncTrigger.requestSync(session.tenantId(), visit.getId());

        log.debug("Appointment checked in id={} visit={} token={}",
                appointment.getId(), visit.getId(), appointment.getTokenNumber());
        audit(session, "APPOINTMENT_CHECK_IN", appointment, Map.of("visitId", visit.getId()));
        return new CheckInResponse(appointment.getId(), visit.getId(), appointment.getTokenNumber(),
                appointment.getStatus(), appointment.getCheckedInAt());
    }

    /**
     * A RESCHEDULED row with a successor is closed; only the successor carries the booking on.
     */
    private void rejectIfSuperseded(Appointment appointment, String hint) {
        if (appointment.getStatus() == AppointmentStatus.RESCHEDULED
                && appointmentRepository.existsByRescheduledFromId(appointment.getId())) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "Appointment was rescheduled; " + hint);
        }
    }

    private Appointment newAppointment(SessionContext session, UUID patientId, UUID practitionerId,
                                       UUID departmentId, LocalDate date, Slot slot) {
        Appointment appointment = new Appointment();
        appointment.setTenantId(session.tenantId());
        appointment.setPatientId(patientId);
        appointment.setPractitionerId(practitionerId);
        appointment.setDepartmentId(departmentId);
        appointment.setAppointmentDate(date);
        appointment.setAppointmentTime(slot.start());
        appointment.setSlotEndTime(slot.end());
        return appointment;
    }

    /**
     * Inserts the booking. The partial unique index on the active slot is the only arbiter of
     * concurrent requests for the same slot.
     */
    private Appointment reserve(Appointment appointment) {
        appointment.setTokenNumber(tokenAllocator.next(appointment.getTenantId(), appointment.getDepartmentId(),
                appointment.getAppointmentDate()));
        try {
            return appointmentRepository.saveAndFlush(appointment);
        } catch (DataIntegrityViolationException ex) {
            if (isActiveSlotViolation(ex)) {
                throw new ProblemException(ErrorCode.SLOT_CONFLICT,
                        "Slot " + appointment.getAppointmentDate() + " " + appointment.getAppointmentTime()
                                + " was booked by another request");
            }
            throw ex;
        }
    }

    private Visit openVisit(Appointment appointment) {
        Visit visit = new Visit();
        visit.setTenantId(appointment.getTenantId());
        visit.setPatientId(appointment.getPatientId());
        visit.setPractitionerId(appointment.getPractitionerId());
        visit.setDepartmentId(appointment.getDepartmentId());
        visit.setAppointmentId(appointment.getId());
        visit.setVisitType(VisitType.OPD);
        visit.setStatus(VisitStatus.WAITING);
        visit.setPriority(appointment.getPriority());
        visit.setTokenNumber(appointment.getTokenNumber());
        visit.setCheckInTime(now());
        return visitRepository.saveAndFlush(visit);
    }

    private void closeLinkedVisit(Appointment appointment, OffsetDateTime now) {
        if (appointment.getVisitId() == null) {
            return;
        }
        visitRepository.findByIdForUpdate(appointment.getVisitId())
                .filter(visit -> visit.getStatus().isActive())
                .ifPresent(visit -> {
                    visit.cancel(now);
                    queueSyncTrigger.requestSync(visit.getTenantId(), visit.getId());
                });
    }

    private Appointment lockAppointment(UUID appointmentId) {
        return appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "APPOINTMENT_NOT_FOUND"));
    }

    private void ensurePatientExists(UUID tenantId, UUID patientId) {
        patientRepository.findByIdAndTenantId(patientId, tenantId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "PATIENT_NOT_FOUND"));
    }

    private void ensurePractitionerInDepartment(UUID practitionerId, UUID departmentId) {
        if (!practitionerDepartmentRepository.existsByPractitionerIdAndDepartmentIdAndActiveTrue(
                practitionerId, departmentId)) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "PRACTITIONER_NOT_IN_DEPARTMENT");
        }
    }

    private void ensureNoDuplicateBooking(UUID patientId, UUID practitionerId, LocalDate date) {
        if (appointmentRepository.existsByPatientIdAndPractitionerIdAndAppointmentDateAndStatusIn(
                patientId, practitionerId, date, AppointmentStatus.slotHolding())) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "PATIENT_ALREADY_BOOKED");
        }
    }

    private boolean isActiveSlotViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(AppointmentRepository.ACTIVE_SLOT_CONSTRAINT);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private void audit(SessionContext session, String action, Appointment appointment, Map<String, Object> extra) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", appointment.getStatus().name());
        detail.put("practitionerId", appointment.getPractitionerId());
        detail.put("appointmentDate", Objects.toString(appointment.getAppointmentDate()));
        detail.put("appointmentTime", Objects.toString(appointment.getAppointmentTime()));
        if (extra != null) {
            detail.putAll(extra);
        }
        auditLogService.recordAfterCommit(AuditLogCommand.of(session.tenantId(), action, RESOURCE_TYPE,
                appointment.getId(), session.userId(), detail));
    }
}
