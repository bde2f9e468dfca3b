package com.clinicflow.backend.modules.visit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.modules.access.application.AccessGuard;
import com.clinicflow.backend.modules.access.domain.Permission;
import com.clinicflow.backend.modules.access.domain.SessionContext;
import com.clinicflow.backend.modules.appointment.domain.Appointment;
import com.clinicflow.backend.modules.appointment.domain.AppointmentStatus;
import com.clinicflow.backend.modules.appointment.infrastructure.persistence.AppointmentRepository;
import com.clinicflow.backend.modules.audit.application.AuditLogService;
import com.clinicflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.clinicflow.backend.modules.master.infrastructure.persistence.PractitionerRepository;
import com.clinicflow.backend.modules.queue.application.QueueSyncTrigger;
import com.clinicflow.backend.modules.visit.domain.Visit;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;
import com.clinicflow.backend.modules.visit.domain.VisitScope;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;
import com.clinicflow.backend.modules.visit.infrastructure.persistence.VisitRepository;
import com.clinicflow.backend.modules.visit.presentation.dto.VisitResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Consultation lifecycle of an OPD visit. Lock order is always practitioner row, then appointment
 * row, then visit row, the same appointment-before-visit order booking uses.
 */
@Service
@Transactional
public class ConsultationService {

    private static final Logger log = LoggerFactory.getLogger(ConsultationService.class);
    private static final String RESOURCE_TYPE = "VISIT";

    private final VisitRepository visitRepository;
    private final AppointmentRepository appointmentRepository;
    private final PractitionerRepository practitionerRepository;
    private final AccessGuard accessGuard;
    private final QueueSyncTrigger queueSyncTrigger;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ConsultationService(
            VisitRepository visitRepository,
            AppointmentRepository appointmentRepository,
            PractitionerRepository practitionerRepository,
            AccessGuard accessGuard,
            QueueSyncTrigger queueSyncTrigger,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.visitRepository = visitRepository;
        this.appointmentRepository = appointmentRepository;
        this.practitionerRepository = practitionerRepository;
        this.accessGuard = accessGuard;
        this.queueSyncTrigger = queueSyncTrigger;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Starts the consultation. A practitioner may have only one IN_PROGRESS visit unless
     * {@code force} is set; starting an already started visit is a no-op.
     */
    public VisitResponse startConsultation(SessionContext session, UUID visitId, boolean force) {
        VisitScope scope = loadScope(visitId);
        accessGuard.require(session, Permission.CONSULTATION_EDIT, scope);
        if (scope.practitionerId() == null) {
            throw new ProblemException(ErrorCode.VALIDATION_ERROR, "VISIT_HAS_NO_PRACTITIONER");
        }

        practitionerRepository.findByIdForUpdate(scope.practitionerId())
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "PRACTITIONER_NOT_FOUND"));
        Appointment appointment = lockLinkedAppointment(scope);
        Visit visit = lockVisit(visitId);
        if (visit.getStatus() == VisitStatus.IN_PROGRESS) {
            return VisitResponse.from(visit);
        }
        if (visit.getStatus() != VisitStatus.WAITING) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "Visit cannot be started from " + visit.getStatus());
        }

        List<Visit> others = visitRepository.findOtherInProgress(scope.practitionerId(), visitId);
        if (!others.isEmpty() && !force) {
            UUID inProgressVisitId = others.get(0).getId();
            throw new ProblemException(ErrorCode.HAS_IN_PROGRESS,
                    "Practitioner already has visit " + inProgressVisitId + " in progress",
                    Map.of("inProgressVisitId", inProgressVisitId));
        }

        if (appointment != null) {
            AppointmentStatus status = appointment.getStatus();
            if (status != AppointmentStatus.CHECKED_IN && status != AppointmentStatus.BOOKED) {
                throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                        "Appointment cannot start from " + status);
            }
            appointment.transitionTo(AppointmentStatus.IN_PROGRESS);
        }

        visit.start(now());
        queueSyncTrigger.requestSync(visit.getTenantId(), visit.getId());
        if (!others.isEmpty()) {
            log.info("Consultation force-started visit={} practitioner={} alongside={}",
                    visitId, scope.practitionerId(), others.get(0).getId());
        } else {
            log.debug("Consultation started visit={} practitioner={}", visitId, scope.practitionerId());
        }
        audit(session, "CONSULTATION_START", visit, force && !others.isEmpty());
        return VisitResponse.from(visit);
    }

    public VisitResponse complete(SessionContext session, UUID visitId) {
        VisitScope scope = loadScope(visitId);
        accessGuard.require(session, Permission.CONSULTATION_EDIT, scope);

        Appointment appointment = lockLinkedAppointment(scope);
        Visit visit = lockVisit(visitId);
        if (visit.getStatus() != VisitStatus.IN_PROGRESS) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "Visit cannot be completed from " + visit.getStatus());
        }
        if (appointment != null) {
            appointment.transitionTo(AppointmentStatus.COMPLETED);
        }
        visit.complete(now());
        queueSyncTrigger.requestSync(visit.getTenantId(), visit.getId());
        log.debug("Consultation completed visit={}", visitId);
        audit(session, "CONSULTATION_COMPLETE", visit, false);
        return VisitResponse.from(visit);
    }

    public VisitResponse updatePriority(SessionContext session, UUID visitId, VisitPriority priority) {
        VisitScope scope = loadScope(visitId);
        accessGuard.require(session, Permission.VISIT_EDIT, scope);

        Visit visit = lockVisit(visitId);
        if (!visit.getStatus().isActive()) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "Priority of a " + visit.getStatus() + " visit cannot change");
        }
        if (visit.getPriority() == priority) {
            return VisitResponse.from(visit);
        }
        VisitPriority previous = visit.getPriority();
        visit.setPriority(priority);
        queueSyncTrigger.requestSync(visit.getTenantId(), visit.getId());
        log.debug("Visit priority changed visit={} from={} to={}", visitId, previous, priority);
        auditLogService.recordAfterCommit(AuditLogCommand.of(session.tenantId(), "VISIT_PRIORITY", RESOURCE_TYPE,
                visit.getId(), session.userId(), Map.of("from", previous.name(), "to", priority.name())));
        return VisitResponse.from(visit);
    }

    private VisitScope loadScope(UUID visitId) {
        return visitRepository.findScopeById(visitId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "VISIT_NOT_FOUND"));
    }

    private Visit lockVisit(UUID visitId) {
        return visitRepository.findByIdForUpdate(visitId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_FOUND, "VISIT_NOT_FOUND"));
    }

    private Appointment lockLinkedAppointment(VisitScope scope) {
        if (scope.appointmentId() == null) {
            return null;
        }
        return appointmentRepository.findByIdForUpdate(scope.appointmentId()).orElse(null);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private void audit(SessionContext session, String action, Visit visit, boolean forced) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", visit.getStatus().name());
        detail.put("practitionerId", visit.getPractitionerId());
        if (forced) {
            detail.put("forced", true);
        }
        auditLogService.recordAfterCommit(AuditLogCommand.of(session.tenantId(), action, RESOURCE_TYPE,
                visit.getId(), session.userId(), detail));
    }
}
