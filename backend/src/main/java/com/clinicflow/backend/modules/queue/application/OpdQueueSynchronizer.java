package com.clinicflow.backend.modules.queue.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.modules.master.domain.Department;
import com.clinicflow.backend.modules.master.domain.Patient;
import com.clinicflow.backend.modules.master.domain.Practitioner;
import com.clinicflow.backend.modules.master.infrastructure.persistence.DepartmentRepository;
import com.clinicflow.backend.modules.master.infrastructure.persistence.PatientRepository;
import com.clinicflow.backend.modules.master.infrastructure.persistence.PractitionerRepository;
import com.clinicflow.backend.modules.queue.domain.OpdQueueSnapshot;
import com.clinicflow.backend.modules.queue.domain.SyncOutcome;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.OpdQueueSnapshotRepository;
import com.clinicflow.backend.modules.queue.infrastructure.persistence.QueueSyncFailureRepository;
import com.clinicflow.backend.modules.visit.domain.Visit;
import com.clinicflow.backend.modules.visit.infrastructure.persistence.VisitRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Projects one visit onto the queue snapshot table. The visit row is the source of truth:
 * an active OPD visit gets an upserted row, anything else gets its row removed. A row whose
 * projected columns already match the visit is left untouched, {@code synced_at} included.
 */
@Service
public class OpdQueueSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(OpdQueueSynchronizer.class);

    private final VisitRepository visitRepository;
    private final OpdQueueSnapshotRepository snapshotRepository;
    private final QueueSyncFailureRepository failureRepository;
    private final PatientRepository patientRepository;
    private final PractitionerRepository practitionerRepository;
    private final DepartmentRepository departmentRepository;
    private final Clock clock;

    public OpdQueueSynchronizer(
            VisitRepository visitRepository,
            OpdQueueSnapshotRepository snapshotRepository,
            QueueSyncFailureRepository failureRepository,
            PatientRepository patientRepository,
            PractitionerRepository practitionerRepository,
            DepartmentRepository departmentRepository,
            Clock clock
    ) {
        this.visitRepository = visitRepository;
        this.snapshotRepository = snapshotRepository;
        this.failureRepository = failureRepository;
        this.patientRepository = patientRepository;
        this.practitionerRepository = practitionerRepository;
        this.departmentRepository = departmentRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncOutcome syncSnapshot(UUID visitId) {
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        // row lock serializes concurrent syncs of the same visit
        Optional<Visit> visit = visitRepository.findByIdForUpdate(visitId);

        SyncOutcome outcome;
        if (visit.isEmpty() || !visit.get().isQueueEligible()) {
            int removed = snapshotRepository.deleteByVisitId(visitId);
            outcome = removed > 0 ? SyncOutcome.REMOVED : SyncOutcome.NOT_QUEUED;
        } else {
            outcome = upsert(visit.get(), now);
        }
        failureRepository.markResolved(visitId, now);
        log.debug("Queue snapshot synced visit={} outcome={}", visitId, outcome);
        return outcome;
    }

    private SyncOutcome upsert(Visit visit, OffsetDateTime now) {
        OpdQueueSnapshot.Projection projection = project(visit);
        Optional<OpdQueueSnapshot> existing = snapshotRepository.findByVisitId(visit.getId());
        if (existing.isPresent() && existing.get().projection().equals(projection)) {
            return SyncOutcome.UNCHANGED;
        }
        OpdQueueSnapshot snapshot = existing.orElseGet(() -> new OpdQueueSnapshot(visit.getId()));
        snapshot.apply(projection, now);
        snapshotRepository.save(snapshot);
        return SyncOutcome.UPSERTED;
    }

    private OpdQueueSnapshot.Projection project(Visit visit) {
        Patient patient = patientRepository.findById(visit.getPatientId())
                .orElseThrow(() -> new IllegalStateException("Patient missing for visit " + visit.getId()));
        String practitionerName = visit.getPractitionerId() == null
                ? null
                : practitionerRepository.findById(visit.getPractitionerId())
                        .map(Practitioner::getFullName)
                        .orElse(null);
        String departmentName = departmentRepository.findById(visit.getDepartmentId())
                .map(Department::getName)
                .orElse(null);

        return new OpdQueueSnapshot.Projection(
                visit.getTenantId(),
                patient.getId(),
                patient.getDisplayName(),
                patient.getMrn(),
                patient.getPhone(),
                patient.getGender(),
                patient.getDateOfBirth(),
                visit.getPractitionerId(),
                practitionerName,
                visit.getDepartmentId(),
                departmentName,
                visit.getTokenNumber(),
                visit.getPriority(),
                visit.getStatus(),
                visit.getVisitType(),
                visit.getCheckInTime(),
                visit.getStartTime()
        );
    }
}
