package com.clinicflow.backend.modules.queue.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import com.clinicflow.backend.global.jpa.AbstractTimestampedEntity;
import com.clinicflow.backend.modules.access.domain.DepartmentScoped;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;
import com.clinicflow.backend.modules.visit.domain.VisitStatus;
import com.clinicflow.backend.modules.visit.domain.VisitType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Denormalized queue row, one per active OPD visit. Written only by {@code OpdQueueSynchronizer}.
 */
@Entity
@Table(name = "opd_queue_snapshot")
public class OpdQueueSnapshot extends AbstractTimestampedEntity implements DepartmentScoped {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "visit_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID visitId;

    @Column(name = "patient_id", nullable = false, columnDefinition = "uuid")
    private UUID patientId;

    @Column(name = "patient_name", nullable = false, length = 200)
    private String patientName;

    @Column(name = "patient_mrn", length = 32)
    private String patientMrn;

    @Column(name = "patient_phone", length = 32)
    private String patientPhone;

    @Column(name = "patient_gender", length = 16)
    private String patientGender;

    @Column(name = "patient_date_of_birth")
    private LocalDate patientDateOfBirth;

    @Column(name = "practitioner_id", columnDefinition = "uuid")
    private UUID practitionerId;

    @Column(name = "practitioner_name", length = 160)
    private String practitionerName;

    @Column(name = "department_id", nullable = false, columnDefinition = "uuid")
    private UUID departmentId;

    @Column(name = "department_name", length = 120)
    private String departmentName;

    @Column(name = "token_number")
    private Integer tokenNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private VisitPriority priority;

    @Column(name = "priority_rank", nullable = false)
    private int priorityRank;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private VisitStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "visit_type", nullable = false, length = 16)
    private VisitType visitType;

    @Column(name = "check_in_time", nullable = false)
    private OffsetDateTime checkInTime;

    @Column(name = "start_time")
    private OffsetDateTime startTime;

    @Column(name = "synced_at", nullable = false)
    private OffsetDateTime syncedAt;

    protected OpdQueueSnapshot() {
    }

    public OpdQueueSnapshot(UUID visitId) {
        this.visitId = visitId;
    }

    public UUID getId() {
        return id;
    }

    public Projection projection() {
        return new Projection(tenantId, patientId, patientName, patientMrn, patientPhone, patientGender,
                patientDateOfBirth, practitionerId, practitionerName, departmentId, departmentName,
                tokenNumber, priority, status, visitType, checkInTime, startTime);
    }

    /**
     * Copies every projected column and stamps {@code synced_at}. Callers skip this when
     * {@link #projection()} already equals the incoming projection so an unchanged visit leaves
     * the row untouched.
     */
    public void apply(Projection projection, OffsetDateTime syncedAt) {
        this.tenantId = projection.tenantId();
        this.patientId = projection.patientId();
        this.patientName = projection.patientName();
        this.patientMrn = projection.patientMrn();
        this.patientPhone = projection.patientPhone();
        this.patientGender = projection.patientGender();
        this.patientDateOfBirth = projection.patientDateOfBirth();
        this.practitionerId = projection.practitionerId();
        this.practitionerName = projection.practitionerName();
        this.departmentId = projection.departmentId();
        this.departmentName = projection.departmentName();
        this.tokenNumber = projection.tokenNumber();
        setPriority(projection.priority());
        this.status = projection.status();
        this.visitType = projection.visitType();
        this.checkInTime = projection.checkInTime();
        this.startTime = projection.startTime();
        this.syncedAt = syncedAt;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public UUID getVisitId() {
        return visitId;
    }

    public UUID getPatientId() {
        return patientId;
    }

    public void setPatientId(UUID patientId) {
        this.patientId = patientId;
    }

    public String getPatientName() {
        return patientName;
    }

    public void setPatientName(String patientName) {
        this.patientName = patientName;
    }

    public String getPatientMrn() {
        return patientMrn;
    }

    public void setPatientMrn(String patientMrn) {
        this.patientMrn = patientMrn;
    }

    public String getPatientPhone() {
        return patientPhone;
    }

    public void setPatientPhone(String patientPhone) {
        this.patientPhone = patientPhone;
    }

    public String getPatientGender() {
        return patientGender;
    }

    public void setPatientGender(String patientGender) {
        this.patientGender = patientGender;
    }

    public LocalDate getPatientDateOfBirth() {
        return patientDateOfBirth;
    }

    public void setPatientDateOfBirth(LocalDate patientDateOfBirth) {
        this.patientDateOfBirth = patientDateOfBirth;
    }

    public UUID getPractitionerId() {
        return practitionerId;
    }

    public void setPractitionerId(UUID practitionerId) {
        this.practitionerId = practitionerId;
    }

    public String getPractitionerName() {
        return practitionerName;
    }

    public void setPractitionerName(String practitionerName) {
        this.practitionerName = practitionerName;
    }

    @Override
    public UUID getDepartmentId() {
        return departmentId;
    }

    public void setDepartmentId(UUID departmentId) {
        this.departmentId = departmentId;
    }

    public String getDepartmentName() {
        return departmentName;
    }

    public void setDepartmentName(String departmentName) {
        this.departmentName = departmentName;
    }

    public Integer getTokenNumber() {
        return tokenNumber;
    }

    public void setTokenNumber(Integer tokenNumber) {
        this.tokenNumber = tokenNumber;
    }

    public VisitPriority getPriority() {
        return priority;
    }

    public void setPriority(VisitPriority priority) {
        this.priority = priority;
        this.priorityRank = priority.rank();
    }

    public int getPriorityRank() {
        return priorityRank;
    }

    public VisitStatus getStatus() {
        return status;
    }

    public void setStatus(VisitStatus status) {
        this.status = status;
    }

    public VisitType getVisitType() {
        return visitType;
    }

    public void setVisitType(VisitType visitType) {
        this.visitType = visitType;
    }

    public OffsetDateTime getCheckInTime() {
        return checkInTime;
    }

    public void setCheckInTime(OffsetDateTime checkInTime) {
        this.checkInTime = checkInTime;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public void setStartTime(OffsetDateTime startTime) {
        this.startTime = startTime;
    }

    public OffsetDateTime getSyncedAt() {
        return syncedAt;
    }

    /**
     * The visit-derived content of a queue row. Timestamps are normalized to UTC microseconds so
     * values read back from PostgreSQL compare equal to freshly projected ones.
     */
    public record Projection(
            UUID tenantId,
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
            Integer tokenNumber,
            VisitPriority priority,
            VisitStatus status,
            VisitType visitType,
            OffsetDateTime checkInTime,
            OffsetDateTime startTime
    ) {
        public Projection {
            checkInTime = normalize(checkInTime);
            startTime = normalize(startTime);
        }

        private static OffsetDateTime normalize(OffsetDateTime value) {
            return value == null
                    ? null
                    : value.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
        }
    }
}
