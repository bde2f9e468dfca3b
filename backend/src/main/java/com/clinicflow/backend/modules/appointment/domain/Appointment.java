package com.clinicflow.backend.modules.appointment.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.clinicflow.backend.global.jpa.AbstractTimestampedEntity;
import com.clinicflow.backend.modules.access.domain.DepartmentScoped;
import com.clinicflow.backend.modules.visit.domain.VisitPriority;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;
import org.springframework.data.annotation.CreatedBy;
import org.springframework.data.annotation.LastModifiedBy;

@Entity
@Table(name = "appointment")
public class Appointment extends AbstractTimestampedEntity implements DepartmentScoped {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "patient_id", nullable = false, columnDefinition = "uuid")
    private UUID patientId;

    @Column(name = "practitioner_id", nullable = false, columnDefinition = "uuid")
    private UUID practitionerId;

    @Column(name = "department_id", nullable = false, columnDefinition = "uuid")
    private UUID departmentId;

    @Column(name = "appointment_date", nullable = false)
    private LocalDate appointmentDate;

    @Column(name = "appointment_time", nullable = false)
    private LocalTime appointmentTime;

    @Column(name = "slot_end_time", nullable = false)
    private LocalTime slotEndTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AppointmentStatus status = AppointmentStatus.BOOKED;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private VisitPriority priority = VisitPriority.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "booking_source", nullable = false, length = 16)
    private BookingSource bookingSource = BookingSource.RECEPTION;

    @Column(name = "token_number", nullable = false)
    private int tokenNumber;

    @Column(name = "chief_complaint", length = 500)
    private String chiefComplaint;

    @Column(name = "cancel_reason", length = 500)
    private String cancelReason;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "checked_in_at")
    private OffsetDateTime checkedInAt;

    @Column(name = "rescheduled_from_id", columnDefinition = "uuid")
    private UUID rescheduledFromId;

    @Column(name = "visit_id", columnDefinition = "uuid")
    private UUID visitId;

    @CreatedBy
    @Column(name = "created_by", updatable = false, columnDefinition = "uuid")
    private UUID createdBy;

    @LastModifiedBy
    @Column(name = "updated_by", columnDefinition = "uuid")
    private UUID updatedBy;

    public void transitionTo(AppointmentStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new ProblemException(ErrorCode.INVALID_TRANSITION,
                    "Appointment cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    public void cancel(String reason, OffsetDateTime now) {
        transitionTo(AppointmentStatus.CANCELLED);
        this.cancelReason = reason;
        this.cancelledAt = now;
    }

    public void checkIn(UUID visitId, OffsetDateTime now) {
        transitionTo(AppointmentStatus.CHECKED_IN);
        this.visitId = visitId;
        this.checkedInAt = now;
    }

    public UUID getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public UUID getPatientId() {
        return patientId;
    }

    public void setPatientId(UUID patientId) {
        this.patientId = patientId;
    }

    public UUID getPractitionerId() {
        return practitionerId;
    }

    public void setPractitionerId(UUID practitionerId) {
        this.practitionerId = practitionerId;
    }

    @Override
    public UUID getDepartmentId() {
        return departmentId;
    }

    public void setDepartmentId(UUID departmentId) {
        this.departmentId = departmentId;
    }

    public LocalDate getAppointmentDate() {
        return appointmentDate;
    }

    public void setAppointmentDate(LocalDate appointmentDate) {
        this.appointmentDate = appointmentDate;
    }

    public LocalTime getAppointmentTime() {
        return appointmentTime;
    }

    public void setAppointmentTime(LocalTime appointmentTime) {
        this.appointmentTime = appointmentTime;
    }

    public LocalTime getSlotEndTime() {
        return slotEndTime;
    }

    public void setSlotEndTime(LocalTime slotEndTime) {
        this.slotEndTime = slotEndTime;
    }

    public AppointmentStatus getStatus() {
        return status;
    }

    public VisitPriority getPriority() {
        return priority;
    }

    public void setPriority(VisitPriority priority) {
        this.priority = priority;
    }

    public BookingSource getBookingSource() {
        return bookingSource;
    }

    public void setBookingSource(BookingSource bookingSource) {
        this.bookingSource = bookingSource;
    }

    public int getTokenNumber() {
        return tokenNumber;
    }

    public void setTokenNumber(int tokenNumber) {
        this.tokenNumber = tokenNumber;
    }

    public String getChiefComplaint() {
        return chiefComplaint;
    }

    public void setChiefComplaint(String chiefComplaint) {
        this.chiefComplaint = chiefComplaint;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public OffsetDateTime getCheckedInAt() {
        return checkedInAt;
    }

    public UUID getRescheduledFromId() {
        return rescheduledFromId;
    }

    public void setRescheduledFromId(UUID rescheduledFromId) {
        this.rescheduledFromId = rescheduledFromId;
    }

    public UUID getVisitId() {
        return visitId;
    }

    public void setVisitId(UUID visitId) {
        this.visitId = visitId;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public UUID getUpdatedBy() {
        return updatedBy;
    }
}
