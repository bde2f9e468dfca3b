package com.clinicflow.backend.modules.appointment.infrastructure.persistence;

import java.util.List;

import com.clinicflow.backend.modules.appointment.domain.Appointment;

public interface AppointmentRepositoryCustom {

    /**
     * Keyset listing ordered by {@code created_at DESC, id DESC}. Returns up to {@code limit + 1} rows.
     */
    List<Appointment> searchAppointments(AppointmentSearchCondition condition);
}
