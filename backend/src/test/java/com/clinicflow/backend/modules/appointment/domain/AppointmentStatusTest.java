package com.clinicflow.backend.modules.appointment.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.clinicflow.backend.global.error.ProblemException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AppointmentStatusTest {

    @Test
    @DisplayName("terminal statuses allow no further transition")
    void terminalStatuses() {
        for (AppointmentStatus status : List.of(
                AppointmentStatus.COMPLETED, AppointmentStatus.CANCELLED, AppointmentStatus.NO_SHOW)) {
            assertThat(status.isTerminal()).isTrue();
            for (AppointmentStatus target : AppointmentStatus.values()) {
                assertThat(status.canTransitionTo(target)).isFalse();
            }
        }
        assertThat(AppointmentStatus.RESCHEDULED.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("slot-holding statuses mirror the partial unique index")
    void slotHoldingStatuses() {
        assertThat(AppointmentStatus.slotHolding()).containsExactlyInAnyOrder(
                AppointmentStatus.BOOKED,
                AppointmentStatus.CONFIRMED,
                AppointmentStatus.CHECKED_IN,
                AppointmentStatus.IN_PROGRESS,
                AppointmentStatus.COMPLETED);
        assertThat(AppointmentStatus.RESCHEDULED.holdsSlot()).isFalse();
        assertThat(AppointmentStatus.COMPLETED.holdsSlot()).isTrue();
    }

    @Test
    @DisplayName("booked appointments can be confirmed, checked in, cancelled or rescheduled")
    void bookedTransitions() {
        assertThat(AppointmentStatus.BOOKED.canTransitionTo(AppointmentStatus.CONFIRMED)).isTrue();
        assertThat(AppointmentStatus.BOOKED.canTransitionTo(AppointmentStatus.CHECKED_IN)).isTrue();
        assertThat(AppointmentStatus.BOOKED.canTransitionTo(AppointmentStatus.RESCHEDULED)).isTrue();
        assertThat(AppointmentStatus.BOOKED.canTransitionTo(AppointmentStatus.COMPLETED)).isFalse();
        assertThat(AppointmentStatus.CHECKED_IN.canTransitionTo(AppointmentStatus.RESCHEDULED)).isFalse();
        assertThat(AppointmentStatus.RESCHEDULED.canTransitionTo(AppointmentStatus.CHECKED_IN)).isTrue();
    }

    @Test
    @DisplayName("an illegal move throws INVALID_TRANSITION and leaves the status untouched")
    void illegalTransitionThrows() {
        Appointment appointment = new Appointment();
        appointment.cancel("patient request", OffsetDateTime.parse("2025-03-01T08:00:00Z"));

        assertThatThrownBy(() -> appointment.checkIn(UUID.randomUUID(), OffsetDateTime.parse("2025-03-01T09:00:00Z")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("INVALID_TRANSITION");
        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(appointment.getVisitId()).isNull();
        assertThat(appointment.getCancelReason()).isEqualTo("patient request");
    }
}
