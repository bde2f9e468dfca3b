package com.clinicflow.backend.modules.appointment.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Appointment lifecycle. COMPLETED, CANCELLED and NO_SHOW are terminal. RESCHEDULED releases
 * the slot; only rows rescheduled in place (no successor) may still be checked in or cancelled.
 */
public enum AppointmentStatus {
    BOOKED,
    CONFIRMED,
    CHECKED_IN,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW,
    RESCHEDULED;

    private static final Map<AppointmentStatus, Set<AppointmentStatus>> ALLOWED = Map.of(
            BOOKED, EnumSet.of(CONFIRMED, CHECKED_IN, IN_PROGRESS, CANCELLED, NO_SHOW, RESCHEDULED),
            CONFIRMED, EnumSet.of(CHECKED_IN, CANCELLED, NO_SHOW, RESCHEDULED),
            CHECKED_IN, EnumSet.of(IN_PROGRESS, CANCELLED),
            IN_PROGRESS, EnumSet.of(COMPLETED, CANCELLED),
            RESCHEDULED, EnumSet.of(CHECKED_IN, CANCELLED),
            COMPLETED, EnumSet.noneOf(AppointmentStatus.class),
            CANCELLED, EnumSet.noneOf(AppointmentStatus.class),
            NO_SHOW, EnumSet.noneOf(AppointmentStatus.class)
    );

    /** Statuses that no longer occupy the practitioner's slot. Mirrors the partial unique index. */
    public static final Set<AppointmentStatus> SLOT_RELEASING =
            Collections.unmodifiableSet(EnumSet.of(CANCELLED, RESCHEDULED, NO_SHOW));

    public boolean canTransitionTo(AppointmentStatus target) {
        return ALLOWED.get(this).contains(target);
    }

    public boolean isTerminal() {
        return ALLOWED.get(this).isEmpty();
    }

    public boolean holdsSlot() {
        return !SLOT_RELEASING.contains(this);
    }

    public static Set<AppointmentStatus> slotHolding() {
        return EnumSet.complementOf(EnumSet.copyOf(SLOT_RELEASING));
    }
}
