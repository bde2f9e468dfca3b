package com.clinicflow.backend.global.common.time;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Wall-clock view of the shared clock in the clinic's own time zone. Availability templates and
 * appointment dates are local times, so "today" and "now" for booking decisions come from here;
 * stored instants keep using the UTC clock.
 */
public final class ClinicCalendar {

    private final Clock clinicClock;

    public ClinicCalendar(Clock clock, ZoneId zone) {
        this.clinicClock = clock.withZone(zone);
    }

    public ZoneId zone() {
        return clinicClock.getZone();
    }

    public LocalDate today() {
        return LocalDate.now(clinicClock);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clinicClock);
    }
}
