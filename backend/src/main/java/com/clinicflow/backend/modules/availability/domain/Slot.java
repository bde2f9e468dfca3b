package com.clinicflow.backend.modules.availability.domain;

import java.time.LocalTime;
import java.util.UUID;

public record Slot(
        LocalTime start,
        LocalTime end,
        UUID templateId,
        UUID departmentId,
        boolean walkInAllowed,
        SlotUnavailableReason unavailableReason
) {

    public boolean available() {
        return unavailableReason == null;
    }

    public TimeWindow window() {
        return new TimeWindow(start, end);
    }
}
