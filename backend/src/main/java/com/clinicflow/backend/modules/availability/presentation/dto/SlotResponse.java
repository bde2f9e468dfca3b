package com.clinicflow.backend.modules.availability.presentation.dto;

import java.time.LocalTime;
import java.util.UUID;

import com.clinicflow.backend.modules.availability.domain.Slot;
import com.clinicflow.backend.modules.availability.domain.SlotUnavailableReason;

public record SlotResponse(
        LocalTime start,
        LocalTime end,
        boolean available,
        SlotUnavailableReason unavailableReason,
        boolean walkInAllowed,
        UUID departmentId
) {

    public static SlotResponse from(Slot slot) {
        return new SlotResponse(slot.start(), slot.end(), slot.available(), slot.unavailableReason(),
                slot.walkInAllowed(), slot.departmentId());
    }
}
