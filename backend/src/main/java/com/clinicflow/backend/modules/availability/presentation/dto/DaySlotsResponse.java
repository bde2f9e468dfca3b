package com.clinicflow.backend.modules.availability.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record DaySlotsResponse(
        UUID practitionerId,
        LocalDate date,
        int availableCount,
        List<SlotResponse> slots
) {
}
