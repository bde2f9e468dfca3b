package com.clinicflow.backend.modules.appointment.presentation.dto;

import java.util.List;

public record AppointmentListResponse(
        List<AppointmentResponse> items,
        String nextCursor,
        boolean hasMore
) {
}
