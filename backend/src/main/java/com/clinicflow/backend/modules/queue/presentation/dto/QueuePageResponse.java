package com.clinicflow.backend.modules.queue.presentation.dto;

import java.util.List;

public record QueuePageResponse(
        List<QueueEntryResponse> items,
        String nextCursor,
        boolean hasMore
) {
}
