package com.clinicflow.backend.modules.queue.presentation.dto;

public record RebuildResponse(int upserted, int removed, int failed) {
}
