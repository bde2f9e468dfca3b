package com.clinicflow.backend.modules.queue.presentation.dto;

public record QueueCountsResponse(long waiting, long inProgress, long total) {
}
