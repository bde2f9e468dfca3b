package com.clinicflow.backend.modules.queue.domain;

public enum SyncOutcome {
    UPSERTED,
    UNCHANGED,
    REMOVED,
    NOT_QUEUED
}
