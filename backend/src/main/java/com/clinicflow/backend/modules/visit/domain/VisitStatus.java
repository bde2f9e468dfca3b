package com.clinicflow.backend.modules.visit.domain;

public enum VisitStatus {
    WAITING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isActive() {
        return this == WAITING || this == IN_PROGRESS;
    }
}
