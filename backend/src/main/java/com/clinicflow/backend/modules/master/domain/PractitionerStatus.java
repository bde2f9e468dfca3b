package com.clinicflow.backend.modules.master.domain;

public enum PractitionerStatus {
    ACTIVE,
    ON_LEAVE,
    INACTIVE;

    public boolean isSchedulable() {
        return this == ACTIVE;
    }
}
