package com.clinicflow.backend.global.common;

/**
 * Lifecycle flag shared by master data rows and availability templates.
 */
public enum ResourceStatus {
    ACTIVE,
    INACTIVE;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
