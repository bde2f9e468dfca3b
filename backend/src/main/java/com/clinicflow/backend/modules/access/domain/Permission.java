package com.clinicflow.backend.modules.access.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Capabilities granted to a staff session. Token claims use the enum names.
 */
public enum Permission {
    APPOINTMENT_VIEW,
    APPOINTMENT_CREATE,
    APPOINTMENT_EDIT,
    VISIT_VIEW,
    VISIT_EDIT,
    CONSULTATION_EDIT,
    DOCTOR_VIEW,
    DOCTOR_EDIT,
    QUEUE_MANAGE;

    public static Optional<Permission> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('.', '_').replace(':', '_');
        for (Permission permission : values()) {
            if (permission.name().equals(normalized)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
